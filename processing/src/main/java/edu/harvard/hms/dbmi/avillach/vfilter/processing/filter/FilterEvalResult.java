package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The variants matching a filter, each with the samples that passed it. Every matching variant has an entry, possibly empty, and
 * nothing else does.
 */
public final class FilterEvalResult {

    private static final FilterEvalResult EMPTY = new FilterEvalResult(ImmutableMap.of());

    private final ImmutableMap<Long, ImmutableSet<String>> passingSampleIds;

    private FilterEvalResult(ImmutableMap<Long, ImmutableSet<String>> passingSampleIds) {
        this.passingSampleIds = passingSampleIds;
    }

    public static FilterEvalResult empty() {
        return EMPTY;
    }

    public static FilterEvalResult of(Map<Long, ? extends Set<String>> passingSampleIds) {
        ImmutableMap.Builder<Long, ImmutableSet<String>> builder = ImmutableMap.builder();
        passingSampleIds.forEach((variantId, sampleIds) -> builder.put(variantId, ImmutableSet.copyOf(sampleIds)));
        return new FilterEvalResult(builder.buildOrThrow());
    }

    public Set<Long> getVariantIds() {
        return passingSampleIds.keySet();
    }

    public Set<String> getPassingSampleIds(long variantId) {
        ImmutableSet<String> sampleIds = passingSampleIds.get(variantId);
        return sampleIds == null ? ImmutableSet.of() : sampleIds;
    }

    public Map<Long, ImmutableSet<String>> getPassingSampleIds() {
        return passingSampleIds;
    }

    public boolean isEmpty() {
        return passingSampleIds.isEmpty();
    }

    public int size() {
        return passingSampleIds.size();
    }

    /**
     * Variants in both results, keeping the samples both sides agree on.
     */
    public FilterEvalResult and(FilterEvalResult other) {
        ImmutableMap.Builder<Long, ImmutableSet<String>> builder = ImmutableMap.builder();
        passingSampleIds.forEach((variantId, sampleIds) -> {
            ImmutableSet<String> otherSampleIds = other.passingSampleIds.get(variantId);
            if (otherSampleIds != null) {
                builder.put(variantId, Sets.intersection(sampleIds, otherSampleIds).immutableCopy());
            }
        });
        return new FilterEvalResult(builder.buildOrThrow());
    }

    /**
     * Variants in either result, with the samples of both sides for variants found by both.
     */
    public FilterEvalResult or(FilterEvalResult other) {
        if (isEmpty()) {
            return other;
        } else if (other.isEmpty()) {
            return this;
        }
        ImmutableMap.Builder<Long, ImmutableSet<String>> builder = ImmutableMap.builder();
        passingSampleIds.forEach((variantId, sampleIds) -> {
            ImmutableSet<String> otherSampleIds = other.passingSampleIds.get(variantId);
            builder.put(variantId, otherSampleIds == null ? sampleIds : Sets.union(sampleIds, otherSampleIds).immutableCopy());
        });
        other.passingSampleIds.forEach((variantId, sampleIds) -> {
            if (!passingSampleIds.containsKey(variantId)) {
                builder.put(variantId, sampleIds);
            }
        });
        return new FilterEvalResult(builder.buildOrThrow());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return passingSampleIds.equals(((FilterEvalResult) o).passingSampleIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(passingSampleIds);
    }

    @Override
    public String toString() {
        return "FilterEvalResult" + passingSampleIds;
    }
}
