package edu.harvard.hms.dbmi.avillach.vfilter.data.storage;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multimaps;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.StorePredicate;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.VariantRecordStore;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A read only variant store over a snapshot held in memory. Predicates are interpreted directly against each record of the
 * requested reference genome.
 */
public class InMemoryVariantStore implements VariantRecordStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVariantStore.class);

    private final ImmutableListMultimap<String, VariantRecord> variantsByReferenceGenome;

    private final ImmutableMap<Long, VariantRecord> variantsById;

    public InMemoryVariantStore(Collection<VariantRecord> variants) {
        this.variantsByReferenceGenome = Multimaps.index(variants, VariantRecord::getReferenceGenomeId);
        // fails on duplicate ids
        this.variantsById = variants.stream().collect(ImmutableMap.toImmutableMap(VariantRecord::getId, variant -> variant));
    }

    @Override
    public List<VariantRecord> query(String referenceGenomeId, List<StorePredicate> predicates) {
        List<VariantRecord> matches = variantsByReferenceGenome.get(referenceGenomeId).stream()
            .filter(variant -> predicates.stream().allMatch(predicate -> predicate.test(variant)))
            .collect(Collectors.toList());
        log.debug("Store query on " + referenceGenomeId + " with " + predicates + " matched " + matches.size() + " variants");
        return matches;
    }

    @Override
    public List<VariantRecord> getVariants(String referenceGenomeId, Collection<Long> variantIds) {
        List<VariantRecord> variants = new ArrayList<>(variantIds.size());
        for (Long variantId : variantIds) {
            VariantRecord variant = variantsById.get(variantId);
            if (variant != null && variant.getReferenceGenomeId().equals(referenceGenomeId)) {
                variants.add(variant);
            }
        }
        return variants;
    }

    public int size() {
        return variantsById.size();
    }
}
