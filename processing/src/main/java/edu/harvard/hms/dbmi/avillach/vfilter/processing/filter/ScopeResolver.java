package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import com.google.common.collect.Sets;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.SampleScope;

import java.util.Set;

public final class ScopeResolver {

    private ScopeResolver() {
    }

    /**
     * Whether the samples passing a condition for one variant satisfy the scope. Unscoped conditions need at least one passing
     * sample.
     *
     * @param scope null when the condition is unscoped
     */
    public static boolean isSatisfied(Set<String> passingSampleIds, SampleScope scope) {
        if (scope == null) {
            return !passingSampleIds.isEmpty();
        }
        Set<String> scopeSampleIds = scope.sampleIds();
        return switch (scope.scopeType()) {
            case ALL -> passingSampleIds.containsAll(scopeSampleIds);
            case ANY -> !Sets.intersection(passingSampleIds, scopeSampleIds).isEmpty();
            case ONLY -> passingSampleIds.equals(scopeSampleIds);
        };
    }
}
