package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import edu.harvard.hms.dbmi.avillach.vfilter.data.query.StorePredicate;

import java.util.List;

/**
 * @param storePredicates  ANDed into a single store query, none means every variant of the reference genome
 * @param catchAllTriples  applied in order to the variants the store returns
 * @param scopedSubFilters evaluated recursively and ANDed with the rest
 */
public record CompiledConjunction(
    List<StorePredicate> storePredicates, List<ConditionTriple> catchAllTriples, List<ScopedSubFilter> scopedSubFilters
) {

    public CompiledConjunction {
        storePredicates = List.copyOf(storePredicates);
        catchAllTriples = List.copyOf(catchAllTriples);
        scopedSubFilters = List.copyOf(scopedSubFilters);
    }
}
