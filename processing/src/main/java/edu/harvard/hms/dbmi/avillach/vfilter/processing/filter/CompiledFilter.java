package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import java.util.List;

/**
 * A filter string compiled for one reference genome: the OR of its compiled conjunctions.
 */
public record CompiledFilter(String filterString, List<CompiledConjunction> conjunctions) {

    public CompiledFilter {
        conjunctions = List.copyOf(conjunctions);
    }
}
