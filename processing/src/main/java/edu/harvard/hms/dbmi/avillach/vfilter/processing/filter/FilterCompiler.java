package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterParseException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses and compiles a filter string, scoped expressions included, before anything is evaluated.
 */
public class FilterCompiler {

    private final ConjunctionCompiler conjunctionCompiler;

    private final FilterSettings settings;

    public FilterCompiler(ConjunctionCompiler conjunctionCompiler, FilterSettings settings) {
        this.conjunctionCompiler = conjunctionCompiler;
        this.settings = settings;
    }

    public CompiledFilter compile(String filterString, String referenceGenomeId) {
        return compile(filterString, referenceGenomeId, 0);
    }

    private CompiledFilter compile(String filterString, String referenceGenomeId, int depth) {
        if (depth > settings.maxScopeDepth()) {
            throw new FilterParseException(filterString, "Scoped expressions are nested more than " + settings.maxScopeDepth() + " levels deep");
        }
        FilterExpression expression = FilterExpression.parse(filterString, settings);

        // the same scoped symbol shows up in several conjunctions after distribution
        Map<String, CompiledFilter> scopedFilters = new HashMap<>();
        List<CompiledConjunction> conjunctions = new ArrayList<>();
        for (Conjunction conjunction : expression.getConjunctions()) {
            conjunctions.add(conjunctionCompiler.compile(
                conjunction, expression.getSymbols(), referenceGenomeId,
                inner -> scopedFilters.computeIfAbsent(inner, key -> compile(key, referenceGenomeId, depth + 1))
            ));
        }
        return new CompiledFilter(expression.getFilterString(), conjunctions);
    }
}
