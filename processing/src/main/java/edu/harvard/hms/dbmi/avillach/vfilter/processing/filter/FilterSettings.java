package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

/**
 * Limits and switches for filter evaluation.
 *
 * @param maxScopeDepth   how deeply scoped expressions may nest
 * @param maxNestingDepth how many NOTs and parentheses may enclose a condition
 * @param maxConjunctions how many alternatives a filter may expand to in disjunctive normal form
 * @param parallelScopes  evaluate the scoped sub-filters of a conjunction concurrently
 * @param timeoutMillis   default time budget of an evaluation, 0 for none
 */
public record FilterSettings(int maxScopeDepth, int maxNestingDepth, int maxConjunctions, boolean parallelScopes, long timeoutMillis) {

    public static final FilterSettings DEFAULTS = new FilterSettings(8, 256, 1024, true, 0);

    public FilterSettings {
        if (maxScopeDepth < 0 || maxNestingDepth < 1 || maxConjunctions < 1 || timeoutMillis < 0) {
            throw new IllegalArgumentException(
                "Invalid filter settings: maxScopeDepth=" + maxScopeDepth + ", maxNestingDepth=" + maxNestingDepth + ", maxConjunctions=" + maxConjunctions + ", timeoutMillis=" + timeoutMillis
            );
        }
    }
}
