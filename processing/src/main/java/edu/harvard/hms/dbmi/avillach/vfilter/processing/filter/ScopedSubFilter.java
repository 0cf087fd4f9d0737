package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import edu.harvard.hms.dbmi.avillach.vfilter.data.query.SampleScope;

/**
 * A scoped condition of a conjunction. Its inner expression is evaluated on its own, under the scope, and the result combined with
 * the rest of the conjunction; when negated the result is replaced by every other variant of the reference genome.
 */
public record ScopedSubFilter(CompiledFilter filter, SampleScope scope, boolean negated) {
}
