package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import edu.harvard.hms.dbmi.avillach.vfilter.data.query.ComparisonOperator;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.SampleScope;

/**
 * A recognized piece of a filter string that has been replaced by a symbol. {@link #text()} is the original text, kept for error
 * reporting.
 */
public sealed interface SubExpression {

    String text();

    /**
     * {@code (innerExpression) in ALL|ANY|ONLY(samples)}
     */
    record Scoped(String text, String innerExpression, SampleScope scope) implements SubExpression {
    }

    /**
     * {@code KEY OP VALUE}, with surrounding quotes already removed from the value
     */
    record Comparator(String text, String key, ComparisonOperator operator, String literal) implements SubExpression {
    }

    /**
     * {@code IN_SET(uid)} or {@code NOT_IN_SET(uid)}
     */
    record SetMembership(String text, String variantSetUid, boolean member) implements SubExpression {
    }

    /**
     * {@code GENE(label)}
     */
    record Gene(String text, String geneLabel) implements SubExpression {
    }
}
