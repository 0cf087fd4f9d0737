package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import com.google.common.collect.ImmutableSet;

/**
 * An AND of literals. The empty conjunction is always true.
 */
public record Conjunction(ImmutableSet<Literal> literals) {

    public static final Conjunction TRUE = new Conjunction(ImmutableSet.of());

    public Conjunction and(Conjunction other) {
        return new Conjunction(ImmutableSet.<Literal>builder().addAll(literals).addAll(other.literals).build());
    }

    public static Conjunction of(Literal literal) {
        return new Conjunction(ImmutableSet.of(literal));
    }
}
