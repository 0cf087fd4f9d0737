package edu.harvard.hms.dbmi.avillach.vfilter.data.query;

import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantRecord;

/**
 * A condition the backing store can evaluate on its own. Predicates are plain data so that a store can translate them into its
 * native query language; {@link #test} is the reference semantics every translation has to agree with.
 */
public sealed interface StorePredicate permits ColumnComparison, VariantSetMembership, PositionRange {

    boolean test(VariantRecord variant);
}
