package edu.harvard.hms.dbmi.avillach.vfilter.data.query;

import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantRecord;

public record VariantSetMembership(String variantSetUid, boolean member) implements StorePredicate {

    public VariantSetMembership {
        if (variantSetUid == null || variantSetUid.isBlank()) {
            throw new IllegalArgumentException("Variant set membership requires a variant set uid");
        }
    }

    @Override
    public boolean test(VariantRecord variant) {
        return variant.getVariantSetUids().contains(variantSetUid) == member;
    }
}
