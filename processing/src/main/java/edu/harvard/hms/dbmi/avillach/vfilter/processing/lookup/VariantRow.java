package edu.harvard.hms.dbmi.avillach.vfilter.processing.lookup;

import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantRecord;

import java.util.Set;

/**
 * One row of a lookup. In the cast view a row is a variant with all of its passing samples and {@code sampleId} is null; in the
 * melted view a row is a variant and one passing sample.
 */
public record VariantRow(VariantRecord variant, String sampleId, Set<String> passingSampleIds) {

    public VariantRow {
        passingSampleIds = Set.copyOf(passingSampleIds);
    }

    public int getSampleCount() {
        return passingSampleIds.size();
    }
}
