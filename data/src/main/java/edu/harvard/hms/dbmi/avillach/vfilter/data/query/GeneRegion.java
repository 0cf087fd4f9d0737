package edu.harvard.hms.dbmi.avillach.vfilter.data.query;

import com.google.common.collect.Range;

/**
 * A gene annotated on a reference genome, spanning positions {@code [start, end)}.
 */
public record GeneRegion(String referenceGenomeId, String label, long start, long end) {

    public GeneRegion {
        if (end < start) {
            throw new IllegalArgumentException("Gene " + label + " ends before it starts");
        }
    }

    public Range<Long> toRange() {
        return Range.closedOpen(start, end);
    }
}
