package edu.harvard.hms.dbmi.avillach.vfilter.data.query;

import com.google.common.collect.Range;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantRecord;

/**
 * Restricts variants to positions inside, or with {@code inside == false} outside, a range of the reference genome.
 */
public record PositionRange(Range<Long> range, boolean inside) implements StorePredicate {

    public PositionRange {
        if (range == null) {
            throw new IllegalArgumentException("Position ranges require a range");
        }
    }

    @Override
    public boolean test(VariantRecord variant) {
        return range.contains((long) variant.getPosition()) == inside;
    }
}
