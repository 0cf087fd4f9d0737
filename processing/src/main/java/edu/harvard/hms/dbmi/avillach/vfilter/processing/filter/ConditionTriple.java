package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import edu.harvard.hms.dbmi.avillach.vfilter.data.query.ComparisonOperator;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.FieldTypeInfo;

/**
 * A comparison on a catch-all field, left for in-process evaluation. {@code value} is already cast to the field's type.
 */
public record ConditionTriple(ComparisonOperator operator, FieldTypeInfo field, Object value) {

    public String fieldKey() {
        return field.getKey();
    }

    public boolean test(Object stored) {
        return operator.test(FieldValueCaster.castStored(field.getType(), stored), value);
    }

    @Override
    public String toString() {
        return field.getKey() + " " + operator.getSymbol() + " " + value;
    }
}
