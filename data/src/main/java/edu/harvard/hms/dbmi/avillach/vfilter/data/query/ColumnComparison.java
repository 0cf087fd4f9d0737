package edu.harvard.hms.dbmi.avillach.vfilter.data.query;

import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantColumn;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantRecord;

/**
 * Compares a variant column to a literal that has already been cast to the column's type.
 */
public record ColumnComparison(VariantColumn column, ComparisonOperator operator, Object value) implements StorePredicate {

    public ColumnComparison {
        if (column == null || operator == null || value == null) {
            throw new IllegalArgumentException("Column comparisons require a column, an operator and a value");
        }
    }

    @Override
    public boolean test(VariantRecord variant) {
        return operator.test(column.valueOf(variant), value);
    }

    @Override
    public String toString() {
        return column.getKey() + " " + operator.getSymbol() + " " + value;
    }
}
