package edu.harvard.hms.dbmi.avillach.vfilter.data.variant;

import edu.harvard.hms.dbmi.avillach.vfilter.data.query.ComparisonOperator;

import java.util.EnumSet;
import java.util.Set;

public enum FieldType {

    INTEGER(EnumSet.allOf(ComparisonOperator.class)),
    FLOAT(EnumSet.allOf(ComparisonOperator.class)),
    STRING(EnumSet.of(ComparisonOperator.EQUAL, ComparisonOperator.NOT_EQUAL)),
    BOOLEAN(EnumSet.of(ComparisonOperator.EQUAL, ComparisonOperator.NOT_EQUAL));

    private final Set<ComparisonOperator> supportedOperators;

    FieldType(Set<ComparisonOperator> supportedOperators) {
        this.supportedOperators = supportedOperators;
    }

    public boolean supports(ComparisonOperator operator) {
        return supportedOperators.contains(operator);
    }
}
