package edu.harvard.hms.dbmi.avillach.vfilter.data.query;

import java.util.Arrays;
import java.util.Optional;

public enum ComparisonOperator {

    EQUAL("=="), NOT_EQUAL("!="), GREATER_THAN(">"), GREATER_THAN_OR_EQUAL(">="), LESS_THAN("<"), LESS_THAN_OR_EQUAL("<=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(operator -> operator.symbol.equals(symbol)).findFirst();
    }

    /**
     * @return the operator that holds exactly when this one does not, for a single value
     */
    public ComparisonOperator complement() {
        return switch (this) {
            case EQUAL -> NOT_EQUAL;
            case NOT_EQUAL -> EQUAL;
            case GREATER_THAN -> LESS_THAN_OR_EQUAL;
            case GREATER_THAN_OR_EQUAL -> LESS_THAN;
            case LESS_THAN -> GREATER_THAN_OR_EQUAL;
            case LESS_THAN_OR_EQUAL -> GREATER_THAN;
        };
    }

    /**
     * @param comparison the result of comparing the stored value to the literal, as returned by {@link Comparable#compareTo}
     */
    public boolean matches(int comparison) {
        return switch (this) {
            case EQUAL -> comparison == 0;
            case NOT_EQUAL -> comparison != 0;
            case GREATER_THAN -> comparison > 0;
            case GREATER_THAN_OR_EQUAL -> comparison >= 0;
            case LESS_THAN -> comparison < 0;
            case LESS_THAN_OR_EQUAL -> comparison <= 0;
        };
    }

    /**
     * Compares a stored value to an already typed literal. Integral numbers are compared exactly, other numbers as doubles.
     * Missing values and values of a different kind than the literal never match, whatever the operator.
     */
    public boolean test(Object value, Object literal) {
        if (value == null || literal == null) {
            return false;
        }
        if (value instanceof Number number && literal instanceof Number literalNumber) {
            if (isIntegral(number) && isIntegral(literalNumber)) {
                return matches(Long.compare(number.longValue(), literalNumber.longValue()));
            }
            return matches(Double.compare(number.doubleValue(), literalNumber.doubleValue()));
        }
        if (value instanceof String string && literal instanceof String literalString) {
            return matches(string.compareTo(literalString));
        }
        if (value instanceof Boolean bool && literal instanceof Boolean literalBool) {
            return matches(bool.compareTo(literalBool));
        }
        return false;
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte;
    }
}
