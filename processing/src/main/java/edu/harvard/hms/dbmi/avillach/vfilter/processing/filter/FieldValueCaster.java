package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import com.google.common.collect.ImmutableSet;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.FieldType;
import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterParseException;

import java.util.Optional;
import java.util.Set;

/**
 * Casts filter literals and stored values to the Java type used for a {@link FieldType}: Long, Double, String or Boolean.
 */
public final class FieldValueCaster {

    public static final Set<String> TRUE_TOKENS = ImmutableSet.of("True", "true", "T", "t");

    public static final Set<String> FALSE_TOKENS = ImmutableSet.of("False", "false", "F", "f");

    private FieldValueCaster() {
    }

    /**
     * @param fragment the condition the literal came from, reported if the cast fails
     */
    public static Object castLiteral(FieldType type, String literal, String fragment) {
        try {
            return switch (type) {
                case INTEGER -> Long.valueOf(literal.trim());
                case FLOAT -> Double.valueOf(literal.trim());
                case STRING -> literal;
                case BOOLEAN -> parseBoolean(literal)
                    .orElseThrow(() -> new FilterParseException(fragment, "Not a boolean value " + literal + ", expected one of " + TRUE_TOKENS + " or " + FALSE_TOKENS));
            };
        } catch (NumberFormatException e) {
            throw new FilterParseException(fragment, "Value " + literal + " is not a valid " + type.name().toLowerCase(), e);
        }
    }

    /**
     * Stored values come from schemaless data and are cast leniently: anything that does not fit the type becomes null and
     * therefore never satisfies a condition.
     */
    public static Object castStored(FieldType type, Object stored) {
        if (stored == null) {
            return null;
        }
        if (type == FieldType.BOOLEAN) {
            return stored instanceof Boolean ? stored : parseBoolean(stored.toString()).orElse(null);
        } else if (type == FieldType.STRING) {
            return stored.toString();
        } else if (stored instanceof Number) {
            return stored;
        }
        try {
            if (type == FieldType.INTEGER) {
                return Long.valueOf(stored.toString().trim());
            }
            return Double.valueOf(stored.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Optional<Boolean> parseBoolean(String literal) {
        if (TRUE_TOKENS.contains(literal)) {
            return Optional.of(Boolean.TRUE);
        } else if (FALSE_TOKENS.contains(literal)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }
}
