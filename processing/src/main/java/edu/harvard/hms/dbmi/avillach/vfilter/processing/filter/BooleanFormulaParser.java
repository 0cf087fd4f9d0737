package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive descent parser for symbolized filter strings. NOT binds tighter than AND, which binds tighter than OR; connectives
 * are case insensitive.
 */
public class BooleanFormulaParser {

    private static final Pattern TOKEN = Pattern.compile("\\s*(\\{[A-Za-z]}|\\(|\\)|[A-Za-z]+|\\S+)");

    private static final String AND = "AND";
    private static final String OR = "OR";
    private static final String NOT = "NOT";

    private final String symbolized;

    private final List<String> tokens;

    private final int maxNestingDepth;

    private int position;

    private int depth;

    private BooleanFormulaParser(String symbolized, int maxNestingDepth) {
        this.symbolized = symbolized;
        this.tokens = tokenize(symbolized);
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * @param maxNestingDepth how many NOTs and parentheses may enclose a condition
     * @return the formula, or empty for a blank string
     */
    public static Optional<BooleanFormula> parse(String symbolized, int maxNestingDepth) {
        BooleanFormulaParser parser = new BooleanFormulaParser(symbolized, maxNestingDepth);
        if (parser.tokens.isEmpty()) {
            return Optional.empty();
        }
        BooleanFormula formula = parser.parseOr();
        if (parser.position < parser.tokens.size()) {
            throw new FilterParseException(parser.remaining(), "Unexpected text in filter");
        }
        return Optional.of(formula);
    }

    private static List<String> tokenize(String symbolized) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(symbolized);
        while (matcher.find()) {
            tokens.add(matcher.group(1));
        }
        return tokens;
    }

    private BooleanFormula parseOr() {
        BooleanFormula formula = parseAnd();
        while (peekKeyword(OR)) {
            position++;
            formula = new BooleanFormula.Or(formula, parseAnd());
        }
        return formula;
    }

    private BooleanFormula parseAnd() {
        BooleanFormula formula = parseUnary();
        while (peekKeyword(AND)) {
            position++;
            formula = new BooleanFormula.And(formula, parseUnary());
        }
        return formula;
    }

    private BooleanFormula parseUnary() {
        if (peekKeyword(NOT)) {
            position++;
            enterNesting();
            BooleanFormula operand = parseUnary();
            depth--;
            return new BooleanFormula.Not(operand);
        }
        return parsePrimary();
    }

    private BooleanFormula parsePrimary() {
        if (position >= tokens.size()) {
            throw new FilterParseException(symbolized, "Filter ends where a condition was expected");
        }
        String token = tokens.get(position);
        if (token.equals("(")) {
            position++;
            enterNesting();
            BooleanFormula formula = parseOr();
            if (position >= tokens.size() || !tokens.get(position).equals(")")) {
                throw new FilterParseException(symbolized, "Missing closing parenthesis");
            }
            position++;
            depth--;
            return formula;
        }
        if (token.length() == 3 && token.startsWith("{") && token.endsWith("}")) {
            position++;
            return new BooleanFormula.Atom(token.substring(1, 2));
        }
        throw new FilterParseException(remaining(), "Expected a condition");
    }

    private void enterNesting() {
        if (++depth > maxNestingDepth) {
            throw new FilterParseException(remaining(), "Conditions are nested in more than " + maxNestingDepth + " NOTs and parentheses");
        }
    }

    private boolean peekKeyword(String keyword) {
        return position < tokens.size() && tokens.get(position).toUpperCase(Locale.ROOT).equals(keyword);
    }

    private String remaining() {
        return String.join(" ", tokens.subList(position, tokens.size()));
    }
}
