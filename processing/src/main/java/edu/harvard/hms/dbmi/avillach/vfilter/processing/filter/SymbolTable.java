package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterParseException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Symbols handed out for the sub-expressions of one filter string. Symbols are the single letters A-Z then a-z, allocated in
 * order; a sub-expression that appears twice with the same text gets the same symbol.
 */
public class SymbolTable {

    public static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";

    private final List<SubExpression> expressions = new ArrayList<>();

    private final Map<String, String> symbolsByText = new HashMap<>();

    private final String filterString;

    public SymbolTable(String filterString) {
        this.filterString = filterString;
    }

    public String allocate(SubExpression expression) {
        String existing = symbolsByText.get(expression.text());
        if (existing != null) {
            return existing;
        }
        int nextIndex = expressions.size();
        if (nextIndex >= ALPHABET.length()) {
            throw new FilterParseException(
                filterString, "Filter has more than " + ALPHABET.length() + " distinct conditions, the first one over the limit is " + expression.text()
            );
        }
        String symbol = String.valueOf(ALPHABET.charAt(nextIndex));
        expressions.add(expression);
        symbolsByText.put(expression.text(), symbol);
        return symbol;
    }

    public SubExpression get(String symbol) {
        int index = symbol.length() == 1 ? ALPHABET.indexOf(symbol.charAt(0)) : -1;
        if (index < 0 || index >= expressions.size()) {
            throw new FilterParseException(symbol, "Unknown symbol");
        }
        return expressions.get(index);
    }

    public int size() {
        return expressions.size();
    }

    /**
     * How a symbol appears inside a symbolized filter string. Braces keep symbols apart from words a user could type.
     */
    public static String placeholder(String symbol) {
        return "{" + symbol + "}";
    }
}
