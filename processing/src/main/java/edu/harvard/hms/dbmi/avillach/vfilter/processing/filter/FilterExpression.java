package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import java.util.List;

/**
 * A parsed filter string: the symbols for its sub-expressions and its boolean structure in disjunctive normal form. Created
 * for one evaluation and then dropped.
 */
public class FilterExpression {

    private final String filterString;

    private final String symbolized;

    private final SymbolTable symbols;

    private final List<Conjunction> conjunctions;

    private FilterExpression(String filterString, String symbolized, SymbolTable symbols, List<Conjunction> conjunctions) {
        this.filterString = filterString;
        this.symbolized = symbolized;
        this.symbols = symbols;
        this.conjunctions = conjunctions;
    }

    /**
     * A blank filter string gives a single empty conjunction, which matches everything.
     */
    public static FilterExpression parse(String filterString, FilterSettings settings) {
        String text = filterString == null ? "" : filterString;
        SymbolTable symbols = new SymbolTable(text);
        String symbolized = new FilterTokenizer().symbolize(text, symbols);
        List<Conjunction> conjunctions = BooleanFormulaParser.parse(symbolized, settings.maxNestingDepth())
            .map(formula -> new DnfConverter(settings.maxConjunctions()).toDnf(formula, text))
            .orElse(List.of(Conjunction.TRUE));
        return new FilterExpression(text, symbolized, symbols, conjunctions);
    }

    public String getFilterString() {
        return filterString;
    }

    public String getSymbolized() {
        return symbolized;
    }

    public SymbolTable getSymbols() {
        return symbols;
    }

    public List<Conjunction> getConjunctions() {
        return conjunctions;
    }

    @Override
    public String toString() {
        return filterString + " => " + conjunctions;
    }
}
