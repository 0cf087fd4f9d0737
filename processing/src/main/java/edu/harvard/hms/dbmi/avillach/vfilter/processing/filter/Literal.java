package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

public record Literal(String symbol, boolean negated) {

    @Override
    public String toString() {
        return negated ? "~" + symbol : symbol;
    }
}
