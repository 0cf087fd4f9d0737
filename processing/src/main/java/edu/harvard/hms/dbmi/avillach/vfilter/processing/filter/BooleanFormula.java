package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

public sealed interface BooleanFormula {

    record Atom(String symbol) implements BooleanFormula {
    }

    record Not(BooleanFormula operand) implements BooleanFormula {
    }

    record And(BooleanFormula left, BooleanFormula right) implements BooleanFormula {
    }

    record Or(BooleanFormula left, BooleanFormula right) implements BooleanFormula {
    }
}
