package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterParseException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rewrites a formula into disjunctive normal form. Negations are pushed down to the atoms while walking the tree (double
 * negation and De Morgan) and AND is distributed over OR. Equal literals within a conjunction and equal conjunctions collapse.
 */
public class DnfConverter {

    private final int maxConjunctions;

    public DnfConverter(int maxConjunctions) {
        this.maxConjunctions = maxConjunctions;
    }

    public List<Conjunction> toDnf(BooleanFormula formula, String filterString) {
        return ImmutableList.copyOf(convert(formula, false, filterString));
    }

    private Set<Conjunction> convert(BooleanFormula formula, boolean negated, String filterString) {
        while (formula instanceof BooleanFormula.Not not) {
            formula = not.operand();
            negated = !negated;
        }
        if (formula instanceof BooleanFormula.Atom atom) {
            Set<Conjunction> dnf = new LinkedHashSet<>();
            dnf.add(Conjunction.of(new Literal(atom.symbol(), negated)));
            return dnf;
        }
        // chains of one connective are left deep, so only the right operands are converted recursively
        boolean and = formula instanceof BooleanFormula.And;
        Deque<BooleanFormula> operands = new ArrayDeque<>();
        BooleanFormula current = formula;
        while (isConnective(current, and)) {
            operands.push(rightOperand(current));
            current = leftOperand(current);
        }
        operands.push(current);

        boolean conjunctive = and != negated;
        Set<Conjunction> dnf = convert(operands.pop(), negated, filterString);
        while (!operands.isEmpty()) {
            Set<Conjunction> next = convert(operands.pop(), negated, filterString);
            dnf = conjunctive ? product(dnf, next, filterString) : union(dnf, next, filterString);
        }
        return dnf;
    }

    private static boolean isConnective(BooleanFormula formula, boolean and) {
        return and ? formula instanceof BooleanFormula.And : formula instanceof BooleanFormula.Or;
    }

    private static BooleanFormula leftOperand(BooleanFormula formula) {
        if (formula instanceof BooleanFormula.And and) {
            return and.left();
        } else if (formula instanceof BooleanFormula.Or or) {
            return or.left();
        }
        throw new IllegalStateException("Not a connective: " + formula);
    }

    private static BooleanFormula rightOperand(BooleanFormula formula) {
        if (formula instanceof BooleanFormula.And and) {
            return and.right();
        } else if (formula instanceof BooleanFormula.Or or) {
            return or.right();
        }
        throw new IllegalStateException("Not a connective: " + formula);
    }

    private Set<Conjunction> union(Set<Conjunction> left, Set<Conjunction> right, String filterString) {
        Set<Conjunction> dnf = new LinkedHashSet<>(left);
        dnf.addAll(right);
        checkSize(dnf.size(), filterString);
        return dnf;
    }

    private Set<Conjunction> product(Set<Conjunction> left, Set<Conjunction> right, String filterString) {
        checkSize((long) left.size() * right.size(), filterString);
        Set<Conjunction> dnf = new LinkedHashSet<>();
        for (Conjunction l : left) {
            for (Conjunction r : right) {
                dnf.add(l.and(r));
            }
        }
        return dnf;
    }

    private void checkSize(long conjunctions, String filterString) {
        if (conjunctions > maxConjunctions) {
            throw new FilterParseException(filterString, "Filter expands to more than " + maxConjunctions + " alternatives");
        }
    }
}
