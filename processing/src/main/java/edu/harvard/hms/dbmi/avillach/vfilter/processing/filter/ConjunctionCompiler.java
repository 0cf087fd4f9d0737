package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import edu.harvard.hms.dbmi.avillach.vfilter.data.query.*;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.FieldTypeInfo;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.FieldTypeRegistry;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantColumn;
import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Sorts the literals of a conjunction into store predicates, catch-all conditions and scoped sub-filters. Every field key, operator
 * and literal is checked here, so a filter that compiles can only fail during evaluation because of the store.
 */
public class ConjunctionCompiler {

    private static final Logger log = LoggerFactory.getLogger(ConjunctionCompiler.class);

    private final FieldTypeRegistry fieldTypeRegistry;

    private final GeneRegionResolver geneRegionResolver;

    public ConjunctionCompiler(FieldTypeRegistry fieldTypeRegistry, GeneRegionResolver geneRegionResolver) {
        this.fieldTypeRegistry = fieldTypeRegistry;
        this.geneRegionResolver = geneRegionResolver;
    }

    /**
     * @param scopedCompiler compiles the inner expression of a scoped condition
     */
    public CompiledConjunction compile(
        Conjunction conjunction, SymbolTable symbols, String referenceGenomeId, Function<String, CompiledFilter> scopedCompiler
    ) {
        List<StorePredicate> storePredicates = new ArrayList<>();
        List<ConditionTriple> catchAllTriples = new ArrayList<>();
        List<ScopedSubFilter> scopedSubFilters = new ArrayList<>();

        for (Literal literal : conjunction.literals()) {
            SubExpression expression = symbols.get(literal.symbol());
            if (expression instanceof SubExpression.Scoped scoped) {
                scopedSubFilters.add(new ScopedSubFilter(scopedCompiler.apply(scoped.innerExpression()), scoped.scope(), literal.negated()));
            } else if (expression instanceof SubExpression.SetMembership setMembership) {
                storePredicates.add(new VariantSetMembership(setMembership.variantSetUid(), setMembership.member() != literal.negated()));
            } else if (expression instanceof SubExpression.Gene gene) {
                GeneRegion region = geneRegionResolver.resolve(referenceGenomeId, gene.geneLabel())
                    .orElseThrow(() -> new FilterParseException(gene.text(), "Unknown gene for reference genome " + referenceGenomeId));
                storePredicates.add(new PositionRange(region.toRange(), !literal.negated()));
            } else if (expression instanceof SubExpression.Comparator comparator) {
                compileComparator(comparator, literal.negated(), storePredicates, catchAllTriples);
            }
        }
        log.debug(
            "Compiled " + conjunction.literals() + " into store predicates " + storePredicates + ", catch-all conditions " + catchAllTriples + " and "
                + scopedSubFilters.size() + " scoped sub-filters"
        );
        return new CompiledConjunction(storePredicates, catchAllTriples, scopedSubFilters);
    }

    private void compileComparator(
        SubExpression.Comparator comparator, boolean negated, List<StorePredicate> storePredicates, List<ConditionTriple> catchAllTriples
    ) {
        FieldTypeInfo field = fieldTypeRegistry.lookup(comparator.key())
            .orElseThrow(() -> new FilterParseException(comparator.text(), "Unrecognized filter key " + comparator.key()));
        if (!field.getType().supports(comparator.operator())) {
            throw new FilterParseException(
                comparator.text(), "Operator " + comparator.operator().getSymbol() + " is not supported for " + field.getType().name().toLowerCase()
                    + " field " + field.getKey()
            );
        }
        Object value = FieldValueCaster.castLiteral(field.getType(), comparator.literal(), comparator.text());
        ComparisonOperator operator = negated ? comparator.operator().complement() : comparator.operator();

        if (field.isPushable()) {
            VariantColumn column = VariantColumn.forKey(field.getKey())
                .orElseThrow(() -> new FilterParseException(comparator.text(), "Field " + field.getKey() + " is not a variant column"));
            storePredicates.add(new ColumnComparison(column, operator, value));
        } else {
            catchAllTriples.add(new ConditionTriple(operator, field, value));
        }
    }
}
