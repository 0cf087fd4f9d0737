package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import edu.harvard.hms.dbmi.avillach.vfilter.data.query.GeneRegionResolver;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.SampleScope;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.StorePredicate;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.VariantRecordStore;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.FieldTypeRegistry;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantRecord;
import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterCancelledException;
import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterExecutionException;
import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates filter strings against the variants of a reference genome.
 * <p>
 * Each conjunction of the filter's disjunctive normal form becomes one store query for its pushable conditions, recursive
 * evaluations for its scoped conditions and an in-process pass for the remaining catch-all conditions. Conjunction results are
 * ORed together. Any failure aborts the whole evaluation.
 */
@Component
public class VariantFilterEvaluator {

    private static final Logger log = LoggerFactory.getLogger(VariantFilterEvaluator.class);

    private final VariantRecordStore variantRecordStore;

    private final FilterCompiler filterCompiler;

    private final CatchAllEvaluator catchAllEvaluator;

    private final FilterSettings settings;

    @Autowired
    public VariantFilterEvaluator(
        VariantRecordStore variantRecordStore, FieldTypeRegistry fieldTypeRegistry, GeneRegionResolver geneRegionResolver, FilterSettings settings
    ) {
        this.variantRecordStore = variantRecordStore;
        this.filterCompiler = new FilterCompiler(new ConjunctionCompiler(fieldTypeRegistry, geneRegionResolver), settings);
        this.catchAllEvaluator = new CatchAllEvaluator();
        this.settings = settings;
    }

    /**
     * A cancellation carrying the configured default timeout, if there is one.
     */
    public FilterCancellation newCancellation() {
        return settings.timeoutMillis() > 0 ? FilterCancellation.withTimeout(Duration.ofMillis(settings.timeoutMillis())) : FilterCancellation.none();
    }

    public FilterEvalResult evaluate(String filterString, String referenceGenomeId, SampleScope scope) {
        return evaluate(filterString, referenceGenomeId, scope, newCancellation());
    }

    /**
     * @param scope        applied to the top level conditions, null for unscoped
     * @param cancellation checked at every store call and conjunction, and periodically during in-process scans
     * @throws FilterParseException     if the filter cannot be compiled, before anything is evaluated
     * @throws FilterExecutionException if the store fails or the evaluation is cancelled
     */
    public FilterEvalResult evaluate(String filterString, String referenceGenomeId, SampleScope scope, FilterCancellation cancellation) {
        if (referenceGenomeId == null || referenceGenomeId.isBlank()) {
            throw new IllegalArgumentException("A reference genome is required to evaluate a filter");
        }
        long start = System.currentTimeMillis();
        CompiledFilter compiledFilter = filterCompiler.compile(filterString, referenceGenomeId);
        FilterEvalResult result = evaluate(compiledFilter, referenceGenomeId, scope, cancellation);
        log.info(
            "Filter [" + compiledFilter.filterString() + "] on " + referenceGenomeId + " matched " + result.size() + " variants in "
                + (System.currentTimeMillis() - start) + "ms"
        );
        return result;
    }

    private FilterEvalResult evaluate(CompiledFilter compiledFilter, String referenceGenomeId, SampleScope scope, FilterCancellation cancellation) {
        FilterEvalResult result = FilterEvalResult.empty();
        for (CompiledConjunction conjunction : compiledFilter.conjunctions()) {
            cancellation.checkpoint("conjunction of [" + compiledFilter.filterString() + "]");
            result = result.or(evaluateConjunction(conjunction, referenceGenomeId, scope, cancellation));
        }
        return result;
    }

    private FilterEvalResult evaluateConjunction(
        CompiledConjunction conjunction, String referenceGenomeId, SampleScope scope, FilterCancellation cancellation
    ) {
        List<FilterEvalResult> scopedResults = evaluateScopedSubFilters(conjunction.scopedSubFilters(), referenceGenomeId, cancellation);

        List<VariantRecord> candidates = query(referenceGenomeId, conjunction.storePredicates(), cancellation);
        FilterEvalResult seed = linkedSamples(candidates);
        for (FilterEvalResult scopedResult : scopedResults) {
            seed = seed.and(scopedResult);
        }
        return catchAllEvaluator.apply(candidates, seed, conjunction.catchAllTriples(), scope, cancellation);
    }

    private List<FilterEvalResult> evaluateScopedSubFilters(
        List<ScopedSubFilter> scopedSubFilters, String referenceGenomeId, FilterCancellation cancellation
    ) {
        if (scopedSubFilters.isEmpty()) {
            return List.of();
        }
        if (!settings.parallelScopes() || scopedSubFilters.size() == 1) {
            return scopedSubFilters.stream().map(scoped -> evaluateScoped(scoped, referenceGenomeId, cancellation)).toList();
        }
        // block() rethrows the first failure as is, the remaining evaluations are cancelled
        try {
            return Flux.fromIterable(scopedSubFilters)
                .flatMapSequential(
                    scoped -> Mono.fromCallable(() -> evaluateScoped(scoped, referenceGenomeId, cancellation)).subscribeOn(Schedulers.boundedElastic())
                )
                .collectList()
                .block();
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new FilterCancelledException("scoped sub-filters of a conjunction");
            }
            throw e;
        }
    }

    private FilterEvalResult evaluateScoped(ScopedSubFilter scoped, String referenceGenomeId, FilterCancellation cancellation) {
        FilterEvalResult result = evaluate(scoped.filter(), referenceGenomeId, scoped.scope(), cancellation);
        log.debug("Scoped filter [" + scoped.filter().filterString() + "] in " + scoped.scope() + " matched " + result.size() + " variants");
        if (!scoped.negated()) {
            return result;
        }
        Map<Long, Set<String>> complement = new LinkedHashMap<>();
        for (VariantRecord variant : query(referenceGenomeId, List.of(), cancellation)) {
            if (!result.getVariantIds().contains(variant.getId())) {
                complement.put(variant.getId(), variant.linkedSampleIds());
            }
        }
        return FilterEvalResult.of(complement);
    }

    private List<VariantRecord> query(String referenceGenomeId, List<StorePredicate> predicates, FilterCancellation cancellation) {
        cancellation.checkpoint("store query " + predicates);
        try {
            return variantRecordStore.query(referenceGenomeId, predicates);
        } catch (FilterExecutionException | FilterParseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FilterExecutionException("Variant store query " + predicates + " on " + referenceGenomeId + " failed", e);
        }
    }

    private static FilterEvalResult linkedSamples(List<VariantRecord> variants) {
        Map<Long, Set<String>> linked = new LinkedHashMap<>();
        for (VariantRecord variant : variants) {
            linked.put(variant.getId(), variant.linkedSampleIds());
        }
        return FilterEvalResult.of(linked);
    }
}
