package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import edu.harvard.hms.dbmi.avillach.vfilter.data.query.GeneRegionResolver;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.SampleScope;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.ScopeType;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.VariantRecordStore;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.StorePredicate;
import edu.harvard.hms.dbmi.avillach.vfilter.data.storage.VariantSnapshot;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantRecord;
import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterCancelledException;
import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterExecutionException;
import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static edu.harvard.hms.dbmi.avillach.vfilter.processing.filter.TestFixtures.GENOME;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

public class VariantFilterEvaluatorTest {

    private VariantFilterEvaluator evaluator;

    @BeforeEach
    public void setup() {
        evaluator = TestFixtures.evaluator(FilterSettings.DEFAULTS);
    }

    @Test
    public void evaluate_scopedScenario() {
        FilterEvalResult result = evaluator.evaluate("(position > 100) AND (GT_TYPE == HET) in ANY(A,B)", GENOME, null);

        assertEquals(Map.of(2L, Set.of("A")), result.getPassingSampleIds());
    }

    @Test
    public void evaluate_emptyFilterMatchesReferenceGenome() {
        FilterEvalResult result = evaluator.evaluate("", GENOME, null);

        assertEquals(
            Map.of(1L, Set.of("A", "B"), 2L, Set.of("A", "B", "C"), 3L, Set.of("A", "B"), 4L, Set.of("A", "D")), result.getPassingSampleIds()
        );
        assertEquals(Set.of(5L), evaluator.evaluate("   ", "genome2", null).getVariantIds());
    }

    @Test
    public void evaluate_sampleEvidenceField() {
        assertEquals(
            Map.of(1L, Set.of("B"), 2L, Set.of("A"), 4L, Set.of("D")), evaluator.evaluate("GT_TYPE == HET", GENOME, null).getPassingSampleIds()
        );
        assertEquals(Map.of(2L, Set.of("A", "B"), 3L, Set.of("A")), evaluator.evaluate("DP >= 35", GENOME, null).getPassingSampleIds());
        assertEquals(Map.of(5L, Set.of("A")), evaluator.evaluate("GT_TYPE == HET", "genome2", null).getPassingSampleIds());
    }

    @Test
    public void evaluate_commonDataField() {
        assertEquals(Map.of(2L, Set.of("A", "B", "C"), 3L, Set.of("A", "B")), evaluator.evaluate("QUAL > 50", GENOME, null).getPassingSampleIds());
        // per alternate common data passes if any allele does
        assertEquals(Set.of(3L, 4L), evaluator.evaluate("INFO_AF > 0.35", GENOME, null).getVariantIds());
    }

    @Test
    public void evaluate_perAlleleField() {
        assertEquals(
            Map.of(3L, Set.of("A"), 4L, Set.of("D")), evaluator.evaluate("INFO_EFF_IMPACT == HIGH", GENOME, null).getPassingSampleIds()
        );
    }

    @Test
    public void evaluate_booleanField() {
        assertEquals(
            evaluator.evaluate("FILTER_PASS == true", GENOME, null), evaluator.evaluate("FILTER_PASS == T", GENOME, null)
        );
        assertEquals(Map.of(1L, Set.of("B"), 3L, Set.of("A")), evaluator.evaluate("FILTER_PASS == f", GENOME, null).getPassingSampleIds());
    }

    @Test
    public void evaluate_setMembership() {
        assertEquals(Set.of(1L, 2L), evaluator.evaluate("IN_SET(set1)", GENOME, null).getVariantIds());
        assertEquals(Set.of(3L, 4L), evaluator.evaluate("NOT_IN_SET(set1)", GENOME, null).getVariantIds());
        assertEquals(Set.of(3L, 4L), evaluator.evaluate("NOT IN_SET(set1)", GENOME, null).getVariantIds());
    }

    @Test
    public void evaluate_geneRegion() {
        assertEquals(Set.of(2L, 3L), evaluator.evaluate("GENE(geneX)", GENOME, null).getVariantIds());
        assertEquals(Set.of(1L, 4L), evaluator.evaluate("NOT GENE(geneX)", GENOME, null).getVariantIds());
        assertEquals(Set.of(4L), evaluator.evaluate("position > 100 AND NOT GENE(geneX)", GENOME, null).getVariantIds());
    }

    @Test
    public void evaluate_scopeTypes() {
        assertEquals(Map.of(2L, Set.of("A", "B")), evaluator.evaluate("(FILTER_PASS == true) in ALL(A,B)", GENOME, null).getPassingSampleIds());
        assertEquals(Map.of(2L, Set.of("A", "B")), evaluator.evaluate("(FILTER_PASS == true) in ONLY(A,B)", GENOME, null).getPassingSampleIds());
        assertEquals(Map.of(3L, Set.of("A"), 4L, Set.of("A")), evaluator.evaluate("(DP >= 30) in ONLY(A)", GENOME, null).getPassingSampleIds());
    }

    @Test
    public void evaluate_topLevelScope() {
        FilterEvalResult result = evaluator.evaluate("DP >= 30", GENOME, new SampleScope(ScopeType.ONLY, Set.of("A")));

        assertEquals(evaluator.evaluate("(DP >= 30) in ONLY(A)", GENOME, null), result);
    }

    @Test
    public void evaluate_negatedScope() {
        FilterEvalResult result = evaluator.evaluate("NOT ((DP >= 30) in ONLY(A))", GENOME, null);

        assertEquals(Map.of(1L, Set.of("A", "B"), 2L, Set.of("A", "B", "C")), result.getPassingSampleIds());
    }

    @Test
    public void evaluate_dnfEquivalence() {
        FilterEvalResult factored = evaluator.evaluate("QUAL > 50 AND (GT_TYPE == HET OR DP >= 40)", GENOME, null);
        FilterEvalResult distributed = evaluator.evaluate("(QUAL > 50 AND GT_TYPE == HET) OR (QUAL > 50 AND DP >= 40)", GENOME, null);

        assertEquals(Map.of(2L, Set.of("A", "B"), 3L, Set.of("A")), factored.getPassingSampleIds());
        assertEquals(factored, distributed);
    }

    @Test
    public void evaluate_idempotent() {
        String filter = "(IN_SET(set1) OR GENE(geneY)) AND ((GT_TYPE == HET) in ANY(A,B,D) OR QUAL < 20)";

        assertEquals(evaluator.evaluate(filter, GENOME, null), evaluator.evaluate(filter, GENOME, null));
    }

    @Test
    public void evaluate_parallelAndSequentialScopesAgree() {
        String filter = "((GT_TYPE == HET) in ANY(A,B)) AND ((DP >= 30) in ALL(A))";
        VariantFilterEvaluator sequential = TestFixtures.evaluator(new FilterSettings(8, 256, 1024, false, 0));

        FilterEvalResult result = evaluator.evaluate(filter, GENOME, null);
        assertEquals(Map.of(2L, Set.of("A")), result.getPassingSampleIds());
        assertEquals(result, sequential.evaluate(filter, GENOME, null));
    }

    @Test
    public void evaluate_nestingLimit() {
        VariantFilterEvaluator shallow = TestFixtures.evaluator(new FilterSettings(2, 256, 1024, true, 0));

        assertEquals(4, shallow.evaluate(nested(2), GENOME, null).size());
        assertThrows(FilterParseException.class, () -> shallow.evaluate(nested(3), GENOME, null));
    }

    @Test
    public void evaluate_tooManyConditions() {
        String filter = IntStream.range(0, 53).mapToObj(i -> "position != " + i).collect(Collectors.joining(" OR "));

        assertThrows(FilterParseException.class, () -> evaluator.evaluate(filter, GENOME, null));
    }

    @Test
    public void evaluate_parseErrorsReported() {
        assertEquals("FOO == 1", assertThrows(FilterParseException.class, () -> evaluator.evaluate("FOO == 1", GENOME, null)).getFragment());
        assertThrows(FilterParseException.class, () -> evaluator.evaluate("GT_TYPE > HET", GENOME, null));
        assertThrows(FilterParseException.class, () -> evaluator.evaluate("FILTER_PASS == yes", GENOME, null));
        assertThrows(FilterParseException.class, () -> evaluator.evaluate("(DP > 1) in SOME(A)", GENOME, null));
        assertThrows(FilterParseException.class, () -> evaluator.evaluate("GENE(nope)", GENOME, null));
        assertThrows(FilterParseException.class, () -> evaluator.evaluate("position > 1 AND", GENOME, null));
        assertThrows(FilterParseException.class, () -> evaluator.evaluate("position = 1", GENOME, null));
    }

    @Test
    public void evaluate_quotedParenthesisInsideScope() {
        assertTrue(evaluator.evaluate("(ref == \"a)\") in ANY(A)", GENOME, null).isEmpty());
        assertEquals(Set.of(2L), evaluator.evaluate("(GT_TYPE == 'HET') in ANY(A) AND ref != \"(\"", GENOME, null).getVariantIds());
    }

    @Test
    public void evaluate_deeplyNestedFilterRejected() {
        assertThrows(FilterParseException.class, () -> evaluator.evaluate("(".repeat(20000) + "position > 1" + ")".repeat(20000), GENOME, null));
        assertThrows(FilterParseException.class, () -> evaluator.evaluate("NOT ".repeat(50000) + "position > 1", GENOME, null));
        assertEquals(Set.of(2L, 3L, 4L), evaluator.evaluate("NOT ".repeat(20) + "((((position > 100))))", GENOME, null).getVariantIds());
    }

    @Test
    public void evaluate_errorInScopedFilterAbortsEvaluation() {
        assertThrows(FilterParseException.class, () -> evaluator.evaluate("IN_SET(set1) OR (FOO == 1) in ANY(A)", GENOME, null));
    }

    @Test
    public void evaluate_referenceGenomeRequired() {
        assertThrows(IllegalArgumentException.class, () -> evaluator.evaluate("", " ", null));
    }

    @Test
    public void evaluate_storeFailureWrapped() {
        VariantSnapshot snapshot = TestFixtures.snapshot();
        VariantRecordStore store = mock(VariantRecordStore.class);
        when(store.query(any(), anyList())).thenThrow(new IllegalStateException("connection refused"));
        VariantFilterEvaluator failing = new VariantFilterEvaluator(store, TestFixtures.registry(snapshot), mock(GeneRegionResolver.class), FilterSettings.DEFAULTS);

        FilterExecutionException exception = assertThrows(FilterExecutionException.class, () -> failing.evaluate("position > 1", GENOME, null));
        assertInstanceOf(IllegalStateException.class, exception.getCause());
        verify(store, times(1)).query(any(), anyList());
    }

    @Test
    public void evaluate_cancelled() {
        FilterCancellation cancellation = FilterCancellation.none();
        cancellation.cancel();

        assertThrows(FilterCancelledException.class, () -> evaluator.evaluate("position > 1", GENOME, null, cancellation));
    }

    @Test
    public void evaluate_timedOut() {
        VariantFilterEvaluator timed = TestFixtures.evaluator(new FilterSettings(8, 256, 1024, true, 1));
        FilterCancellation cancellation = timed.newCancellation();
        await(5);

        assertTrue(cancellation.isCancelled());
        assertThrows(FilterCancelledException.class, () -> timed.evaluate("position > 1", GENOME, null, cancellation));
    }

    @Test
    public void evaluate_interruptedWhileWaitingForScopedFilters() throws InterruptedException {
        VariantSnapshot snapshot = TestFixtures.snapshot();
        VariantRecordStore fixtureStore = TestFixtures.store(snapshot);
        CountDownLatch queried = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        VariantRecordStore slowStore = new VariantRecordStore() {
            @Override
            public List<VariantRecord> query(String referenceGenomeId, List<StorePredicate> predicates) {
                queried.countDown();
                awaitRelease(release);
                return fixtureStore.query(referenceGenomeId, predicates);
            }

            @Override
            public List<VariantRecord> getVariants(String referenceGenomeId, Collection<Long> variantIds) {
                return fixtureStore.getVariants(referenceGenomeId, variantIds);
            }
        };
        VariantFilterEvaluator slow = new VariantFilterEvaluator(slowStore, TestFixtures.registry(snapshot), TestFixtures.genes(), FilterSettings.DEFAULTS);

        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AtomicBoolean interruptRestored = new AtomicBoolean();
        Thread evaluation = new Thread(() -> {
            try {
                slow.evaluate("(GT_TYPE == HET) in ANY(A) AND (DP > 1) in ANY(B)", GENOME, null);
            } catch (Throwable t) {
                thrown.set(t);
                interruptRestored.set(Thread.currentThread().isInterrupted());
            }
        });
        evaluation.start();
        assertTrue(queried.await(5, TimeUnit.SECONDS));
        evaluation.interrupt();
        evaluation.join(5000);
        release.countDown();

        assertInstanceOf(FilterCancelledException.class, thrown.get());
        assertTrue(interruptRestored.get());
    }

    private static void awaitRelease(CountDownLatch release) {
        try {
            release.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String nested(int levels) {
        String filter = "position > 0";
        for (int i = 0; i < levels; i++) {
            filter = "(" + filter + ") in ANY(A)";
        }
        return filter;
    }

    private static void await(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
