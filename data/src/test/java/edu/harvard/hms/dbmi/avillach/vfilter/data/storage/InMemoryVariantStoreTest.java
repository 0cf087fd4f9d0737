package edu.harvard.hms.dbmi.avillach.vfilter.data.storage;

import com.google.common.collect.Range;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.*;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantColumn;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryVariantStoreTest {

    private VariantSnapshot snapshot;

    private InMemoryVariantStore store;

    @BeforeEach
    public void setup() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/variants.json")) {
            snapshot = new VariantSnapshotLoader().load(in);
        }
        store = new InMemoryVariantStore(snapshot.getVariants());
    }

    @Test
    public void load_snapshot() {
        assertEquals(6, snapshot.getFields().size());
        assertEquals(5, store.size());

        VariantRecord variant = store.getVariants("genome1", List.of(2L)).get(0);
        assertEquals(150, variant.getPosition());
        assertEquals(Set.of("A", "B", "C"), variant.linkedSampleIds());
        assertEquals(List.of("MODERATE", "HIGH"), variant.alleleValues("INFO_EFF_IMPACT"));
        assertFalse(variant.getEvidenceEntries().get(2).isCalled());
        assertEquals(Set.of(1), variant.getEvidenceEntries().get(1).nonReferenceAlleleIndexes());
    }

    @Test
    public void query_noPredicates_restrictedToReferenceGenome() {
        assertEquals(Set.of(1L, 2L, 3L, 4L), ids(store.query("genome1", List.of())));
        assertEquals(Set.of(5L), ids(store.query("genome2", List.of())));
        assertEquals(Set.of(), ids(store.query("genome3", List.of())));
    }

    @Test
    public void query_columnComparison() {
        List<StorePredicate> predicates = List.of(new ColumnComparison(VariantColumn.POSITION, ComparisonOperator.GREATER_THAN, 100L));
        assertEquals(Set.of(2L, 3L, 4L), ids(store.query("genome1", predicates)));
    }

    @Test
    public void query_conjunction() {
        List<StorePredicate> predicates = List.of(
            new ColumnComparison(VariantColumn.POSITION, ComparisonOperator.GREATER_THAN, 100L),
            new ColumnComparison(VariantColumn.CHROMOSOME, ComparisonOperator.EQUAL, "chr1")
        );
        assertEquals(Set.of(2L, 3L), ids(store.query("genome1", predicates)));
    }

    @Test
    public void query_variantSetMembership() {
        assertEquals(Set.of(1L, 2L), ids(store.query("genome1", List.of(new VariantSetMembership("set1", true)))));
        assertEquals(Set.of(3L, 4L), ids(store.query("genome1", List.of(new VariantSetMembership("set1", false)))));
    }

    @Test
    public void query_positionRange() {
        Range<Long> range = Range.closedOpen(100L, 200L);
        assertEquals(Set.of(2L), ids(store.query("genome1", List.of(new PositionRange(range, true)))));
        assertEquals(Set.of(1L, 3L, 4L), ids(store.query("genome1", List.of(new PositionRange(range, false)))));
    }

    @Test
    public void getVariants_skipsUnknownAndForeignIds() {
        assertEquals(Set.of(1L, 3L), ids(store.getVariants("genome1", List.of(1L, 3L, 5L, 42L))));
    }

    @Test
    public void new_duplicateIds() {
        VariantRecord variant = snapshot.getVariants().get(0);
        assertThrows(IllegalArgumentException.class, () -> new InMemoryVariantStore(List.of(variant, variant)));
    }

    private static Set<Long> ids(List<VariantRecord> variants) {
        return variants.stream().map(VariantRecord::getId).collect(Collectors.toSet());
    }
}
