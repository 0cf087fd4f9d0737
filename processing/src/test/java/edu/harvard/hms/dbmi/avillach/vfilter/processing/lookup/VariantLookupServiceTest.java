package edu.harvard.hms.dbmi.avillach.vfilter.processing.lookup;

import edu.harvard.hms.dbmi.avillach.vfilter.data.query.SortDirection;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.VariantLookupRequest;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.ViewMode;
import edu.harvard.hms.dbmi.avillach.vfilter.data.storage.VariantSnapshot;
import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterParseException;
import edu.harvard.hms.dbmi.avillach.vfilter.processing.filter.FilterSettings;
import edu.harvard.hms.dbmi.avillach.vfilter.processing.filter.TestFixtures;
import edu.harvard.hms.dbmi.avillach.vfilter.processing.filter.VariantFilterEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static edu.harvard.hms.dbmi.avillach.vfilter.processing.filter.TestFixtures.GENOME;
import static org.junit.jupiter.api.Assertions.*;

public class VariantLookupServiceTest {

    private VariantLookupService lookupService;

    @BeforeEach
    public void setup() {
        VariantSnapshot snapshot = TestFixtures.snapshot();
        VariantFilterEvaluator evaluator =
            new VariantFilterEvaluator(TestFixtures.store(snapshot), TestFixtures.registry(snapshot), TestFixtures.genes(), FilterSettings.DEFAULTS);
        lookupService = new VariantLookupService(evaluator, TestFixtures.store(snapshot));
    }

    @Test
    public void lookup_defaultsSortByPosition() {
        VariantLookupResult result = lookupService.lookup(VariantLookupRequest.of("", GENOME));

        assertEquals(4, result.totalCount());
        assertEquals(List.of(50, 150, 200, 400), positions(result));
        assertNull(result.rows().get(0).sampleId());
        assertEquals(Set.of("A", "B", "C"), result.rows().get(1).passingSampleIds());
        assertEquals(3, result.rows().get(1).getSampleCount());
    }

    @Test
    public void lookup_limitReturnsMinOfLimitAndTotal() {
        for (int limit = 0; limit <= 6; limit++) {
            VariantLookupResult result = lookupService.lookup(request("", null, null, ViewMode.CAST, 0, limit));
            assertEquals(Math.min(limit, 4), result.rows().size(), "limit " + limit);
            assertEquals(4, result.totalCount(), "limit " + limit);
        }
    }

    @Test
    public void lookup_offset() {
        assertEquals(List.of(150, 200), positions(lookupService.lookup(request("", null, null, ViewMode.CAST, 1, 2))));
        assertEquals(List.of(400), positions(lookupService.lookup(request("", null, null, ViewMode.CAST, 3, 5))));

        VariantLookupResult pastTheEnd = lookupService.lookup(request("", null, null, ViewMode.CAST, 10, -1));
        assertEquals(List.of(), pastTheEnd.rows());
        assertEquals(4, pastTheEnd.totalCount());
    }

    @Test
    public void lookup_descending() {
        assertEquals(List.of(400, 200, 150, 50), positions(lookupService.lookup(request("", "position", SortDirection.DESC, ViewMode.CAST, 0, -1))));
    }

    @Test
    public void lookup_sortTiesBrokenById() {
        VariantLookupResult result = lookupService.lookup(request("", "chromosome", SortDirection.DESC, ViewMode.CAST, 0, -1));

        assertEquals(List.of(4L, 1L, 2L, 3L), result.rows().stream().map(row -> row.variant().getId()).collect(Collectors.toList()));
    }

    @Test
    public void lookup_melted() {
        VariantLookupResult result = lookupService.lookup(request("GT_TYPE == HET", null, null, ViewMode.MELTED, 0, -1));

        assertEquals(3, result.totalCount());
        assertEquals(List.of("B", "A", "D"), result.rows().stream().map(VariantRow::sampleId).collect(Collectors.toList()));
        assertEquals(List.of(50, 150, 400), positions(result));
    }

    @Test
    public void lookup_meltedRowsPerSample() {
        VariantLookupResult result = lookupService.lookup(request("", null, null, ViewMode.MELTED, 2, 3));

        assertEquals(9, result.totalCount());
        // variant 2 has samples A, B and C
        assertEquals(List.of("A", "B", "C"), result.rows().stream().map(VariantRow::sampleId).collect(Collectors.toList()));
        assertEquals(List.of(150, 150, 150), positions(result));
    }

    @Test
    public void lookup_invalidSortKey() {
        assertThrows(FilterParseException.class, () -> lookupService.lookup(request("", "QUAL", null, ViewMode.CAST, 0, -1)));
        assertThrows(FilterParseException.class, () -> lookupService.lookup(request("", "nope", null, ViewMode.CAST, 0, -1)));
    }

    @Test
    public void lookup_invalidPagination() {
        assertThrows(IllegalArgumentException.class, () -> lookupService.lookup(request("", null, null, ViewMode.CAST, -1, -1)));
        assertThrows(IllegalArgumentException.class, () -> lookupService.lookup(request("", null, null, ViewMode.CAST, 0, -2)));
    }

    @Test
    public void count() {
        assertEquals(2, lookupService.count("QUAL > 50", GENOME));
        assertEquals(0, lookupService.count("QUAL > 500", GENOME));
    }

    private static VariantLookupRequest request(String filter, String sortKey, SortDirection direction, ViewMode viewMode, int offset, int limit) {
        return new VariantLookupRequest(filter, GENOME, sortKey, direction, viewMode, offset, limit);
    }

    private static List<Integer> positions(VariantLookupResult result) {
        return result.rows().stream().map(row -> row.variant().getPosition()).collect(Collectors.toList());
    }
}
