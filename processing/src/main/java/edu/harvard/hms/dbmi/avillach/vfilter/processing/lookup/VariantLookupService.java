package edu.harvard.hms.dbmi.avillach.vfilter.processing.lookup;

import edu.harvard.hms.dbmi.avillach.vfilter.data.query.SortDirection;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.VariantLookupRequest;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.VariantRecordStore;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.ViewMode;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantColumn;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantRecord;
import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterExecutionException;
import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterParseException;
import edu.harvard.hms.dbmi.avillach.vfilter.processing.filter.FilterCancellation;
import edu.harvard.hms.dbmi.avillach.vfilter.processing.filter.FilterEvalResult;
import edu.harvard.hms.dbmi.avillach.vfilter.processing.filter.VariantFilterEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Evaluates a filter and returns the matching variants as sorted, paginated rows.
 */
@Component
public class VariantLookupService {

    private static final Logger log = LoggerFactory.getLogger(VariantLookupService.class);

    private final VariantFilterEvaluator variantFilterEvaluator;

    private final VariantRecordStore variantRecordStore;

    @Autowired
    public VariantLookupService(VariantFilterEvaluator variantFilterEvaluator, VariantRecordStore variantRecordStore) {
        this.variantFilterEvaluator = variantFilterEvaluator;
        this.variantRecordStore = variantRecordStore;
    }

    public VariantLookupResult lookup(VariantLookupRequest request) {
        return lookup(request, variantFilterEvaluator.newCancellation());
    }

    public VariantLookupResult lookup(VariantLookupRequest request, FilterCancellation cancellation) {
        if (request.paginationOffset() < 0) {
            throw new IllegalArgumentException("Pagination offset must not be negative: " + request.paginationOffset());
        }
        if (request.paginationLimit() < VariantLookupRequest.NO_LIMIT) {
            throw new IllegalArgumentException("Pagination limit must be -1 or more: " + request.paginationLimit());
        }
        VariantColumn sortColumn = VariantColumn.forKey(request.sortKey())
            .orElseThrow(() -> new FilterParseException(request.sortKey(), "Variants can only be sorted by a variant column"));

        FilterEvalResult result =
            variantFilterEvaluator.evaluate(request.filterString(), request.referenceGenomeId(), null, cancellation);
        List<VariantRecord> variants = new ArrayList<>(fetch(request.referenceGenomeId(), result.getVariantIds(), cancellation));
        variants.sort(comparator(sortColumn, request.sortDirection()));

        List<VariantRow> rows = request.viewMode() == ViewMode.MELTED ? melt(variants, result) : cast(variants, result);
        List<VariantRow> page = page(rows, request.paginationOffset(), request.paginationLimit());
        log.debug("Lookup returned " + page.size() + " of " + rows.size() + " " + request.viewMode() + " rows");
        return new VariantLookupResult(page, rows.size());
    }

    /**
     * Number of matching variants, as {@link #lookup} would report in the cast view.
     */
    public int count(String filterString, String referenceGenomeId) {
        return variantFilterEvaluator.evaluate(filterString, referenceGenomeId, null).size();
    }

    private List<VariantRecord> fetch(String referenceGenomeId, Collection<Long> variantIds, FilterCancellation cancellation) {
        cancellation.checkpoint("variant fetch");
        try {
            return variantRecordStore.getVariants(referenceGenomeId, variantIds);
        } catch (RuntimeException e) {
            throw new FilterExecutionException("Unable to fetch " + variantIds.size() + " variants of " + referenceGenomeId, e);
        }
    }

    private static Comparator<VariantRecord> comparator(VariantColumn column, SortDirection direction) {
        Comparator<VariantRecord> byColumn = (left, right) -> compareValues(column.valueOf(left), column.valueOf(right));
        if (direction == SortDirection.DESC) {
            byColumn = byColumn.reversed();
        }
        return byColumn.thenComparingLong(VariantRecord::getId);
    }

    // column values are Longs or Strings, missing values come last in ascending order
    @SuppressWarnings("unchecked")
    private static int compareValues(Object left, Object right) {
        if (left == null || right == null) {
            return left == null ? (right == null ? 0 : 1) : -1;
        }
        return ((Comparable<Object>) left).compareTo(right);
    }

    private static List<VariantRow> cast(List<VariantRecord> variants, FilterEvalResult result) {
        List<VariantRow> rows = new ArrayList<>(variants.size());
        for (VariantRecord variant : variants) {
            rows.add(new VariantRow(variant, null, result.getPassingSampleIds(variant.getId())));
        }
        return rows;
    }

    private static List<VariantRow> melt(List<VariantRecord> variants, FilterEvalResult result) {
        List<VariantRow> rows = new ArrayList<>();
        for (VariantRecord variant : variants) {
            SortedSet<String> sampleIds = new TreeSet<>(result.getPassingSampleIds(variant.getId()));
            if (sampleIds.isEmpty()) {
                // variants without passing samples still get a row
                rows.add(new VariantRow(variant, null, Set.of()));
            }
            for (String sampleId : sampleIds) {
                rows.add(new VariantRow(variant, sampleId, Set.of(sampleId)));
            }
        }
        return rows;
    }

    private static List<VariantRow> page(List<VariantRow> rows, int offset, int limit) {
        if (offset >= rows.size()) {
            return List.of();
        }
        int end = limit == VariantLookupRequest.NO_LIMIT ? rows.size() : (int) Math.min((long) offset + limit, rows.size());
        return rows.subList(offset, end);
    }
}
