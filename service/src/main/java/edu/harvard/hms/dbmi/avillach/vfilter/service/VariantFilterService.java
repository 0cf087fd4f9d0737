package edu.harvard.hms.dbmi.avillach.vfilter.service;

import edu.harvard.hms.dbmi.avillach.vfilter.data.query.SampleScope;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.VariantLookupRequest;
import edu.harvard.hms.dbmi.avillach.vfilter.processing.filter.FilterEvalResult;
import edu.harvard.hms.dbmi.avillach.vfilter.processing.filter.VariantFilterEvaluator;
import edu.harvard.hms.dbmi.avillach.vfilter.processing.lookup.VariantLookupResult;
import edu.harvard.hms.dbmi.avillach.vfilter.processing.lookup.VariantLookupService;
import edu.harvard.hms.dbmi.avillach.vfilter.processing.lookup.VariantRow;
import edu.harvard.hms.dbmi.avillach.vfilter.service.util.PaginatedSearchResult;
import edu.harvard.hms.dbmi.avillach.vfilter.service.util.Paginator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Entry point for callers embedding the filter engine: evaluation, lookups, counts and page based lookups.
 */
@Service
public class VariantFilterService {

    private static final Logger log = LoggerFactory.getLogger(VariantFilterService.class);

    private final VariantFilterEvaluator variantFilterEvaluator;

    private final VariantLookupService variantLookupService;

    private final Paginator paginator;

    @Autowired
    public VariantFilterService(VariantFilterEvaluator variantFilterEvaluator, VariantLookupService variantLookupService, Paginator paginator) {
        this.variantFilterEvaluator = variantFilterEvaluator;
        this.variantLookupService = variantLookupService;
        this.paginator = paginator;
    }

    public FilterEvalResult evaluate(String filterString, String referenceGenomeId, SampleScope scope) {
        return variantFilterEvaluator.evaluate(filterString, referenceGenomeId, scope);
    }

    public VariantLookupResult lookup(VariantLookupRequest request) {
        return variantLookupService.lookup(request);
    }

    public int count(String filterString, String referenceGenomeId) {
        return variantLookupService.count(filterString, referenceGenomeId);
    }

    /**
     * Looks up the rows of one page. The request's own offset and limit are ignored.
     *
     * @param page the page to select, the first page is 1
     * @param size the size of a page to select, minimum 1
     */
    public PaginatedSearchResult<VariantRow> lookupPage(VariantLookupRequest request, int page, int size) {
        paginator.validate(page, size);
        VariantLookupRequest unpaged = new VariantLookupRequest(
            request.filterString(), request.referenceGenomeId(), request.sortKey(), request.sortDirection(), request.viewMode(), 0,
            VariantLookupRequest.NO_LIMIT
        );
        VariantLookupResult result = variantLookupService.lookup(unpaged);
        log.debug("Selecting page " + page + " of size " + size + " from " + result.totalCount() + " rows");
        return paginator.paginate(result.rows(), page, size);
    }
}
