package edu.harvard.hms.dbmi.avillach.vfilter.data.query;

import io.swagger.v3.oas.annotations.media.Schema;

public record VariantLookupRequest(
    @Schema(
        description = "The filter expression to evaluate, empty to match every variant",
        example = "(position > 100) AND (GT_TYPE == HET) in ANY(sample1,sample2)"
    ) String filterString,
    @Schema(description = "The reference genome that all matching variants belong to", requiredMode = Schema.RequiredMode.REQUIRED) String referenceGenomeId,
    @Schema(description = "A variant column to sort by, defaults to position", example = "position") String sortKey,
    @Schema(description = "Sort direction, defaults to ascending") SortDirection sortDirection,
    @Schema(description = "Whether rows are returned per variant or per variant and sample, defaults to CAST") ViewMode viewMode,
    @Schema(description = "Number of rows to skip") int paginationOffset,
    @Schema(description = "Maximum number of rows to return, -1 for no limit") int paginationLimit
) {

    public static final int NO_LIMIT = -1;

    public static final String DEFAULT_SORT_KEY = "position";

    @Override
    public String filterString() {
        return filterString == null ? "" : filterString;
    }

    @Override
    public String sortKey() {
        return sortKey == null || sortKey.isBlank() ? DEFAULT_SORT_KEY : sortKey;
    }

    @Override
    public SortDirection sortDirection() {
        return sortDirection == null ? SortDirection.ASC : sortDirection;
    }

    @Override
    public ViewMode viewMode() {
        return viewMode == null ? ViewMode.CAST : viewMode;
    }

    public static VariantLookupRequest of(String filterString, String referenceGenomeId) {
        return new VariantLookupRequest(filterString, referenceGenomeId, null, null, null, 0, NO_LIMIT);
    }
}
