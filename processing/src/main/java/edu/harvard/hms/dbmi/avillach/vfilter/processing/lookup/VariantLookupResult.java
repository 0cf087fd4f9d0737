package edu.harvard.hms.dbmi.avillach.vfilter.processing.lookup;

import java.util.List;

/**
 * @param rows       the requested page
 * @param totalCount the number of rows without pagination
 */
public record VariantLookupResult(List<VariantRow> rows, int totalCount) {

    public VariantLookupResult {
        rows = List.copyOf(rows);
    }
}
