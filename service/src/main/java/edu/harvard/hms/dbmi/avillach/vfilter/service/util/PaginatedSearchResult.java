package edu.harvard.hms.dbmi.avillach.vfilter.service.util;

import java.util.List;

public record PaginatedSearchResult<T>(List<T> results, int page, int total) {
}
