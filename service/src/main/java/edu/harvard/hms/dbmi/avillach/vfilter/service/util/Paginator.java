package edu.harvard.hms.dbmi.avillach.vfilter.service.util;

import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class Paginator {

    /**
     * Creates a paginated search result with the specified page from a list
     *
     * @param list the list from which to select a page
     * @param page the page to select, the first page is 1
     * @param size the size of a page to select, minimum 1
     * @return A paginated search result containing the specified page
     */
    public <T> PaginatedSearchResult<T> paginate(List<T> list, int page, int size) {
        validate(page, size);
        int start = (int) Math.min((long) (page - 1) * size, list.size());
        int end = (int) Math.min((long) page * size, list.size());
        return new PaginatedSearchResult<>(List.copyOf(list.subList(start, end)), page, list.size());
    }

    public void validate(int page, int size) {
        if (page < 1) {
            throw new IllegalArgumentException("Page must be greater than 0");
        }
        if (size < 1) {
            throw new IllegalArgumentException("Size must be greater than 0");
        }
    }
}
