package com.bastion.accessservice.domain.query;

/**
 * Paging of list results.
 *
 * @param limit maximum number of results, 0 for all
 */
public record ListQuery(long offset, int limit, boolean ascending) {

    public ListQuery {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
    }

    public static ListQuery unpaged() {
        return new ListQuery(0, 0, true);
    }
}
