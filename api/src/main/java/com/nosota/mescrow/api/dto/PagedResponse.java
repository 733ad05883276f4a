package com.nosota.mescrow.api.dto;

import java.util.List;

/**
 * One page of results.
 *
 * @param data         Records of the current page
 * @param pageNumber   Current page number (0-indexed)
 * @param pageSize     Maximum number of records per page
 * @param totalRecords Total number of records across all pages
 */
public record PagedResponse<T>(
        List<T> data,
        int pageNumber,
        int pageSize,
        long totalRecords
) {
    public int totalPages() {
        return pageSize == 0 ? 0 : (int) Math.ceil((double) totalRecords / pageSize);
    }
}
