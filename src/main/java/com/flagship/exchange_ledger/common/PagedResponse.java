package com.flagship.exchange_ledger.common;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * One page of a larger result set. Page numbers are 1-based.
 */
@Value
public class PagedResponse<T> {
    @JsonProperty("data")
    List<T> data;

    @JsonProperty("page")
    int pageNumber;

    @JsonProperty("page_size")
    int pageSize;

    @JsonProperty("total_records")
    long totalRecords;

    @JsonProperty("total_pages")
    int totalPages;

    public static <T> PagedResponse<T> of(List<T> data, int pageNumber, int pageSize, long totalRecords) {
        int totalPages = (int) Math.ceil((double) totalRecords / pageSize);
        return new PagedResponse<>(data, pageNumber, pageSize, totalRecords, totalPages);
    }
}
