package com.flagship.restaurant_ledger.common;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class PageResult<T> {

    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final int MAX_PAGE_SIZE = 1000;

    List<T> items;
    int page;
    int pageSize;
    long totalItems;
    int totalPages;

    public static int clampPage(Integer page) {
        return page == null || page < 1 ? 1 : page;
    }

    /**
     * Clamps a requested page size to [1, 1000]; absent means 100.
     */
    public static int clampPageSize(Integer pageSize) {
        if (pageSize == null) {
            return DEFAULT_PAGE_SIZE;
        }
        return Math.max(1, Math.min(MAX_PAGE_SIZE, pageSize));
    }

    public static <T> PageResult<T> of(List<T> items, int page, int pageSize, long totalItems) {
        int totalPages = (int) ((totalItems + pageSize - 1) / pageSize);
        return PageResult.<T>builder()
                .items(items)
                .page(page)
                .pageSize(pageSize)
                .totalItems(totalItems)
                .totalPages(totalPages)
                .build();
    }
}
