package com.wangbin.hostkeeper.core.module.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaginationTest {

    @Test
    void readsPageAfterOffset() {
        Pagination page = Pagination.from(List.of("unit", "filter", "3", "50"), 2);

        assertEquals(3, page.pageNumber());
        assertEquals(50, page.pageSize());
        assertEquals(150, page.tailLines());
        assertFalse(page.isFirstPage());
    }

    @Test
    void missingOrInvalidValuesUseDefaults() {
        assertEquals(new Pagination(1, Pagination.DEFAULT_PAGE_SIZE), Pagination.from(List.of(), 2));
        assertEquals(new Pagination(1, Pagination.DEFAULT_PAGE_SIZE), Pagination.from(List.of("a", "b", "x", "-5"), 2));
        assertEquals(new Pagination(1, Pagination.DEFAULT_PAGE_SIZE), Pagination.from(null, 0));
    }

    @Test
    void oversizedPageIsClampedAndRejected() {
        Pagination page = Pagination.from(List.of("all", "", "1000000", "1000000"), 2);

        assertEquals(Integer.MAX_VALUE, page.tailLines());
        assertTrue(page.validate().isPresent());
        assertTrue(new Pagination(3, 50).validate().isEmpty());
    }
}
