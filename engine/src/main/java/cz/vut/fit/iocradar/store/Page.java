package cz.vut.fit.iocradar.store;

import cz.vut.fit.iocradar.models.Indicator;

import java.util.List;

/**
 * One page of query results.
 *
 * @param items    The records on the page.
 * @param total    The number of records matching the query.
 * @param page     The 1-based page number.
 * @param pageSize The requested page size.
 * @param pages    The number of pages, {@code ceil(total / pageSize)}.
 */
public record Page(List<Indicator> items, long total, int page, int pageSize, int pages) {
    public Page {
        items = List.copyOf(items);
    }
}
