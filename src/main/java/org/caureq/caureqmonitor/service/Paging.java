package org.caureq.caureqmonitor.service;

import org.caureq.caureqmonitor.config.AppProps;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/** limit/offset query params -> Pageable, limit clamped to the configured bounds. */
final class Paging {
    private Paging() {}

    static Pageable of(Integer limit, Integer offset, Sort sort, AppProps.QueryProps bounds) {
        int size = (limit == null || limit <= 0 || limit > bounds.maxLimit()) ? bounds.defaultLimit() : limit;
        int off = (offset == null || offset < 0) ? 0 : offset;
        return new OffsetLimitRequest(off, size, sort);
    }
}
