package com.huntql.service.core.store;

import java.util.List;

/**
 * Backing relational store; the only I/O boundary of the query core. Implementations must be safe for concurrent
 * callers and must honour interruption of the calling thread as well as {@link StoreOptions#timeoutMs()}.
 */
public interface QueryStore {

    /**
     * Runs {@code sql} with {@code $1..$n} bound to {@code params} in order.
     *
     * @return at most {@link StoreOptions#maxRows()} rows
     * @throws StoreException on any store failure
     */
    RowSet runParameterized(String sql, List<Object> params, StoreOptions options);
}
