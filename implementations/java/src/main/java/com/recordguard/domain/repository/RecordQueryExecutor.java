package com.recordguard.domain.repository;

import com.recordguard.domain.model.QueryResult;

/**
 * Execution boundary: runs an approved retrieval query against the record store.
 *
 * <p>Implementations must only ever read, must not keep transactions open
 * across calls, and must report every store failure or timeout as a
 * {@link com.recordguard.application.exceptions.RecordStoreException}.
 */
public interface RecordQueryExecutor {

    QueryResult execute(String query);
}
