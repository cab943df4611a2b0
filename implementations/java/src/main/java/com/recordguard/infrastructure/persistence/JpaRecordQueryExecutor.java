package com.recordguard.infrastructure.persistence;

import com.recordguard.application.exceptions.RecordStoreException;
import com.recordguard.config.RecordGuardProperties;
import com.recordguard.domain.model.QueryResult;
import com.recordguard.domain.repository.RecordQueryExecutor;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Executes approved queries as native SQL on a read-only transaction.
 *
 * <p>Only statements that already passed the scope gate reach this class; it
 * still refuses anything that is not a SELECT.
 */
@Repository
@Slf4j
public class JpaRecordQueryExecutor implements RecordQueryExecutor {

    static final String TIMEOUT_HINT = "jakarta.persistence.query.timeout";

    @PersistenceContext
    private EntityManager entityManager;

    private final int queryTimeoutMillis;

    public JpaRecordQueryExecutor(RecordGuardProperties properties) {
        this.queryTimeoutMillis = (int) properties.getStore().getQueryTimeout().toMillis();
    }

    @Override
    @Transactional(readOnly = true)
    public QueryResult execute(String query) {
        if (query == null || !query.trim().toLowerCase(Locale.ROOT).startsWith("select")) {
            throw new RecordStoreException("Refusing to execute a statement that is not a SELECT");
        }
        List<?> rows;
        try {
            Query nativeQuery = entityManager.createNativeQuery(query);
            nativeQuery.setHint(TIMEOUT_HINT, queryTimeoutMillis);
            rows = nativeQuery.getResultList();
        } catch (RuntimeException e) {
            log.warn("Query execution failed: {}", e.getMessage());
            throw new RecordStoreException("Query execution failed", e);
        }
        log.debug("Query returned {} row(s)", rows.size());
        return toResult(rows);
    }

    static QueryResult toResult(List<?> rows) {
        if (rows.isEmpty()) {
            return QueryResult.empty();
        }
        int columnCount = rows.get(0) instanceof Object[] ? ((Object[]) rows.get(0)).length : 1;
        List<List<String>> cells = new ArrayList<>(rows.size());
        for (Object row : rows) {
            List<String> values = new ArrayList<>(columnCount);
            if (row instanceof Object[]) {
                for (Object column : (Object[]) row) {
                    values.add(column == null ? null : column.toString());
                }
            } else {
                values.add(row == null ? null : row.toString());
            }
            cells.add(values);
        }
        return new QueryResult(columnCount, cells);
    }
}
