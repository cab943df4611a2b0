package com.recordguard.domain.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tabular or scalar result of one executed query.
 *
 * <p>Cells are already stringified; {@code null} marks an absent value.
 */
@Value
public class QueryResult {

    public static final String NO_RESULTS = "No results found.";
    public static final String NO_DATA = "No data available";
    public static final String ABSENT = "N/A";
    public static final String COLUMN_DELIMITER = " | ";

    int columnCount;
    List<List<String>> rows;

    public QueryResult(int columnCount, List<List<String>> rows) {
        this.columnCount = columnCount;
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static QueryResult empty() {
        return new QueryResult(0, List.of());
    }

    public int getRowCount() {
        return rows.size();
    }

    /**
     * Render the result the way the execution boundary hands it to the
     * sanitization stage.
     */
    public String render() {
        if (rows.isEmpty()) {
            return NO_RESULTS;
        }
        if (columnCount == 1) {
            return rows.stream()
                .map(row -> row.get(0) == null ? NO_DATA : row.get(0))
                .collect(Collectors.joining("\n"));
        }
        return rows.stream()
            .map(row -> row.stream()
                .map(cell -> cell == null ? ABSENT : cell)
                .collect(Collectors.joining(COLUMN_DELIMITER)))
            .collect(Collectors.joining("\n"));
    }
}
