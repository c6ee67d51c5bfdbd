package de.bsommerfeld.sqlserve.core.domain;

import java.util.List;

/**
 * A fully materialized query result. Row values are in column order and keep
 * the JDBC driver's Java types ({@code Integer}, {@code Long},
 * {@code Double}, {@code String}, {@code byte[]} or {@code null}).
 */
public record RowSet(List<String> columns, List<List<Object>> rows) {

    public RowSet {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }
}
