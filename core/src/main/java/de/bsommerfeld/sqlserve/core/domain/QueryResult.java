package de.bsommerfeld.sqlserve.core.domain;

import java.util.Objects;

/**
 * Either a {@link RowSet} or a {@link QueryError}, never both. Renderers
 * branch on {@link #isOk()}.
 */
public final class QueryResult {

    private final RowSet rows;
    private final QueryError error;

    private QueryResult(RowSet rows, QueryError error) {
        this.rows = rows;
        this.error = error;
    }

    public static QueryResult ok(RowSet rows) {
        return new QueryResult(Objects.requireNonNull(rows, "rows"), null);
    }

    public static QueryResult error(String message) {
        return new QueryResult(null, new QueryError(message));
    }

    public boolean isOk() {
        return rows != null;
    }

    /**
     * @throws IllegalStateException if this result carries an error
     */
    public RowSet rows() {
        if (rows == null)
            throw new IllegalStateException("Query failed: " + error.message());
        return rows;
    }

    /**
     * @throws IllegalStateException if this result carries rows
     */
    public QueryError error() {
        if (error == null)
            throw new IllegalStateException("Query succeeded, no error present");
        return error;
    }

    @Override
    public String toString() {
        return isOk() ? "QueryResult[ok, rows=" + rows.size() + "]" : "QueryResult[error=" + error.message() + "]";
    }
}
