package de.bsommerfeld.sqlserve.db;

import de.bsommerfeld.sqlserve.core.domain.RowSet;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * A read-only, immutable-mode connection bound to the file it was opened on.
 * Owned by {@link ConnectionCache}; callers only issue reads through it.
 *
 * <p>
 * Queries on one handle are serialized and fully materialized into a
 * {@link RowSet} before the lock is released, so no JDBC cursor ever escapes.
 */
public class ConnectionHandle implements AutoCloseable {

    private final String name;
    private final Path file;
    private final Connection connection;

    public ConnectionHandle(String name, Path file, Connection connection) {
        this.name = name;
        this.file = file;
        this.connection = connection;
    }

    /**
     * Runs {@code sql} with positional {@code params}.
     *
     * @param maxRows row cap, {@code 0} for unlimited
     * @throws SQLException the engine's rejection, message unchanged
     */
    public synchronized RowSet query(String sql, List<?> params, int maxRows) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            if (maxRows > 0)
                ps.setMaxRows(maxRows);
            try (ResultSet rs = ps.executeQuery()) {
                return materialize(rs);
            }
        }
    }

    /**
     * @see SchemaIntrospector#primaryKeyColumns(Connection, String)
     */
    public synchronized List<String> primaryKeyColumns(String table) throws SQLException {
        return SchemaIntrospector.primaryKeyColumns(connection, table);
    }

    private static RowSet materialize(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int width = meta.getColumnCount();
        List<String> columns = new ArrayList<>(width);
        for (int i = 1; i <= width; i++) {
            columns.add(meta.getColumnLabel(i));
        }

        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> row = new ArrayList<>(width);
            for (int i = 1; i <= width; i++) {
                row.add(rs.getObject(i));
            }
            rows.add(row);
        }
        return new RowSet(columns, rows);
    }

    public String name() {
        return name;
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized void close() throws SQLException {
        connection.close();
    }
}
