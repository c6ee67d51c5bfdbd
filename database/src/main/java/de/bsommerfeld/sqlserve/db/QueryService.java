package de.bsommerfeld.sqlserve.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sqlserve.core.config.ServerConfig;
import de.bsommerfeld.sqlserve.core.domain.DatabaseRecord;
import de.bsommerfeld.sqlserve.core.domain.QueryResult;
import de.bsommerfeld.sqlserve.core.domain.RowSet;
import de.bsommerfeld.sqlserve.core.error.DatabaseAccessException;
import de.bsommerfeld.sqlserve.core.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Read queries against cached handles for the three addressable levels:
 * database, table and row.
 *
 * <p>
 * Engine rejections (bad SQL, attempted writes) come back as
 * {@link QueryResult#error}. Addressing failures are thrown as
 * {@link NotFoundException}; connection failures as
 * {@link DatabaseAccessException}.
 */
@Singleton
public class QueryService {

    private static final Logger LOG = LoggerFactory.getLogger(QueryService.class);
    private static final String ROWID = "rowid";

    private final MetadataRegistry registry;
    private final ConnectionCache connections;
    private final int tableRowLimit;
    private final int queryRowLimit;

    @Inject
    public QueryService(MetadataRegistry registry, ConnectionCache connections, ServerConfig config) {
        this.registry = registry;
        this.connections = connections;
        this.tableRowLimit = config.getTableRowLimit();
        this.queryRowLimit = config.getQueryRowLimit();
    }

    /**
     * Runs caller-supplied SQL. A blank statement lists {@code sqlite_master}.
     * At most {@link ServerConfig#getQueryRowLimit()} rows are materialized.
     */
    public QueryResult databaseQuery(String name, String sql) {
        String statement = sql == null || sql.isBlank() ? SqlLoader.load("select-sqlite-master") : sql;
        return run(name, statement, List.of(), queryRowLimit);
    }

    /**
     * Returns the first rows of {@code table}, capped by the configured limit.
     *
     * @throws NotFoundException if the table is not part of the database
     */
    public QueryResult tableRows(String name, String table) {
        requireTable(name, table);
        return run(name, "SELECT * FROM " + SqlIdentifiers.quote(table) + " LIMIT " + tableRowLimit, List.of(), 0);
    }

    /**
     * Looks up one row by its encoded primary key. Tables without a declared
     * key are addressed by {@code rowid}.
     *
     * @throws NotFoundException if the table is unknown, the key has the
     *                           wrong number of values, or no row matches
     */
    public QueryResult row(String name, String table, String pkPath) {
        requireTable(name, table);
        ConnectionHandle handle = connections.get(name);

        List<String> keyColumns;
        try {
            keyColumns = handle.primaryKeyColumns(table);
        } catch (SQLException e) {
            return engineError(name, e);
        }
        List<String> values = CompoundKeyCodec.decode(pkPath);
        List<?> bindings = values;
        if (keyColumns.isEmpty()) {
            keyColumns = List.of(ROWID);
            bindings = rowidBinding(values);
        }
        if (values.size() != keyColumns.size())
            throw new NotFoundException("Record not found: " + values);

        StringJoiner where = new StringJoiner(" AND ");
        for (String column : keyColumns) {
            where.add(SqlIdentifiers.quote(column) + " = ?");
        }
        String sql = "SELECT * FROM " + SqlIdentifiers.quote(table) + " WHERE " + where;

        QueryResult result = run(handle, sql, bindings, 0);
        if (result.isOk() && result.rows().isEmpty())
            throw new NotFoundException("Record not found: " + values);
        return result;
    }

    /**
     * Encodes the row path of every row in {@code rows}, in row order. Empty
     * when the table has no declared primary key or the key columns are not
     * all part of the result. A row whose key holds NULL or a blob gets a
     * {@code null} path.
     */
    public Optional<List<String>> rowPaths(String name, String table, RowSet rows) {
        List<String> keyColumns;
        try {
            keyColumns = connections.get(name).primaryKeyColumns(table);
        } catch (SQLException e) {
            LOG.debug("No key columns for {}/{}: {}", name, table, e.getMessage());
            return Optional.empty();
        }
        if (keyColumns.isEmpty() || !rows.columns().containsAll(keyColumns))
            return Optional.empty();

        List<String> paths = new ArrayList<>(rows.size());
        for (List<Object> values : rows.rows()) {
            Map<String, Object> byColumn = new HashMap<>();
            for (int i = 0; i < rows.columns().size(); i++) {
                byColumn.put(rows.columns().get(i), values.get(i));
            }
            try {
                paths.add(CompoundKeyCodec.encode(byColumn, keyColumns));
            } catch (IllegalArgumentException e) {
                // NULL or blob key value: row is not addressable
                paths.add(null);
            }
        }
        return Optional.of(paths);
    }

    private static List<Long> rowidBinding(List<String> values) {
        if (values.size() != 1)
            throw new NotFoundException("Record not found: " + values);
        try {
            return List.of(Long.parseLong(values.get(0)));
        } catch (NumberFormatException e) {
            throw new NotFoundException("Record not found: " + values);
        }
    }

    private void requireTable(String name, String table) {
        DatabaseRecord record = registry.lookup(name);
        if (!record.hasTable(table))
            throw new NotFoundException("Table not found: " + table);
    }

    private QueryResult run(String name, String sql, List<?> params, int maxRows) {
        return run(connections.get(name), sql, params, maxRows);
    }

    private QueryResult run(ConnectionHandle handle, String sql, List<?> params, int maxRows) {
        try {
            RowSet rows = handle.query(sql, params, maxRows);
            LOG.debug("[{}] {} -> {} row(s)", handle.name(), sql, rows.size());
            return QueryResult.ok(rows);
        } catch (SQLException e) {
            return engineError(handle.name(), e);
        }
    }

    private static QueryResult engineError(String name, SQLException e) {
        LOG.debug("[{}] Query rejected: {}", name, e.getMessage());
        return QueryResult.error(e.getMessage());
    }
}
