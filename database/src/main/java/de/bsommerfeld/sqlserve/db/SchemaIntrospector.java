package de.bsommerfeld.sqlserve.db;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the table inventory of a database file. Uses its own short-lived
 * connection, never one from {@link ConnectionCache}.
 */
public class SchemaIntrospector {

    /**
     * Lists user tables in {@code sqlite_master} order with their exact row
     * count. Internal {@code sqlite_*} tables are skipped.
     *
     * @throws SQLException if the file cannot be opened or any table cannot
     *                      be counted; no partial result is returned
     */
    public Map<String, Long> introspect(Path file) throws SQLException {
        try (Connection conn = SqliteFiles.openImmutable(file)) {
            List<String> names = tableNames(conn);
            Map<String, Long> tables = new LinkedHashMap<>();
            for (String table : names) {
                tables.put(table, countRows(conn, table));
            }
            return tables;
        }
    }

    private List<String> tableNames(Connection conn) throws SQLException {
        List<String> names = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(SqlLoader.load("select-user-tables"))) {
            while (rs.next()) {
                names.add(rs.getString(1));
            }
        }
        return names;
    }

    private long countRows(Connection conn, String table) throws SQLException {
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT count(*) FROM " + SqlIdentifiers.quote(table))) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    /**
     * Returns the table's primary-key columns ordered by their position in
     * the key declaration, not by column order. A table declared as
     * {@code (id, region, seq, PRIMARY KEY (region, seq))} yields
     * {@code [region, seq]}. Empty for rowid-only tables.
     */
    public static List<String> primaryKeyColumns(Connection conn, String table) throws SQLException {
        record KeyColumn(String name, int position) {
        }

        List<KeyColumn> keyColumns = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + SqlIdentifiers.quote(table) + ")")) {
            while (rs.next()) {
                int position = rs.getInt("pk");
                if (position > 0) {
                    keyColumns.add(new KeyColumn(rs.getString("name"), position));
                }
            }
        }
        keyColumns.sort(Comparator.comparingInt(KeyColumn::position));
        return keyColumns.stream().map(KeyColumn::name).toList();
    }
}
