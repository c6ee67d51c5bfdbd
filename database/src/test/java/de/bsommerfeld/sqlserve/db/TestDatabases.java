package de.bsommerfeld.sqlserve.db;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Writes throwaway SQLite files for tests through a normal read-write
 * connection.
 */
final class TestDatabases {

    private TestDatabases() {
    }

    static Path create(Path file, String... statements) {
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath());
                Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to create test database " + file, e);
        }
        return file;
    }

    /** Two tables: {@code orders} (3 rows, compound key) and {@code notes} (rowid only, 1 row). */
    static Path sales(Path file) {
        return create(file,
                "CREATE TABLE orders (id INTEGER, region TEXT, seq INTEGER, item TEXT, PRIMARY KEY (region, seq))",
                "INSERT INTO orders VALUES (1, 'north', 1, 'apples')",
                "INSERT INTO orders VALUES (2, 'north', 2, 'pears')",
                "INSERT INTO orders VALUES (3, 'south east', 1, 'plums')",
                "CREATE TABLE notes (body TEXT)",
                "INSERT INTO notes VALUES ('first')");
    }
}
