package de.bsommerfeld.sqlserve.db;

import org.sqlite.SQLiteConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens database files strictly read-only in SQLite's immutable mode.
 *
 * <p>
 * Immutable mode skips all locking and change detection: SQLite assumes the
 * file never changes while the connection is open. Served files must
 * therefore not be modified once they are placed in the root directory; a
 * modification after open leaves existing connections reading a stale (or
 * inconsistent) image.
 */
public final class SqliteFiles {

    private SqliteFiles() {
    }

    /**
     * @throws SQLException if the file does not exist or the driver refuses
     *                      to open it. The file is never created.
     */
    public static Connection openImmutable(Path file) throws SQLException {
        if (!Files.isRegularFile(file)) {
            throw new SQLException("Database file not found: " + file);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        return DriverManager.getConnection(immutableUrl(file), config.toProperties());
    }

    /** {@code jdbc:sqlite:file:///abs/path.db?immutable=1} */
    static String immutableUrl(Path file) {
        return "jdbc:sqlite:" + file.toAbsolutePath().toUri() + "?immutable=1";
    }
}
