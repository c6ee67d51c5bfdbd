package de.bsommerfeld.sqlserve.db;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens the connection backing a {@link ConnectionHandle}.
 */
@FunctionalInterface
public interface ConnectionOpener {

    ConnectionOpener IMMUTABLE = SqliteFiles::openImmutable;

    Connection open(Path file) throws SQLException;
}
