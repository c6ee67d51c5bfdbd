package de.bsommerfeld.sqlserve.core.error;

/**
 * I/O or driver failure while fingerprinting, introspecting, persisting the
 * snapshot or opening a connection.
 */
public class DatabaseAccessException extends RuntimeException {

    public DatabaseAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
