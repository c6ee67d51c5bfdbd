package de.bsommerfeld.sqlserve.core.error;

/**
 * A database, table or row addressed by a request does not exist in the
 * current registry or table. Never retried.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
