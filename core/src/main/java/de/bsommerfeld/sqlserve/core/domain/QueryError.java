package de.bsommerfeld.sqlserve.core.domain;

/**
 * Engine rejection of a caller-supplied query. The message is passed through
 * from the driver unchanged.
 */
public record QueryError(String message) {
}
