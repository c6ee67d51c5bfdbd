package de.bsommerfeld.sqlserve.db;

/**
 * Quoting for identifiers spliced into SQL text.
 */
final class SqlIdentifiers {

    private SqlIdentifiers() {
    }

    /** {@code my "table"} becomes {@code "my ""table"""}. */
    static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }
}
