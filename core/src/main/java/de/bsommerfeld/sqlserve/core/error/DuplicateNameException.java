package de.bsommerfeld.sqlserve.core.error;

import java.nio.file.Path;

/**
 * Two discovered files share a stem, e.g. {@code sales.db} and
 * {@code sales.sqlite}. Aborts the whole registry build.
 */
public class DuplicateNameException extends RuntimeException {

    private final String name;

    public DuplicateNameException(String name, Path first, Path second) {
        super("Multiple files with same stem " + name + ": " + first.getFileName() + ", " + second.getFileName());
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
