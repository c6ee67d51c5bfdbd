package de.bsommerfeld.sqlserve.core.domain;

/**
 * The identity a request resolved to. A given pair stays valid forever since
 * the content behind it cannot change without changing the prefix.
 */
public record CanonicalAddress(String name, String hashPrefix) {
}
