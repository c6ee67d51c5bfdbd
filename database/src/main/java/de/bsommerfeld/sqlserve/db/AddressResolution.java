package de.bsommerfeld.sqlserve.db;

import de.bsommerfeld.sqlserve.core.domain.CanonicalAddress;

import java.util.Optional;

/**
 * Outcome of {@link AddressResolver#resolve}: the canonical address, and the
 * path the caller must be sent to when the request did not use it.
 *
 * @param redirectTarget {@code null} when the request was already canonical
 */
public record AddressResolution(CanonicalAddress address, String redirectTarget) {

    public static AddressResolution canonical(CanonicalAddress address) {
        return new AddressResolution(address, null);
    }

    public static AddressResolution redirect(CanonicalAddress address, String target) {
        return new AddressResolution(address, target);
    }

    public boolean isRedirect() {
        return redirectTarget != null;
    }

    public Optional<String> redirect() {
        return Optional.ofNullable(redirectTarget);
    }

    public String name() {
        return address.name();
    }

    public String hashPrefix() {
        return address.hashPrefix();
    }
}
