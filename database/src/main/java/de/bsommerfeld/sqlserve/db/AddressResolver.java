package de.bsommerfeld.sqlserve.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sqlserve.core.domain.CanonicalAddress;
import de.bsommerfeld.sqlserve.core.domain.DatabaseRecord;
import de.bsommerfeld.sqlserve.core.error.NotFoundException;

/**
 * Turns the database segment of a URL into a {@link CanonicalAddress}.
 *
 * <p>
 * A segment is either {@code name} or {@code name-hashprefix}. Because names
 * may contain hyphens themselves, the last hyphen only separates a hash when
 * the part before it is a registered name; otherwise the whole segment is the
 * name. So with {@code my-data} registered, {@code my-data} resolves to
 * {@code my-data} and {@code my-data-1a2b3c4} to {@code my-data} with a
 * claimed prefix.
 *
 * <p>
 * A missing or stale prefix yields a redirect to
 * {@code /<name>-<prefix>[/<table>[/<pk>]]}. The resolver only reads the
 * digest computed at registry build time; it never touches the file.
 */
@Singleton
public class AddressResolver {

    private final MetadataRegistry registry;

    @Inject
    public AddressResolver(MetadataRegistry registry) {
        this.registry = registry;
    }

    public AddressResolution resolve(String dbSegment) {
        return resolve(dbSegment, null, null);
    }

    public AddressResolution resolve(String dbSegment, String table) {
        return resolve(dbSegment, table, null);
    }

    /**
     * @param dbSegment URL-decoded database segment
     * @param table     URL-decoded table name, re-encoded into the redirect,
     *                  may be null
     * @param pkPath    raw primary-key segment carried into the redirect after
     *                  the table, may be null
     * @throws NotFoundException if neither reading names a registered database
     */
    public AddressResolution resolve(String dbSegment, String table, String pkPath) {
        DatabaseRegistry snapshot = registry.current();

        String name = dbSegment;
        String claimedHash = null;
        int hyphen = dbSegment.lastIndexOf('-');
        if (hyphen >= 0) {
            String candidateName = dbSegment.substring(0, hyphen);
            if (snapshot.contains(candidateName)) {
                name = candidateName;
                claimedHash = dbSegment.substring(hyphen + 1);
            }
        }

        DatabaseRecord record = snapshot.lookup(name);
        CanonicalAddress address = new CanonicalAddress(name, record.hashPrefix());
        if (address.hashPrefix().equals(claimedHash)) {
            return AddressResolution.canonical(address);
        }

        StringBuilder target = new StringBuilder("/")
                .append(PathSegments.encode(name))
                .append('-')
                .append(address.hashPrefix());
        if (table != null) {
            target.append('/').append(PathSegments.encode(table));
            if (pkPath != null)
                target.append('/').append(pkPath);
        }
        return AddressResolution.redirect(address, target.toString());
    }
}
