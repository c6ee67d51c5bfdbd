package de.bsommerfeld.sqlserve.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sqlserve.core.domain.DatabaseRecord;
import de.bsommerfeld.sqlserve.core.error.DatabaseAccessException;
import de.bsommerfeld.sqlserve.core.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide cache of {@link ConnectionHandle}s keyed by database name.
 *
 * <p>
 * A handle is opened on the first request for its name and kept until
 * {@link #close()}. The check-open-insert sequence runs inside
 * {@link ConcurrentHashMap#computeIfAbsent}, so concurrent first requests for
 * the same name open exactly one connection and all observe the same handle.
 *
 * <p>
 * Handles are never refreshed: if the registry is rebuilt with a new digest
 * for a name, the cached handle keeps serving the file image it opened.
 */
@Singleton
public class ConnectionCache implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionCache.class);

    private final MetadataRegistry registry;
    private final ConnectionOpener opener;
    private final Map<String, ConnectionHandle> handles = new ConcurrentHashMap<>();

    @Inject
    public ConnectionCache(MetadataRegistry registry) {
        this(registry, ConnectionOpener.IMMUTABLE);
    }

    ConnectionCache(MetadataRegistry registry, ConnectionOpener opener) {
        this.registry = registry;
        this.opener = opener;
    }

    /**
     * Returns the handle for {@code name}, opening it on first use.
     *
     * @throws NotFoundException       if the registry does not know the name
     * @throws DatabaseAccessException if the file cannot be opened; nothing
     *                                 is cached and the next call retries
     */
    public ConnectionHandle get(String name) {
        ConnectionHandle cached = handles.get(name);
        if (cached != null)
            return cached;
        return handles.computeIfAbsent(name, this::open);
    }

    private ConnectionHandle open(String name) {
        DatabaseRegistry snapshot = registry.current();
        DatabaseRecord record = snapshot.lookup(name);
        Path file = snapshot.pathOf(record);
        try {
            Connection connection = opener.open(file);
            LOG.info("Opened immutable connection for {} ({})", name, file.getFileName());
            return new ConnectionHandle(name, file, connection);
        } catch (SQLException e) {
            throw new DatabaseAccessException("Failed to open " + file, e);
        }
    }

    public boolean isOpen(String name) {
        return handles.containsKey(name);
    }

    public int size() {
        return handles.size();
    }

    /**
     * Closes every cached handle. Failures are logged so that one broken
     * handle does not keep the others open.
     */
    @Override
    public void close() {
        for (ConnectionHandle handle : handles.values()) {
            try {
                handle.close();
            } catch (SQLException e) {
                LOG.warn("Failed to close connection for {}", handle.name(), e);
            }
        }
        handles.clear();
        LOG.info("Connection cache closed.");
    }
}
