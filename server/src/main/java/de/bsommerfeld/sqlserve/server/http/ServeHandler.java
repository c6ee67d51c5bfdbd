package de.bsommerfeld.sqlserve.server.http;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import de.bsommerfeld.sqlserve.core.domain.DatabaseRecord;
import de.bsommerfeld.sqlserve.core.domain.QueryResult;
import de.bsommerfeld.sqlserve.core.error.NotFoundException;
import de.bsommerfeld.sqlserve.db.AddressResolution;
import de.bsommerfeld.sqlserve.db.AddressResolver;
import de.bsommerfeld.sqlserve.db.MetadataRegistry;
import de.bsommerfeld.sqlserve.db.QueryService;
import de.bsommerfeld.sqlserve.server.json.DataPayload;
import de.bsommerfeld.sqlserve.server.json.ErrorPayload;
import de.bsommerfeld.sqlserve.server.json.IndexPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Routes every request under {@code /}. One call handles one exchange on a
 * worker thread and always closes it.
 *
 * <pre>
 * /                         rebuild registry, list databases
 * /favicon.ico              empty 200
 * /{db}[?sql=...]           caller SQL, default sqlite_master
 * /{db}/{table}             first rows of the table
 * /{db}/{table}/{pk}        one row by encoded primary key
 * </pre>
 *
 * A {@code db} segment without the current hash prefix is answered with a
 * redirect before any query runs.
 */
@Singleton
public class ServeHandler implements HttpHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ServeHandler.class);

    private final MetadataRegistry registry;
    private final AddressResolver resolver;
    private final QueryService queries;
    private final JsonResponder responder;

    @Inject
    public ServeHandler(MetadataRegistry registry, AddressResolver resolver, QueryService queries,
            JsonResponder responder) {
        this.registry = registry;
        this.resolver = resolver;
        this.queries = queries;
        this.responder = responder;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        URI uri = exchange.getRequestURI();
        String method = exchange.getRequestMethod();
        LOG.debug("{} {}", method, uri);
        try {
            if (!"GET".equals(method) && !"HEAD".equals(method)) {
                exchange.getResponseHeaders().set("Allow", "GET, HEAD");
                responder.json(exchange, 405, ErrorPayload.of("Method not allowed: " + method), false);
                return;
            }
            route(exchange, RequestPath.parse(uri.getRawPath()), uri.getRawQuery());
        } catch (NotFoundException e) {
            LOG.debug("404 {}: {}", uri, e.getMessage());
            responder.json(exchange, 404, ErrorPayload.of(e.getMessage()), false);
        } catch (RuntimeException e) {
            LOG.error("Request failed: {} {}", method, uri, e);
            responder.json(exchange, 500, ErrorPayload.of("Internal server error"), false);
        } finally {
            exchange.close();
        }
    }

    private void route(HttpExchange exchange, RequestPath path, String rawQuery) throws IOException {
        switch (path.kind()) {
            case INDEX -> index(exchange);
            case FAVICON -> responder.empty(exchange, 200);
            default -> data(exchange, path, rawQuery);
        }
    }

    private void index(HttpExchange exchange) throws IOException {
        List<DatabaseRecord> records = new ArrayList<>(registry.build(true).records());
        records.sort(Comparator.comparing(DatabaseRecord::name));
        responder.json(exchange, 200, IndexPayload.of(records), false);
    }

    private void data(HttpExchange exchange, RequestPath path, String rawQuery) throws IOException {
        AddressResolution resolution = resolver.resolve(path.database(), path.table(), path.pkPath());
        if (resolution.isRedirect()) {
            String target = rawQuery == null ? resolution.redirectTarget()
                    : resolution.redirectTarget() + "?" + rawQuery;
            LOG.debug("Redirecting {} to {}", exchange.getRequestURI(), target);
            responder.redirect(exchange, target);
            return;
        }

        String name = resolution.name();
        QueryResult result = switch (path.kind()) {
            case DATABASE -> queries.databaseQuery(name, QueryParameters.parse(rawQuery).get("sql").orElse(null));
            case TABLE -> queries.tableRows(name, path.table());
            case ROW -> queries.row(name, path.table(), path.pkPath());
            default -> throw new IllegalStateException("Not a data route: " + path.kind());
        };

        if (!result.isOk()) {
            responder.json(exchange, 400, ErrorPayload.of(result.error().message()), false);
            return;
        }
        List<String> rowPaths = path.kind() == RequestPath.Kind.TABLE
                ? queries.rowPaths(name, path.table(), result.rows()).orElse(null)
                : null;
        responder.json(exchange, 200, DataPayload.of(resolution.address(), path.table(), result.rows(), rowPaths),
                true);
    }
}
