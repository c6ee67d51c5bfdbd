package de.bsommerfeld.sqlserve.server.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import de.bsommerfeld.sqlserve.core.config.ServerConfig;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes responses with the headers every client relies on: JSON bodies are
 * CORS-open, and anything addressed by a canonical hash prefix is marked
 * cacheable for {@link ServerConfig#getCacheMaxAgeSeconds()}.
 */
@Singleton
public class JsonResponder {

    static final String JSON_TYPE = "application/json; charset=utf-8";

    private final ObjectMapper mapper;
    private final String cacheControl;

    @Inject
    public JsonResponder(ObjectMapper mapper, ServerConfig config) {
        this.mapper = mapper;
        this.cacheControl = "max-age=" + config.getCacheMaxAgeSeconds();
    }

    public void json(HttpExchange exchange, int status, Object payload, boolean cacheable) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        Headers headers = exchange.getResponseHeaders();
        headers.set("Content-Type", JSON_TYPE);
        headers.set("Access-Control-Allow-Origin", "*");
        if (cacheable)
            headers.set("Cache-Control", cacheControl);
        send(exchange, status, body);
    }

    /** 302 to {@code target} with a preload hint for the same URL. */
    public void redirect(HttpExchange exchange, String target) throws IOException {
        Headers headers = exchange.getResponseHeaders();
        headers.set("Location", target);
        headers.set("Link", "<" + target + ">; rel=preload");
        headers.set("Cache-Control", cacheControl);
        exchange.sendResponseHeaders(302, -1);
    }

    public void empty(HttpExchange exchange, int status) throws IOException {
        exchange.sendResponseHeaders(status, -1);
    }

    private static void send(HttpExchange exchange, int status, byte[] body) throws IOException {
        if ("HEAD".equals(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(status, -1);
            return;
        }
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }
}
