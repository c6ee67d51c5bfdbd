package de.bsommerfeld.sqlserve.server.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.sqlserve.core.config.ServeConfig;
import de.bsommerfeld.sqlserve.db.ConnectionCache;
import de.bsommerfeld.sqlserve.db.MetadataRegistry;
import de.bsommerfeld.sqlserve.server.SampleDatabases;
import de.bsommerfeld.sqlserve.server.ServeModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Round trips through the real server on an ephemeral port, with a Guice
 * injector wired exactly as in production.
 */
class ServeHttpServerTest {

    private static final String ONE_YEAR = "max-age=31536000";

    @TempDir
    Path root;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();

    private ServeHttpServer server;
    private ConnectionCache connections;
    private String sales;

    @BeforeEach
    void setUp() throws IOException {
        SampleDatabases.sales(root.resolve("sales.db"));

        ServeConfig config = new ServeConfig();
        config.getRegistry().setRoot(root.toString());
        config.getServer().setHost("127.0.0.1");
        config.getServer().setPort(0);
        config.getServer().setWorkerThreads(4);

        Injector injector = Guice.createInjector(new ServeModule(config));
        sales = "sales-" + injector.getInstance(MetadataRegistry.class).build(false).lookup("sales").hashPrefix();
        connections = injector.getInstance(ConnectionCache.class);
        server = injector.getInstance(ServeHttpServer.class);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        connections.close();
    }

    // -- Index --

    @Test
    void index_shouldListDatabasesWithCanonicalPaths() throws Exception {
        HttpResponse<String> response = get("/");

        assertEquals(200, response.statusCode());
        assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
        JsonNode body = mapper.readTree(response.body());
        assertTrue(body.get("ok").asBoolean());
        JsonNode db = body.get("databases").get(0);
        assertEquals("sales", db.get("name").asText());
        assertEquals("/" + sales, db.get("path").asText());
        assertEquals(64, db.get("hash").asText().length());
        assertEquals(3, db.get("tables").get("orders").asLong());
    }

    @Test
    void favicon_shouldReturnEmptyOk() throws Exception {
        HttpResponse<String> response = get("/favicon.ico");

        assertEquals(200, response.statusCode());
        assertEquals("", response.body());
    }

    // -- Redirects --

    @Test
    void database_shouldRedirectBareNameToCanonicalPath() throws Exception {
        HttpResponse<String> response = get("/sales");

        assertEquals(302, response.statusCode());
        assertEquals("/" + sales, response.headers().firstValue("Location").orElse(null));
        assertEquals("</" + sales + ">; rel=preload", response.headers().firstValue("Link").orElse(null));
        assertEquals(ONE_YEAR, response.headers().firstValue("Cache-Control").orElse(null));
    }

    @Test
    void row_shouldRedirectStalePrefixKeepingTableAndKey() throws Exception {
        HttpResponse<String> response = get("/sales-0000000/orders/north,2");

        assertEquals(302, response.statusCode());
        assertEquals("/" + sales + "/orders/north,2", response.headers().firstValue("Location").orElse(null));
    }

    @Test
    void database_shouldKeepQueryStringOnRedirect() throws Exception {
        HttpResponse<String> response = get("/sales?sql=select+1");

        assertEquals("/" + sales + "?sql=select+1", response.headers().firstValue("Location").orElse(null));
    }

    // -- Data --

    @Test
    void database_shouldRunCallerSql() throws Exception {
        HttpResponse<String> response = get("/" + sales + "?sql=select+item+from+orders+order+by+id");

        assertEquals(200, response.statusCode());
        assertEquals(ONE_YEAR, response.headers().firstValue("Cache-Control").orElse(null));
        JsonNode body = mapper.readTree(response.body());
        assertTrue(body.get("ok").asBoolean());
        assertEquals("sales", body.get("database").asText());
        assertEquals(sales.substring("sales-".length()), body.get("database_hash").asText());
        assertFalse(body.has("table"));
        assertEquals("item", body.get("columns").get(0).asText());
        assertEquals("apples", body.get("rows").get(0).get(0).asText());
        assertEquals(3, body.get("rows").size());
    }

    @Test
    void database_shouldReturnBadRequestForEngineError() throws Exception {
        HttpResponse<String> response = get("/" + sales + "?sql=select+*+from+nowhere");

        assertEquals(400, response.statusCode());
        assertTrue(response.headers().firstValue("Cache-Control").isEmpty());
        JsonNode body = mapper.readTree(response.body());
        assertFalse(body.get("ok").asBoolean());
        assertTrue(body.get("error").asText().contains("no such table"), body.get("error").asText());
    }

    @Test
    void table_shouldListRowsWithRowPaths() throws Exception {
        JsonNode body = mapper.readTree(get("/" + sales + "/orders").body());

        assertEquals("orders", body.get("table").asText());
        assertEquals(3, body.get("rows").size());
        assertEquals("south+east,1", body.get("row_paths").get(2).asText());
    }

    @Test
    void table_shouldAcceptJsonSuffix() throws Exception {
        assertEquals(200, get("/" + sales + "/orders.json").statusCode());
    }

    @Test
    void row_shouldReturnSingleRowForCompoundKey() throws Exception {
        HttpResponse<String> response = get("/" + sales + "/orders/south+east,1");

        assertEquals(200, response.statusCode());
        JsonNode rows = mapper.readTree(response.body()).get("rows");
        assertEquals(1, rows.size());
        assertEquals("plums", rows.get(0).get(3).asText());
    }

    // -- Errors --

    @Test
    void row_shouldReturnNotFoundForMissingRow() throws Exception {
        HttpResponse<String> response = get("/" + sales + "/orders/west,9");

        assertEquals(404, response.statusCode());
        assertEquals("Record not found: [west, 9]", mapper.readTree(response.body()).get("error").asText());
    }

    @Test
    void table_shouldReturnNotFoundForUnknownTable() throws Exception {
        HttpResponse<String> response = get("/" + sales + "/ghosts");

        assertEquals(404, response.statusCode());
        assertEquals("Table not found: ghosts", mapper.readTree(response.body()).get("error").asText());
    }

    @Test
    void database_shouldReturnNotFoundForUnknownDatabase() throws Exception {
        HttpResponse<String> response = get("/ghost");

        assertEquals(404, response.statusCode());
        assertEquals("Database not found: ghost", mapper.readTree(response.body()).get("error").asText());
    }

    @Test
    void handle_shouldReturnNotFoundForDeepPaths() throws Exception {
        assertEquals(404, get("/" + sales + "/orders/1/extra").statusCode());
    }

    @Test
    void handle_shouldRejectNonGetMethods() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri("/" + sales))
                .POST(HttpRequest.BodyPublishers.ofString("sql=delete+from+orders"))
                .build();

        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(405, response.statusCode());
        assertEquals("GET, HEAD", response.headers().firstValue("Allow").orElse(null));
    }

    @Test
    void stop_shouldBeIdempotent() {
        server.stop();
        server.stop();
        assertFalse(server.isRunning());
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.port() + path);
    }
}
