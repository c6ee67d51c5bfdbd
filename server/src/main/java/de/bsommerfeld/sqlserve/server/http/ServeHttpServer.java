package de.bsommerfeld.sqlserve.server.http;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.sun.net.httpserver.HttpServer;
import de.bsommerfeld.sqlserve.core.config.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The JDK HTTP server bound to the configured address, dispatching every
 * request to {@link ServeHandler} on a fixed worker pool.
 */
@Singleton
public class ServeHttpServer {

    private static final Logger LOG = LoggerFactory.getLogger(ServeHttpServer.class);
    private static final int STOP_DELAY_SECONDS = 1;

    private final ServerConfig config;
    private final ServeHandler handler;

    private HttpServer server;
    private ExecutorService workers;

    @Inject
    public ServeHttpServer(ServerConfig config, ServeHandler handler) {
        this.config = config;
        this.handler = handler;
    }

    /**
     * Binds and starts serving. A configured port of {@code 0} binds an
     * ephemeral port, see {@link #port()}.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized void start() throws IOException {
        if (server != null)
            throw new IllegalStateException("Server already started");

        HttpServer created = HttpServer.create(new InetSocketAddress(config.getHost(), config.getPort()), 0);
        workers = Executors.newFixedThreadPool(config.getWorkerThreads(), new WorkerThreadFactory());
        created.setExecutor(workers);
        created.createContext("/", handler);
        created.start();
        server = created;
        LOG.info("Serving on http://{}:{} with {} worker thread(s)", config.getHost(), port(),
                config.getWorkerThreads());
    }

    /** The bound port. */
    public synchronized int port() {
        if (server == null)
            throw new IllegalStateException("Server not started");
        return server.getAddress().getPort();
    }

    public synchronized boolean isRunning() {
        return server != null;
    }

    /** Stops accepting requests and drains the worker pool. No-op when stopped. */
    public synchronized void stop() {
        if (server == null)
            return;
        server.stop(STOP_DELAY_SECONDS);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(STOP_DELAY_SECONDS, TimeUnit.SECONDS))
                workers.shutdownNow();
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        server = null;
        workers = null;
        LOG.info("Server stopped");
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "sqlserve-http-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
