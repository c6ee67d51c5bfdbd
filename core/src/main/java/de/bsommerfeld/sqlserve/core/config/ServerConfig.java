package de.bsommerfeld.sqlserve.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * HTTP surface settings. Loaded from the {@code [server]} section.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerConfig {

    /** One year, the longest max-age most caches honour. */
    public static final long DEFAULT_CACHE_MAX_AGE = 365L * 24 * 60 * 60;

    @JsonProperty("host")
    private String host = "0.0.0.0";

    @JsonProperty("port")
    private int port = 8006;

    @JsonProperty("worker-threads")
    private int workerThreads = 16;

    @JsonProperty("cache-max-age-seconds")
    private long cacheMaxAgeSeconds = DEFAULT_CACHE_MAX_AGE;

    @JsonProperty("table-row-limit")
    private int tableRowLimit = 20;

    /** Row cap for caller SQL; {@code 0} means unlimited. */
    @JsonProperty("query-row-limit")
    private int queryRowLimit = 1000;

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public long getCacheMaxAgeSeconds() {
        return cacheMaxAgeSeconds;
    }

    public void setCacheMaxAgeSeconds(long cacheMaxAgeSeconds) {
        this.cacheMaxAgeSeconds = cacheMaxAgeSeconds;
    }

    public int getTableRowLimit() {
        return tableRowLimit;
    }

    public void setTableRowLimit(int tableRowLimit) {
        this.tableRowLimit = tableRowLimit;
    }

    public int getQueryRowLimit() {
        return queryRowLimit;
    }

    public void setQueryRowLimit(int queryRowLimit) {
        this.queryRowLimit = queryRowLimit;
    }
}
