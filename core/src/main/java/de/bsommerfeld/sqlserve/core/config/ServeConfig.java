package de.bsommerfeld.sqlserve.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of the configuration tree. Every value has a default, so a missing
 * config file yields a runnable setup serving the working directory.
 *
 * @see ConfigLoader
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServeConfig {

    @JsonProperty("server")
    private ServerConfig server = new ServerConfig();

    @JsonProperty("registry")
    private RegistryConfig registry = new RegistryConfig();

    public ServerConfig getServer() {
        return server;
    }

    public RegistryConfig getRegistry() {
        return registry;
    }
}
