package de.bsommerfeld.sqlserve.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.sqlserve.core.config.RegistryConfig;
import de.bsommerfeld.sqlserve.core.config.ServeConfig;
import de.bsommerfeld.sqlserve.core.config.ServerConfig;

/**
 * Binds an already loaded {@link ServeConfig} and its sections. Everything
 * else ({@code MetadataRegistry}, {@code ConnectionCache}, {@code QueryService},
 * the HTTP server) is a just-in-time {@code @Singleton}.
 */
public class ServeModule extends AbstractModule {

    private final ServeConfig config;

    public ServeModule(ServeConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(ServeConfig.class).toInstance(config);
        bind(ServerConfig.class).toInstance(config.getServer());
        bind(RegistryConfig.class).toInstance(config.getRegistry());
    }

    @Provides
    @Singleton
    ObjectMapper objectMapper() {
        return new ObjectMapper();
    }
}
