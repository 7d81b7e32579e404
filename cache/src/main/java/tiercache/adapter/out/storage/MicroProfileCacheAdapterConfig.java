package tiercache.adapter.out.storage;

import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;

import tiercache.spi.CacheAdapterConfig;

/**
 * MicroProfile Config implementation of CacheAdapterConfig.
 *
 * <p>Provides access to application properties for cache store providers.
 */
@ApplicationScoped
public class MicroProfileCacheAdapterConfig implements CacheAdapterConfig {

    private final Config config;

    @Inject
    public MicroProfileCacheAdapterConfig(Config config) {
        this.config = config;
    }

    @Override
    public Optional<String> get(String key) {
        return config.getOptionalValue(key, String.class);
    }

    @Override
    public String getOrDefault(String key, String defaultValue) {
        return config.getOptionalValue(key, String.class).orElse(defaultValue);
    }

    @Override
    public Optional<Duration> getDuration(String key) {
        return config.getOptionalValue(key, String.class).map(Duration::parse);
    }
}
