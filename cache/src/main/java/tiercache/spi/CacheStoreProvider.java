package tiercache.spi;

import tiercache.core.port.out.CacheStore;
import tiercache.core.service.ExpirationPolicy;

/**
 * Service Provider Interface for cache store implementations.
 *
 * <p>Providers are discovered with {@link java.util.ServiceLoader}. The
 * application picks one with {@code tiercache.backend={name}}; without that
 * setting the highest-priority available provider wins.
 */
public interface CacheStoreProvider {

    /**
     * Unique name identifying this provider.
     *
     * <p>Used in configuration: tiercache.backend={name}
     *
     * @return The provider name
     */
    String name();

    /**
     * Human-readable description of this provider.
     *
     * @return Description for logging and diagnostics
     */
    default String description() {
        return name() + " cache store provider";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     *
     * <p>Higher values = higher priority.
     *
     * @return The provider priority
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider is available (dependencies present, etc.)
     *
     * @return true if the provider can be used
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the store.
     *
     * <p>Called once per cache. The returned instance must be thread-safe.
     *
     * @param config Access to configuration properties
     * @param policy TTL and clock the cache runs with
     * @return Store implementation
     * @throws CacheProviderException if required settings are missing
     */
    CacheStore createStore(CacheAdapterConfig config, ExpirationPolicy policy);
}
