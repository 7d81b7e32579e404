package tiercache.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the application cache.
 *
 * <p>Configuration prefix: {@code tiercache}
 *
 * <h2>Configuration Properties</h2>
 * <ul>
 *   <li>{@code tiercache.backend} - Store provider name: memory, file, redis or redis-cluster</li>
 *   <li>{@code tiercache.ttl} - Entry time-to-live; PT0S means entries never expire</li>
 *   <li>{@code tiercache.sweeper.enabled} - Run the background expiry sweeper for local stores</li>
 *   <li>{@code tiercache.metrics.enabled} - Record Micrometer metrics when a registry is present</li>
 * </ul>
 *
 * <p>Store-specific settings ({@code tiercache.file.*}, {@code tiercache.redis.*}) are read by
 * the providers themselves.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code TIERCACHE_BACKEND} - e.g., "redis"</li>
 *   <li>{@code TIERCACHE_TTL} - e.g., "PT5M" for five minutes</li>
 * </ul>
 */
@ConfigMapping(prefix = "tiercache")
public interface CacheConfig {

    /**
     * Store provider to use.
     *
     * @return provider name, or empty to pick the highest-priority available provider
     */
    Optional<String> backend();

    /**
     * TTL applied to every write.
     *
     * @return TTL duration (default: never expire)
     */
    @WithDefault("PT0S")
    Duration ttl();

    /**
     * Expiry sweeper settings.
     */
    SweeperConfig sweeper();

    /**
     * Metrics settings.
     */
    MetricsConfig metrics();

    interface SweeperConfig {

        /**
         * Whether local stores with a positive TTL run a background sweeper.
         *
         * @return true to sweep (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }

    interface MetricsConfig {

        @WithDefault("true")
        boolean enabled();
    }
}
