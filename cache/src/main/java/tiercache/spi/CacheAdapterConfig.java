package tiercache.spi;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Configuration access for cache store providers.
 *
 * <p>Providers use this to read their settings without coupling to a specific
 * configuration framework.
 */
public interface CacheAdapterConfig {

    /**
     * Get an optional configuration value.
     *
     * @param key The configuration key
     * @return Optional containing the value if present
     */
    Optional<String> get(String key);

    /**
     * Get configuration value with default.
     *
     * @param key The configuration key
     * @param defaultValue The default value if not configured
     * @return The configuration value or default
     */
    String getOrDefault(String key, String defaultValue);

    /**
     * Get a comma-separated configuration value as a list, blanks dropped.
     *
     * @param key The configuration key
     * @return the values, empty if not configured
     */
    default List<String> getList(String key) {
        return get(key).stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();
    }

    /**
     * Get duration configuration value (ISO-8601 format, e.g., PT5S).
     *
     * @param key The configuration key
     * @return Optional containing the duration if present and valid
     */
    Optional<Duration> getDuration(String key);
}
