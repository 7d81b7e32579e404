package tiercache.adapter.out.redis;

import java.time.Duration;
import java.util.List;

/**
 * Connection settings for a Redis-backed cache.
 *
 * @param endpoints connection strings such as {@code redis://localhost:6379}; one for a
 *                  single node, one or more seed nodes for a cluster
 * @param password the password, or null when the server requires none
 * @param timeout bound applied to every operation
 * @param keyPrefix prepended to every key; empty for none
 */
public record RedisSettings(List<String> endpoints, String password, Duration timeout, String keyPrefix) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    public RedisSettings {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one Redis endpoint is required");
        }
        endpoints = endpoints.stream().map(RedisSettings::normalize).toList();
        password = password == null || password.isEmpty() ? null : password;
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    public static RedisSettings of(String endpoint, String password) {
        return new RedisSettings(List.of(endpoint), password, DEFAULT_TIMEOUT, "");
    }

    public RedisSettings withTimeout(Duration timeout) {
        return new RedisSettings(endpoints, password, timeout, keyPrefix);
    }

    public RedisSettings withKeyPrefix(String keyPrefix) {
        return new RedisSettings(endpoints, password, timeout, keyPrefix);
    }

    /**
     * Same credentials and timeout, aimed at a single node.
     */
    public RedisSettings forNode(String endpoint) {
        return new RedisSettings(List.of(endpoint), password, timeout, keyPrefix);
    }

    // Accept bare host:port the way most Redis tooling does.
    private static String normalize(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Redis endpoint cannot be blank");
        }
        final var trimmed = endpoint.trim();
        return trimmed.contains("://") ? trimmed : "redis://" + trimmed;
    }
}
