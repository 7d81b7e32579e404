package tiercache.adapter.out.redis;

import java.util.List;

import tiercache.core.port.out.CacheStore;
import tiercache.core.service.ExpirationPolicy;
import tiercache.spi.CacheAdapterConfig;
import tiercache.spi.CacheProviderException;
import tiercache.spi.CacheStoreProvider;

/**
 * Single-node Redis cache store provider.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>tiercache.redis.endpoint - Redis server, e.g. redis://localhost:6379 (required)</li>
 *   <li>tiercache.redis.password - Redis password (optional)</li>
 *   <li>tiercache.redis.timeout - Operation timeout in ISO-8601 duration format (default: PT5S)</li>
 *   <li>tiercache.redis.key-prefix - Prefix applied to every key (optional)</li>
 * </ul>
 */
public class RedisCacheStoreProvider implements CacheStoreProvider {

    static final String ENDPOINT = "tiercache.redis.endpoint";
    static final String ENDPOINTS = "tiercache.redis.endpoints";
    static final String PASSWORD = "tiercache.redis.password";
    static final String TIMEOUT = "tiercache.redis.timeout";
    static final String KEY_PREFIX = "tiercache.redis.key-prefix";

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public String description() {
        return "Single Redis node, native TTL";
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("io.vertx.mutiny.redis.client.Redis");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public CacheStore createStore(CacheAdapterConfig config, ExpirationPolicy policy) {
        final var endpoint = config.get(ENDPOINT)
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new CacheProviderException("Redis cache requires " + ENDPOINT));
        return RedisConnector.standalone(settings(config, List.of(endpoint)), policy.ttl());
    }

    static RedisSettings settings(CacheAdapterConfig config, List<String> endpoints) {
        return new RedisSettings(
                endpoints,
                config.get(PASSWORD).orElse(null),
                config.getDuration(TIMEOUT).orElse(RedisSettings.DEFAULT_TIMEOUT),
                config.getOrDefault(KEY_PREFIX, ""));
    }
}
