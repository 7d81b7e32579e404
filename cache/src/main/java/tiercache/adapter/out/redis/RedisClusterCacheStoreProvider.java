package tiercache.adapter.out.redis;

import tiercache.core.port.out.CacheStore;
import tiercache.core.service.ExpirationPolicy;
import tiercache.spi.CacheAdapterConfig;
import tiercache.spi.CacheProviderException;
import tiercache.spi.CacheStoreProvider;

/**
 * Redis cluster cache store provider.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>tiercache.redis.endpoints - Comma-separated seed nodes (required)</li>
 *   <li>tiercache.redis.password - Redis password (optional)</li>
 *   <li>tiercache.redis.timeout - Operation timeout in ISO-8601 duration format (default: PT5S)</li>
 *   <li>tiercache.redis.key-prefix - Prefix applied to every key (optional)</li>
 * </ul>
 */
public class RedisClusterCacheStoreProvider extends RedisCacheStoreProvider {

    @Override
    public String name() {
        return "redis-cluster";
    }

    @Override
    public String description() {
        return "Redis cluster, native TTL";
    }

    @Override
    public CacheStore createStore(CacheAdapterConfig config, ExpirationPolicy policy) {
        final var endpoints = config.getList(ENDPOINTS);
        if (endpoints.isEmpty()) {
            throw new CacheProviderException("Redis cluster cache requires " + ENDPOINTS);
        }
        return RedisConnector.cluster(settings(config, endpoints), policy.ttl());
    }
}
