package tiercache.adapter.out.redis;

import java.time.Duration;
import java.util.ArrayList;
import java.util.function.Function;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.redis.client.RedisClientType;
import io.vertx.redis.client.RedisOptions;
import org.jboss.logging.Logger;

import tiercache.core.exception.CacheConnectionException;
import tiercache.core.model.CacheKind;

/**
 * Builds Redis stores for the single-node and the cluster client.
 *
 * <p>The two variants differ only in how the client connects. Each store gets
 * its own Vert.x instance, closed together with the store. Cluster stores can
 * also open single-node clients on that instance for per-master scans.
 */
public final class RedisConnector {

    private static final Logger LOG = Logger.getLogger(RedisConnector.class);

    private RedisConnector() {}

    /**
     * Connect to a single Redis node.
     *
     * @param settings exactly one endpoint plus password, timeout and key prefix
     * @param ttl TTL for every write; zero for persistent entries
     * @throws CacheConnectionException if the server does not answer
     */
    public static RedisCacheStore standalone(RedisSettings settings, Duration ttl) {
        if (settings.endpoints().size() != 1) {
            throw new IllegalArgumentException(
                    "A single-node Redis cache takes exactly one endpoint, got: " + settings.endpoints());
        }
        return connect(CacheKind.REDIS, RedisClientType.STANDALONE, settings, ttl);
    }

    /**
     * Connect to a Redis cluster through one or more seed nodes.
     *
     * @param settings seed endpoints plus password, timeout and key prefix
     * @param ttl TTL for every write; zero for persistent entries
     * @throws CacheConnectionException if the cluster does not answer
     */
    public static RedisCacheStore cluster(RedisSettings settings, Duration ttl) {
        return connect(CacheKind.REDIS_CLUSTER, RedisClientType.CLUSTER, settings, ttl);
    }

    static RedisOptions options(RedisClientType type, RedisSettings settings) {
        final var options = new RedisOptions().setType(type).setEndpoints(new ArrayList<>(settings.endpoints()));
        if (settings.password() != null) {
            options.setPassword(settings.password());
        }
        return options;
    }

    private static RedisCacheStore connect(
            CacheKind kind, RedisClientType type, RedisSettings settings, Duration ttl) {
        LOG.debugf("Connecting %s client to %s", type, settings.endpoints());
        final var vertx = Vertx.vertx();
        final Redis redis;
        try {
            redis = Redis.createClient(vertx, options(type, settings));
        } catch (RuntimeException e) {
            vertx.closeAndAwait();
            throw new CacheConnectionException("Cannot create redis client for " + settings.endpoints(), e);
        }
        final Function<String, Redis> nodeClients = kind == CacheKind.REDIS_CLUSTER
                ? endpoint -> Redis.createClient(vertx, options(RedisClientType.STANDALONE, settings.forNode(endpoint)))
                : null;
        return new RedisCacheStore(kind, redis, settings, ttl, vertx::closeAndAwait, nodeClients);
    }
}
