package tiercache.adapter.out.redis;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.redis.client.Command;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.mutiny.redis.client.Request;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import tiercache.core.exception.CacheConnectionException;
import tiercache.core.model.CacheEntry;
import tiercache.core.model.CacheKind;
import tiercache.core.model.EntryStatus;
import tiercache.core.port.out.CacheStore;

/**
 * Redis implementation of CacheStore.
 *
 * <p>Expiry is left to Redis: writes carry a {@code PX} argument when the TTL is
 * positive and entries vanish on their own. Reads therefore never report an
 * expiry instant and the facade performs no staleness check for this store.
 *
 * <p>The server is pinged once at construction; an unreachable server fails the
 * construction with {@link CacheConnectionException}. Deletes and flushes are
 * best-effort: failures are logged and ignored.
 *
 * <p>With a key prefix, flush scans for prefixed keys instead of dropping the
 * whole database. A cluster client sends a keyless {@code SCAN} to one node
 * only, so for {@link CacheKind#REDIS_CLUSTER} the scan runs over a direct
 * connection to every master listed by {@code CLUSTER NODES}.
 */
public class RedisCacheStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(RedisCacheStore.class);

    private static final int SCAN_BATCH = 500;

    private final CacheKind kind;
    private final Redis redis;
    private final Duration ttl;
    private final long expiryMillis;
    private final String keyPrefix;
    private final List<String> seeds;
    private final Function<String, Redis> nodeClients;
    private final RedisTimeoutHelper timeoutHelper;
    private final Runnable onClose;

    /**
     * Create a store over an already created client and verify the server answers.
     *
     * @param kind {@link CacheKind#REDIS} or {@link CacheKind#REDIS_CLUSTER}
     * @param redis the client, owned by this store from now on
     * @param settings timeout and key prefix
     * @param ttl TTL passed to every write; zero for persistent entries
     * @param onClose run after the client is closed, e.g. to close an owned Vert.x instance
     * @throws CacheConnectionException if the ping fails
     */
    public RedisCacheStore(CacheKind kind, Redis redis, RedisSettings settings, Duration ttl, Runnable onClose) {
        this(kind, redis, settings, ttl, onClose, null);
    }

    /**
     * Create a store that can also open short-lived connections to single nodes.
     *
     * @param nodeClients opens a client for one node endpoint; required for a
     *                    cluster with a key prefix, where flush visits every master
     * @throws CacheConnectionException if the ping fails
     */
    public RedisCacheStore(
            CacheKind kind,
            Redis redis,
            RedisSettings settings,
            Duration ttl,
            Runnable onClose,
            Function<String, Redis> nodeClients) {
        if (kind.isLocal()) {
            throw new IllegalArgumentException("Not a remote cache kind: " + kind);
        }
        if (kind == CacheKind.REDIS_CLUSTER && !settings.keyPrefix().isEmpty() && nodeClients == null) {
            throw new IllegalArgumentException("A prefixed cluster cache needs node clients to flush every master");
        }
        this.kind = kind;
        this.redis = redis;
        this.ttl = ttl == null || ttl.isNegative() ? Duration.ZERO : ttl;
        this.expiryMillis = expiryMillis(this.ttl);
        this.keyPrefix = settings.keyPrefix();
        this.seeds = settings.endpoints();
        this.nodeClients = nodeClients;
        this.timeoutHelper = new RedisTimeoutHelper(settings.timeout(), kind.configName());
        this.onClose = onClose;

        try {
            timeoutHelper.withTimeout(redis.send(Request.cmd(Command.PING)), "ping").await().indefinitely();
        } catch (RuntimeException e) {
            close();
            throw new CacheConnectionException("Cannot connect to redis server " + settings.endpoints(), e);
        }
        LOG.infof("Connected to %s at %s", kind.configName(), settings.endpoints());
    }

    @Override
    public CacheKind kind() {
        return kind;
    }

    @Override
    public boolean expiresNatively() {
        return true;
    }

    @Override
    public Optional<EntryStatus> probe(String key) {
        final var response = execute(Request.cmd(Command.EXISTS).arg(keyFor(key)), "exists", key);
        if (response == null || response.toInteger() == 0) {
            return Optional.empty();
        }
        return Optional.of(EntryStatus.PERSISTENT);
    }

    @Override
    public Optional<CacheEntry> read(String key) {
        final var response = execute(Request.cmd(Command.GET).arg(keyFor(key)), "get", key);
        if (response == null) {
            return Optional.empty();
        }
        return Optional.of(new CacheEntry(response.toBuffer().getBytes(), null));
    }

    @Override
    public void write(String key, byte[] payload, Instant writtenAt) {
        final var request = Request.cmd(Command.SET).arg(keyFor(key)).arg(Buffer.buffer(payload));
        if (!ttl.isZero()) {
            request.arg("PX").arg(expiryMillis);
        }
        execute(request, "set", key);
    }

    @Override
    public void delete(String key) {
        bestEffort(redis.send(Request.cmd(Command.DEL).arg(keyFor(key))).replaceWithVoid(), "del");
    }

    /**
     * Remove every entry. Without a key prefix this is {@code FLUSHALL}; with one,
     * only keys in the prefix namespace are deleted.
     */
    @Override
    public void flush() {
        if (keyPrefix.isEmpty()) {
            bestEffort(redis.send(Request.cmd(Command.FLUSHALL)).replaceWithVoid(), "flushall");
            return;
        }

        try {
            if (kind == CacheKind.REDIS_CLUSTER) {
                for (String master : clusterMasters()) {
                    final var node = nodeClients.apply(master);
                    try {
                        scanAndDelete(node, false);
                    } finally {
                        node.close();
                    }
                }
            } else {
                scanAndDelete(redis, true);
            }
        } catch (RuntimeException e) {
            LOG.warnv("Redis flush of prefix {0} incomplete: {1}", keyPrefix, e.getMessage());
        }
    }

    /**
     * Redis owns expiry for this store, so there is nothing to sweep.
     */
    @Override
    public Set<String> keys() {
        return Set.of();
    }

    @Override
    public void close() {
        try {
            redis.close();
        } finally {
            if (onClose != null) {
                onClose.run();
            }
        }
    }

    private String keyFor(String key) {
        return keyPrefix + key;
    }

    /**
     * Delete every prefixed key the client's node holds. Keys found on a single
     * cluster node may span slots, so there they are deleted one by one.
     */
    private void scanAndDelete(Redis client, boolean batchDeletes) {
        var cursor = "0";
        do {
            final var page = execute(
                    client,
                    Request.cmd(Command.SCAN)
                            .arg(cursor)
                            .arg("MATCH")
                            .arg(keyPrefix + "*")
                            .arg("COUNT")
                            .arg(SCAN_BATCH),
                    "scan",
                    null);
            cursor = page.get(0).toString();
            final var keys = page.get(1);
            if (batchDeletes && keys.size() > 0) {
                final var del = Request.cmd(Command.DEL);
                for (int i = 0; i < keys.size(); i++) {
                    del.arg(keys.get(i).toString());
                }
                bestEffort(client.send(del).replaceWithVoid(), "del");
            } else {
                for (int i = 0; i < keys.size(); i++) {
                    final var del = Request.cmd(Command.DEL).arg(keys.get(i).toString());
                    bestEffort(client.send(del).replaceWithVoid(), "del");
                }
            }
        } while (!"0".equals(cursor));
    }

    private List<String> clusterMasters() {
        for (String seed : seeds) {
            final var node = nodeClients.apply(seed);
            try {
                final var nodes = execute(node, Request.cmd(Command.CLUSTER).arg("NODES"), "cluster nodes", null);
                if (nodes != null) {
                    return masterEndpoints(nodes.toString());
                }
            } catch (CacheConnectionException e) {
                LOG.debugf("Seed %s did not list cluster nodes: %s", seed, e.getMessage());
            } finally {
                node.close();
            }
        }
        throw new CacheConnectionException("No seed node listed the cluster nodes: " + seeds, null);
    }

    /**
     * Endpoints of the healthy masters in a {@code CLUSTER NODES} reply.
     */
    static List<String> masterEndpoints(String clusterNodes) {
        final List<String> masters = new ArrayList<>();
        for (String line : clusterNodes.split("\\R")) {
            final var fields = line.trim().split(" ");
            if (fields.length < 3) {
                continue;
            }
            final var flags = Arrays.asList(fields[2].split(","));
            if (!flags.contains("master")
                    || flags.contains("fail")
                    || flags.contains("fail?")
                    || flags.contains("noaddr")
                    || flags.contains("handshake")) {
                continue;
            }
            final var address = fields[1];
            final var at = address.indexOf('@');
            final var hostPort = at >= 0 ? address.substring(0, at) : address;
            if (hostPort.isEmpty() || hostPort.startsWith(":")) {
                continue;
            }
            masters.add("redis://" + hostPort);
        }
        return masters;
    }

    /**
     * Milliseconds for a {@code PX} argument. Redis rejects {@code PX 0}, so a
     * positive TTL is rounded up to the next whole millisecond.
     */
    static long expiryMillis(Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            return 0;
        }
        final var millis = ttl.toMillis();
        return ttl.minusMillis(millis).isZero() ? millis : millis + 1;
    }

    private Response execute(Request request, String operationName, String key) {
        return execute(redis, request, operationName, key);
    }

    private Response execute(Redis client, Request request, String operationName, String key) {
        try {
            return timeoutHelper.withTimeout(client.send(request), operationName).await().indefinitely();
        } catch (RuntimeException e) {
            throw new CacheConnectionException(
                    "Redis " + operationName + " failed" + (key != null ? " for " + key : ""), key, e);
        }
    }

    private void bestEffort(Uni<Void> operation, String operationName) {
        timeoutHelper.withTimeoutSilent(operation, operationName).await().indefinitely();
    }
}
