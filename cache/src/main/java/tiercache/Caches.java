package tiercache;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import tiercache.adapter.out.codec.JacksonValueCodec;
import tiercache.adapter.out.file.FileCacheStore;
import tiercache.adapter.out.memory.InMemoryCacheStore;
import tiercache.adapter.out.redis.RedisConnector;
import tiercache.adapter.out.redis.RedisSettings;
import tiercache.adapter.out.telemetry.NoOpCacheMetrics;
import tiercache.core.exception.CacheConnectionException;
import tiercache.core.exception.CacheIoException;
import tiercache.core.model.CacheKind;
import tiercache.core.port.in.Cache;
import tiercache.core.port.out.CacheMetrics;
import tiercache.core.port.out.CacheStore;
import tiercache.core.port.out.ValueCodec;
import tiercache.core.service.DefaultCache;
import tiercache.core.service.ExpirationPolicy;

/**
 * Entry point for creating caches without CDI.
 *
 * <pre>{@code
 * try (Cache cache = Caches.inMemory(Duration.ofSeconds(5))) {
 *     cache.set("greeting", "hello");
 *     String value = cache.get("greeting", String.class);
 * }
 * }</pre>
 *
 * <p>A zero TTL means entries never expire.
 */
public final class Caches {

    private Caches() {}

    public static Cache inMemory(Duration ttl) {
        return builder(CacheKind.MEMORY).ttl(ttl).build();
    }

    /**
     * @throws CacheIoException if {@code directory} cannot be created or written
     */
    public static Cache file(Duration ttl, Path directory) {
        return builder(CacheKind.FILE).ttl(ttl).directory(directory).build();
    }

    /**
     * @param endpoint e.g. {@code redis://localhost:6379} or {@code localhost:6379}
     * @param password the password, or null
     * @throws CacheConnectionException if the server does not answer
     */
    public static Cache redis(Duration ttl, String endpoint, String password) {
        return builder(CacheKind.REDIS).ttl(ttl).redis(RedisSettings.of(endpoint, password)).build();
    }

    /**
     * @param endpoints one or more cluster seed nodes
     * @param password the password, or null
     * @throws CacheConnectionException if the cluster does not answer
     */
    public static Cache redisCluster(Duration ttl, List<String> endpoints, String password) {
        return builder(CacheKind.REDIS_CLUSTER)
                .ttl(ttl)
                .redis(new RedisSettings(endpoints, password, RedisSettings.DEFAULT_TIMEOUT, ""))
                .build();
    }

    public static Builder builder(CacheKind kind) {
        return new Builder(kind);
    }

    /**
     * Builder for caches that need a custom codec, clock, metrics or Redis settings.
     */
    public static final class Builder {

        private final CacheKind kind;
        private Duration ttl = Duration.ZERO;
        private Path directory;
        private RedisSettings redisSettings;
        private ValueCodec codec = new JacksonValueCodec();
        private Clock clock = Clock.systemUTC();
        private CacheMetrics metrics = NoOpCacheMetrics.INSTANCE;
        private boolean sweeperEnabled = true;

        private Builder(CacheKind kind) {
            if (kind == null) {
                throw new IllegalArgumentException("kind cannot be null");
            }
            this.kind = kind;
        }

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder directory(Path directory) {
            this.directory = directory;
            return this;
        }

        public Builder redis(RedisSettings settings) {
            this.redisSettings = settings;
            return this;
        }

        public Builder codec(ValueCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(CacheMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder sweeper(boolean enabled) {
            this.sweeperEnabled = enabled;
            return this;
        }

        public Cache build() {
            final var policy = ExpirationPolicy.of(ttl, clock);
            return new DefaultCache(createStore(policy), codec, policy, metrics, sweeperEnabled);
        }

        private CacheStore createStore(ExpirationPolicy policy) {
            return switch (kind) {
                case MEMORY -> new InMemoryCacheStore(policy);
                case FILE -> {
                    if (directory == null) {
                        throw new IllegalStateException("File cache requires a directory");
                    }
                    yield new FileCacheStore(directory, policy);
                }
                case REDIS -> RedisConnector.standalone(requireRedis(), policy.ttl());
                case REDIS_CLUSTER -> RedisConnector.cluster(requireRedis(), policy.ttl());
            };
        }

        private RedisSettings requireRedis() {
            if (redisSettings == null) {
                throw new IllegalStateException("Redis cache requires connection settings");
            }
            return redisSettings;
        }
    }
}
