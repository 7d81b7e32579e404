package tiercache.core.service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.jboss.logging.Logger;

import tiercache.core.exception.CacheAlreadyExistsException;
import tiercache.core.exception.CacheDecodingException;
import tiercache.core.exception.CacheEncodingException;
import tiercache.core.exception.CacheException;
import tiercache.core.exception.CacheExpiredException;
import tiercache.core.exception.CacheNotFoundException;
import tiercache.core.model.CacheEntry;
import tiercache.core.model.CacheKind;
import tiercache.core.model.EntryStatus;
import tiercache.core.port.in.Cache;
import tiercache.core.port.out.CacheMetrics;
import tiercache.core.port.out.CacheStore;
import tiercache.core.port.out.ValueCodec;

/**
 * Cache facade over a single {@link CacheStore}.
 *
 * <p>Writers (add, set, delete, flush) hold the write lock for their whole
 * duration, store I/O included. Readers (get, pull, has) share the read lock and
 * may evict a stale entry while holding it; two readers evicting the same key
 * is harmless because store deletes are idempotent.
 *
 * <p>Staleness is judged here with the {@link ExpirationPolicy}, never in the
 * stores. Stores that expire entries natively report no expiry instant, so the
 * check is a no-op for them.
 */
public class DefaultCache implements Cache {

    private static final Logger LOG = Logger.getLogger(DefaultCache.class);

    private static final String READ = "read";
    private static final String SWEEPER = "sweeper";

    private final CacheStore store;
    private final ValueCodec codec;
    private final ExpirationPolicy policy;
    private final CacheMetrics metrics;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ExpirySweeper sweeper;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Create a cache.
     *
     * @param store the backing store, owned by this cache from now on
     * @param codec encodes values on write and decodes typed reads
     * @param policy TTL and clock
     * @param metrics activity recorder
     * @param sweeperEnabled start an expiry sweeper when the store needs one
     */
    public DefaultCache(
            CacheStore store,
            ValueCodec codec,
            ExpirationPolicy policy,
            CacheMetrics metrics,
            boolean sweeperEnabled) {
        this.store = store;
        this.codec = codec;
        this.policy = policy;
        this.metrics = metrics;

        if (sweeperEnabled && policy.expires() && !store.expiresNatively()) {
            this.sweeper = new ExpirySweeper(
                    store.kind().configName(),
                    policy.ttl(),
                    store::keys,
                    this::sweepCheck,
                    store.kind() == CacheKind.FILE);
        } else {
            this.sweeper = null;
        }

        LOG.infof(
                "Created %s cache (ttl=%s, sweeper=%s)",
                store.kind().configName(), policy.expires() ? policy.ttl() : "never", sweeper != null);
    }

    @Override
    public void add(String key, Object value) {
        requireKey(key);
        lock.writeLock().lock();
        try {
            if (isFresh(key, READ)) {
                metrics.recordOperation(store.kind(), "add", "exists");
                throw new CacheAlreadyExistsException(key);
            }
            write(key, value);
            metrics.recordOperation(store.kind(), "add", "stored");
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void set(String key, Object value) {
        requireKey(key);
        lock.writeLock().lock();
        try {
            write(key, value);
            metrics.recordOperation(store.kind(), "set", "stored");
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public byte[] get(String key) {
        return read(key, false);
    }

    @Override
    public <T> T get(String key, Class<T> type) {
        return decode(key, get(key), type);
    }

    @Override
    public byte[] pull(String key) {
        return read(key, true);
    }

    @Override
    public <T> T pull(String key, Class<T> type) {
        return decode(key, pull(key), type);
    }

    @Override
    public boolean has(String key) {
        if (key == null || key.isEmpty()) {
            return false;
        }
        lock.readLock().lock();
        try {
            final var fresh = isFresh(key, READ);
            metrics.recordOperation(store.kind(), "has", fresh ? "hit" : "miss");
            return fresh;
        } catch (CacheException | IllegalArgumentException e) {
            LOG.warnv("Existence check for {0} in {1} cache failed: {2}", key, store.kind(), e.getMessage());
            metrics.recordOperation(store.kind(), "has", "error");
            return false;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void delete(String key) {
        requireKey(key);
        lock.writeLock().lock();
        try {
            store.delete(key);
            metrics.recordOperation(store.kind(), "delete", "done");
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void flush() {
        lock.writeLock().lock();
        try {
            store.flush();
            metrics.recordOperation(store.kind(), "flush", "done");
            LOG.debugf("Flushed %s cache", store.kind().configName());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public CacheKind kind() {
        return store.kind();
    }

    @Override
    public Duration ttl() {
        return policy.ttl();
    }

    /**
     * The expiry sweeper, if this cache runs one.
     */
    public Optional<ExpirySweeper> sweeper() {
        return Optional.ofNullable(sweeper);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (sweeper != null) {
            sweeper.stop();
        }
        store.close();
        LOG.infof("Closed %s cache", store.kind().configName());
    }

    private void write(String key, Object value) {
        final byte[] payload;
        try {
            payload = codec.encode(value);
        } catch (CacheEncodingException e) {
            throw new CacheEncodingException("Cannot encode value for cache entry " + key, key, e);
        }
        store.write(key, payload, policy.now());
    }

    private byte[] read(String key, boolean remove) {
        requireKey(key);
        final var operation = remove ? "pull" : "get";
        lock.readLock().lock();
        try {
            final Optional<CacheEntry> found = store.read(key);
            if (found.isEmpty()) {
                metrics.recordOperation(store.kind(), operation, "miss");
                throw new CacheNotFoundException(key);
            }

            final var entry = found.get();
            if (policy.isStale(entry.expiresAt())) {
                evict(key, READ);
                metrics.recordOperation(store.kind(), operation, "expired");
                throw new CacheExpiredException(key);
            }

            if (remove) {
                store.delete(key);
            }
            metrics.recordOperation(store.kind(), operation, "hit");
            return entry.payload();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Existence-and-freshness check shared by has, add and the sweeper.
     * Removes the entry when it is stale.
     */
    private boolean isFresh(String key, String source) {
        final Optional<EntryStatus> status = store.probe(key);
        if (status.isEmpty()) {
            return false;
        }
        if (policy.isStale(status.get().expiresAt())) {
            evict(key, source);
            return false;
        }
        return true;
    }

    private boolean sweepCheck(String key) {
        lock.readLock().lock();
        try {
            return isFresh(key, SWEEPER);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void evict(String key, String source) {
        store.delete(key);
        metrics.recordEviction(store.kind(), source);
        LOG.debugf("Evicted stale entry %s from %s cache (%s)", key, store.kind().configName(), source);
    }

    private <T> T decode(String key, byte[] payload, Class<T> type) {
        try {
            return codec.decode(payload, type);
        } catch (CacheDecodingException e) {
            throw new CacheDecodingException(
                    "Cannot decode cache entry " + key + " as " + type.getSimpleName(), key, e);
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Cache key cannot be null or empty");
        }
    }
}
