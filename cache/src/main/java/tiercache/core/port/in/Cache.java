package tiercache.core.port.in;

import java.time.Duration;

import tiercache.core.exception.CacheAlreadyExistsException;
import tiercache.core.exception.CacheDecodingException;
import tiercache.core.exception.CacheEncodingException;
import tiercache.core.exception.CacheExpiredException;
import tiercache.core.exception.CacheNotFoundException;
import tiercache.core.model.CacheKind;

/**
 * Uniform cache contract, identical for every storage tier.
 *
 * <p>Entries expire after the TTL the cache was created with; a zero TTL means
 * entries never expire. Operations are safe to call from many threads: writers
 * are exclusive, readers share access.
 *
 * <p>Instances own background resources (an expiry sweeper for local tiers, a
 * client connection for remote ones) and must be closed when discarded.
 */
public interface Cache extends AutoCloseable {

    /**
     * Store a value only if no live entry exists for the key.
     *
     * <p>The existence check and the write happen atomically with respect to
     * other writers, so two concurrent adds for the same key never both succeed.
     *
     * @param key the cache key
     * @param value the value to store
     * @throws CacheAlreadyExistsException if a live entry exists
     * @throws CacheEncodingException if the value cannot be encoded
     */
    void add(String key, Object value);

    /**
     * Store a value, overwriting any previous entry.
     *
     * @param key the cache key
     * @param value the value to store
     * @throws CacheEncodingException if the value cannot be encoded
     */
    void set(String key, Object value);

    /**
     * Return the payload stored for a key.
     *
     * @param key the cache key
     * @return the encoded value
     * @throws CacheNotFoundException if there is no entry
     * @throws CacheExpiredException if the entry is stale; the entry is removed
     */
    byte[] get(String key);

    /**
     * Return the value stored for a key, decoded as {@code type}.
     *
     * @throws CacheDecodingException if the payload does not fit {@code type}
     * @see #get(String)
     */
    <T> T get(String key, Class<T> type);

    /**
     * Return the payload stored for a key and remove the entry.
     *
     * @param key the cache key
     * @return the encoded value
     * @throws CacheNotFoundException if there is no entry
     * @throws CacheExpiredException if the entry is stale; the entry is removed
     */
    byte[] pull(String key);

    /**
     * Return the value stored for a key, decoded as {@code type}, and remove the entry.
     *
     * @throws CacheDecodingException if the payload does not fit {@code type}
     * @see #pull(String)
     */
    <T> T pull(String key, Class<T> type);

    /**
     * Check whether a live entry exists. Never throws; a stale entry found here
     * is removed.
     *
     * @param key the cache key
     * @return true if a fresh entry exists
     */
    boolean has(String key);

    /**
     * Remove an entry. Missing keys are ignored.
     *
     * @param key the cache key
     */
    void delete(String key);

    /**
     * Remove every entry.
     */
    void flush();

    /**
     * The storage tier behind this cache.
     */
    CacheKind kind();

    /**
     * The TTL applied to every write; zero means entries never expire.
     */
    Duration ttl();

    /**
     * Stop background work and release the store.
     */
    @Override
    void close();
}
