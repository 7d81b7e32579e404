package tiercache.core.port.out;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import tiercache.core.model.CacheEntry;
import tiercache.core.model.CacheKind;
import tiercache.core.model.EntryStatus;

/**
 * Port for the medium a cache writes to.
 *
 * <p>A store only moves bytes. Deciding whether an entry is stale, and evicting
 * it when it is, belongs to the cache facade, which uses the expiry instants
 * reported here. Stores that expire entries themselves report no expiry instant.
 *
 * <p>Implementations must tolerate concurrent calls to {@link #probe},
 * {@link #read} and {@link #delete}; the facade serializes writes.
 */
public interface CacheStore extends AutoCloseable {

    /**
     * The tier this store implements.
     */
    CacheKind kind();

    /**
     * Whether entries vanish on their own once their TTL passes. When true the
     * facade performs no staleness check and no sweeper is started.
     */
    boolean expiresNatively();

    /**
     * Check whether an entry exists without reading its payload.
     *
     * @param key the cache key
     * @return status of the entry, or empty if there is none
     */
    Optional<EntryStatus> probe(String key);

    /**
     * Read an entry.
     *
     * @param key the cache key
     * @return the entry, or empty if there is none
     */
    Optional<CacheEntry> read(String key);

    /**
     * Write an entry, replacing any previous one.
     *
     * @param key the cache key
     * @param payload the encoded value
     * @param writtenAt the write instant from the cache clock
     */
    void write(String key, byte[] payload, Instant writtenAt);

    /**
     * Remove an entry. Removing a missing entry is a no-op.
     *
     * @param key the cache key
     */
    void delete(String key);

    /**
     * Remove every entry this store owns.
     */
    void flush();

    /**
     * Snapshot of the keys this store knows about, used by the expiry sweeper.
     */
    Set<String> keys();

    /**
     * Release resources held by the store. The default does nothing.
     */
    @Override
    default void close() {}
}
