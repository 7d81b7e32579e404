package tiercache.adapter.out.memory;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.jboss.logging.Logger;

import tiercache.core.model.CacheEntry;
import tiercache.core.model.CacheKind;
import tiercache.core.model.EntryStatus;
import tiercache.core.port.out.CacheStore;
import tiercache.core.service.ExpirationPolicy;

/**
 * In-memory implementation of CacheStore.
 *
 * <p>Entries live in a map owned by this store and are lost when the cache is
 * closed or the process exits. The expiry instant is computed once, at write
 * time, and kept next to the payload.
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCacheStore.class);

    private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ExpirationPolicy policy;

    public InMemoryCacheStore(ExpirationPolicy policy) {
        this.policy = policy;
    }

    @Override
    public CacheKind kind() {
        return CacheKind.MEMORY;
    }

    @Override
    public boolean expiresNatively() {
        return false;
    }

    @Override
    public Optional<EntryStatus> probe(String key) {
        return Optional.ofNullable(entries.get(key)).map(entry -> new EntryStatus(entry.expiresAt()));
    }

    @Override
    public Optional<CacheEntry> read(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void write(String key, byte[] payload, Instant writtenAt) {
        final var expiresAt = policy.expiresAt(writtenAt).orElse(null);
        entries.put(key, new CacheEntry(payload, expiresAt));
        LOG.debugf("Stored %s (%d bytes, expires=%s)", key, payload.length, expiresAt);
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public void flush() {
        entries.clear();
    }

    @Override
    public Set<String> keys() {
        return Set.copyOf(entries.keySet());
    }

    @Override
    public void close() {
        entries.clear();
    }

    /**
     * Return the current entry count (for testing).
     */
    public int size() {
        return entries.size();
    }
}
