package tiercache.core.exception;

/**
 * Thrown when a read finds an entry whose TTL has passed.
 *
 * <p>The stale entry has already been removed by the time this is thrown.
 */
public class CacheExpiredException extends CacheException {

    public CacheExpiredException(String key) {
        super("Cache entry expired: " + key, key);
    }
}
