package tiercache.core.exception;

/**
 * Thrown when a read targets a key that has no entry.
 */
public class CacheNotFoundException extends CacheException {

    public CacheNotFoundException(String key) {
        super("Cache entry not found: " + key, key);
    }
}
