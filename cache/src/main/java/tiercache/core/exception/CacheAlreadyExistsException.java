package tiercache.core.exception;

/**
 * Thrown by add when a live entry already exists for the key.
 */
public class CacheAlreadyExistsException extends CacheException {

    public CacheAlreadyExistsException(String key) {
        super("Cache entry already exists: " + key, key);
    }
}
