package tiercache.core.exception;

/**
 * Base type for every failure raised by a cache operation.
 *
 * <p>All cache exceptions are unchecked. Subclasses identify the failure kind so
 * callers can tell, for example, a key that was never cached apart from one that
 * aged out.
 */
public class CacheException extends RuntimeException {

    private final String key;

    public CacheException(String message, String key) {
        super(message);
        this.key = key;
    }

    public CacheException(String message, String key, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * Returns the key the failed operation targeted.
     *
     * @return the key, or null when the failure is not tied to a single key
     */
    public String getKey() {
        return key;
    }
}
