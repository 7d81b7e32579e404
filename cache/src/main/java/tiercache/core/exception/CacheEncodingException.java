package tiercache.core.exception;

/**
 * Thrown when a value cannot be turned into a payload.
 */
public class CacheEncodingException extends CacheException {

    public CacheEncodingException(String message, Throwable cause) {
        super(message, null, cause);
    }

    public CacheEncodingException(String message, String key, Throwable cause) {
        super(message, key, cause);
    }
}
