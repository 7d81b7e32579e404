package tiercache.core.exception;

/**
 * Thrown when a stored payload cannot be read back as the requested type.
 */
public class CacheDecodingException extends CacheException {

    public CacheDecodingException(String message, Throwable cause) {
        super(message, null, cause);
    }

    public CacheDecodingException(String message, String key, Throwable cause) {
        super(message, key, cause);
    }
}
