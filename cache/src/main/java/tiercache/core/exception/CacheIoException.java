package tiercache.core.exception;

/**
 * Thrown when the file store cannot create, write or read a cache file.
 */
public class CacheIoException extends CacheException {

    public CacheIoException(String message, String key, Throwable cause) {
        super(message, key, cause);
    }

    public CacheIoException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
