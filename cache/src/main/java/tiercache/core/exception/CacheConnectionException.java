package tiercache.core.exception;

/**
 * Thrown when a remote store cannot be reached, either while connecting or
 * while serving an operation.
 */
public class CacheConnectionException extends CacheException {

    public CacheConnectionException(String message, Throwable cause) {
        super(message, null, cause);
    }

    public CacheConnectionException(String message, String key, Throwable cause) {
        super(message, key, cause);
    }
}
