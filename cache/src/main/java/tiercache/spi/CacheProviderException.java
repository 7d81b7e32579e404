package tiercache.spi;

/**
 * Exception thrown when a cache store provider cannot be selected or fails to initialize.
 */
public class CacheProviderException extends RuntimeException {

    public CacheProviderException(String message) {
        super(message);
    }

    public CacheProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
