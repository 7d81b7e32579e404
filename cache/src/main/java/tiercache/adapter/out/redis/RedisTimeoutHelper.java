package tiercache.adapter.out.redis;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Applies timeouts and failure handling to Redis operations.
 *
 * <h2>Operation Modes</h2>
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: fails with {@link RedisTimeoutException} on timeout,
 *       propagates other failures. Used for reads and writes whose outcome the caller needs.</li>
 *   <li>{@link #withTimeoutSilent} - Best-effort: logs but ignores timeout or any failure.
 *       Used for deletes and flushes.</li>
 * </ul>
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final String storeName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param storeName the store name used in log messages
     */
    public RedisTimeoutHelper(Duration timeout, String storeName) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Redis timeout must be positive, got: " + timeout);
        }
        this.timeout = timeout;
        this.storeName = storeName;
    }

    /**
     * Apply timeout to an operation that should fail on timeout.
     *
     * <p>Only timeouts are converted to {@link RedisTimeoutException}; other
     * failures (connection errors, server errors) are propagated unchanged.
     *
     * @param operation the Redis operation
     * @param operationName name for logging
     * @param <T> the result type
     * @return a Uni that fails with RedisTimeoutException on timeout
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation.ifNoItem().after(timeout).failWith(() -> {
            LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, storeName, timeout);
            return new RedisTimeoutException(operationName, storeName);
        });
    }

    /**
     * Apply timeout with silent failure.
     *
     * <p>Timeouts and failures are logged and the returned Uni completes with
     * null instead of failing.
     *
     * @param operation the Redis operation
     * @param operationName name for logging
     * @return a Uni that completes with void on timeout or failure
     */
    public Uni<Void> withTimeoutSilent(Uni<Void> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (silent): {0} in {1} after {2}",
                            operationName, storeName, timeout);
                    return null;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Redis operation failure (silent): {0} in {1}: {2}",
                            operationName, storeName, error.getMessage());
                    return null;
                });
    }

    /**
     * Exception indicating a Redis operation timeout.
     */
    public static class RedisTimeoutException extends RuntimeException {
        private final String operation;
        private final String store;

        public RedisTimeoutException(String operation, String store) {
            super("Redis operation timeout: " + operation + " in " + store);
            this.operation = operation;
            this.store = store;
        }

        /** Returns the name of the operation that timed out. */
        public String getOperation() {
            return operation;
        }

        /** Returns the store where the timeout occurred. */
        public String getStore() {
            return store;
        }
    }
}
