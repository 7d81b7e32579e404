package tiercache.core.port.out;

import tiercache.core.model.CacheKind;

/**
 * Port for recording cache activity.
 *
 * <p>Implementations handle the actual metric recording (e.g. Micrometer).
 */
public interface CacheMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record the outcome of a cache operation.
     *
     * @param kind the backend that served the operation
     * @param operation the operation name, e.g. {@code get}
     * @param result the outcome, e.g. {@code hit}, {@code miss}, {@code expired}
     */
    void recordOperation(CacheKind kind, String operation, String result);

    /**
     * Record the removal of a stale entry.
     *
     * @param kind the backend the entry was removed from
     * @param source what discovered the entry, {@code read} or {@code sweeper}
     */
    void recordEviction(CacheKind kind, String source);
}
