package tiercache.adapter.out.telemetry;

import tiercache.core.model.CacheKind;
import tiercache.core.port.out.CacheMetrics;

/**
 * CacheMetrics that records nothing. Used when no meter registry is configured.
 */
public final class NoOpCacheMetrics implements CacheMetrics {

    public static final NoOpCacheMetrics INSTANCE = new NoOpCacheMetrics();

    private NoOpCacheMetrics() {}

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public void recordOperation(CacheKind kind, String operation, String result) {}

    @Override
    public void recordEviction(CacheKind kind, String source) {}
}
