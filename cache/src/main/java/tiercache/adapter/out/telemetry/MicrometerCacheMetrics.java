package tiercache.adapter.out.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import tiercache.core.model.CacheKind;
import tiercache.core.port.out.CacheMetrics;

/**
 * Records cache activity using Micrometer.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code tiercache.requests.total} - Operations by backend, operation and result</li>
 *   <li>{@code tiercache.evictions.total} - Stale entries removed, by backend and source
 *       ({@code read} or {@code sweeper})</li>
 * </ul>
 */
public class MicrometerCacheMetrics implements CacheMetrics {

    private final MeterRegistry registry;

    public MicrometerCacheMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void recordOperation(CacheKind kind, String operation, String result) {
        Counter.builder("tiercache.requests.total")
                .description("Total number of cache operations")
                .tag("backend", kind.configName())
                .tag("operation", operation)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    @Override
    public void recordEviction(CacheKind kind, String source) {
        Counter.builder("tiercache.evictions.total")
                .description("Stale cache entries removed")
                .tag("backend", kind.configName())
                .tag("source", source)
                .register(registry)
                .increment();
    }
}
