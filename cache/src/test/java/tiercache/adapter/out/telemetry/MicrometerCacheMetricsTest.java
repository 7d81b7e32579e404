package tiercache.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tiercache.core.model.CacheKind;

@DisplayName("MicrometerCacheMetrics")
class MicrometerCacheMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerCacheMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerCacheMetrics(registry);
    }

    @Test
    @DisplayName("should count operations by backend, operation and result")
    void shouldCountOperations() {
        metrics.recordOperation(CacheKind.REDIS_CLUSTER, "get", "hit");
        metrics.recordOperation(CacheKind.REDIS_CLUSTER, "get", "hit");
        metrics.recordOperation(CacheKind.REDIS_CLUSTER, "get", "miss");

        assertEquals(
                2.0,
                registry.get("tiercache.requests.total")
                        .tag("backend", "redis-cluster")
                        .tag("operation", "get")
                        .tag("result", "hit")
                        .counter()
                        .count());
        assertEquals(
                1.0,
                registry.get("tiercache.requests.total")
                        .tag("result", "miss")
                        .counter()
                        .count());
    }

    @Test
    @DisplayName("should count evictions by source")
    void shouldCountEvictions() {
        metrics.recordEviction(CacheKind.FILE, "sweeper");

        assertEquals(
                1.0,
                registry.get("tiercache.evictions.total")
                        .tag("backend", "file")
                        .tag("source", "sweeper")
                        .counter()
                        .count());
    }

    @Test
    @DisplayName("should report enabled while the no-op recorder does not")
    void shouldReportEnabled() {
        assertTrue(metrics.isEnabled());
        assertFalse(NoOpCacheMetrics.INSTANCE.isEnabled());
    }
}
