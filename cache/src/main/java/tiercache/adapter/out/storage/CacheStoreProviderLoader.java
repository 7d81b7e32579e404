package tiercache.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import tiercache.adapter.out.codec.JacksonValueCodec;
import tiercache.adapter.out.telemetry.MicrometerCacheMetrics;
import tiercache.adapter.out.telemetry.NoOpCacheMetrics;
import tiercache.config.CacheConfig;
import tiercache.core.port.in.Cache;
import tiercache.core.port.out.CacheMetrics;
import tiercache.core.service.DefaultCache;
import tiercache.core.service.ExpirationPolicy;
import tiercache.spi.CacheAdapterConfig;
import tiercache.spi.CacheProviderException;
import tiercache.spi.CacheStoreProvider;

/**
 * Discovers cache store providers via ServiceLoader and produces the application cache.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If tiercache.backend is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class CacheStoreProviderLoader {

    private static final Logger LOG = Logger.getLogger(CacheStoreProviderLoader.class);

    private final CacheConfig cacheConfig;
    private final CacheAdapterConfig adapterConfig;
    private final CacheMetrics metrics;
    private final List<CacheStoreProvider> providers;

    @Inject
    public CacheStoreProviderLoader(
            CacheConfig cacheConfig, CacheAdapterConfig adapterConfig, Instance<MeterRegistry> meterRegistry) {
        this(cacheConfig, adapterConfig, metricsFor(cacheConfig, meterRegistry), discoverProviders());
    }

    CacheStoreProviderLoader(
            CacheConfig cacheConfig,
            CacheAdapterConfig adapterConfig,
            CacheMetrics metrics,
            List<CacheStoreProvider> providers) {
        this.cacheConfig = cacheConfig;
        this.adapterConfig = adapterConfig;
        this.metrics = metrics;
        this.providers = List.copyOf(providers);
    }

    @Produces
    @ApplicationScoped
    public Cache cache() {
        final var provider = selectProvider();
        LOG.infof("Creating cache from provider: %s (%s)", provider.name(), provider.description());

        final var policy = ExpirationPolicy.of(cacheConfig.ttl());
        final var store = provider.createStore(adapterConfig, policy);
        return new DefaultCache(
                store, new JacksonValueCodec(), policy, metrics, cacheConfig.sweeper().enabled());
    }

    void close(@Disposes Cache cache) {
        cache.close();
    }

    CacheStoreProvider selectProvider() {
        if (providers.isEmpty()) {
            throw new CacheProviderException(
                    "No cache store providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d cache store provider(s): %s",
                providers.size(),
                providers.stream().map(CacheStoreProvider::name).toList());

        final var configured = cacheConfig.backend().filter(name -> !name.isBlank());

        // Explicit configuration takes precedence
        if (configured.isPresent()) {
            final var name = configured.get().trim();
            return providers.stream()
                    .filter(p -> p.name().equals(name))
                    .findFirst()
                    .orElseThrow(() -> new CacheProviderException("Configured cache backend not found: " + name
                            + ". Available: "
                            + providers.stream().map(CacheStoreProvider::name).toList()));
        }

        // Otherwise, select by priority from available providers
        return providers.stream()
                .filter(CacheStoreProvider::isAvailable)
                .max(Comparator.comparingInt(CacheStoreProvider::priority))
                .orElseThrow(() -> new CacheProviderException("No available cache store providers"));
    }

    private static List<CacheStoreProvider> discoverProviders() {
        List<CacheStoreProvider> found = new ArrayList<>();
        ServiceLoader.load(CacheStoreProvider.class).forEach(found::add);
        return found;
    }

    private static CacheMetrics metricsFor(CacheConfig config, Instance<MeterRegistry> meterRegistry) {
        if (config.metrics().enabled() && meterRegistry.isResolvable()) {
            return new MicrometerCacheMetrics(meterRegistry.get());
        }
        LOG.debug("Cache metrics disabled");
        return NoOpCacheMetrics.INSTANCE;
    }
}
