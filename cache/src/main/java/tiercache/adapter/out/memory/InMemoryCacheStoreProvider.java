package tiercache.adapter.out.memory;

import tiercache.core.port.out.CacheStore;
import tiercache.core.service.ExpirationPolicy;
import tiercache.spi.CacheAdapterConfig;
import tiercache.spi.CacheStoreProvider;

/**
 * In-memory cache store provider.
 *
 * <p>Default provider when no backend is configured. Needs no settings.
 */
public class InMemoryCacheStoreProvider implements CacheStoreProvider {

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-process map (entries lost on restart)";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public CacheStore createStore(CacheAdapterConfig config, ExpirationPolicy policy) {
        return new InMemoryCacheStore(policy);
    }
}
