package tiercache.adapter.out.file;

import java.nio.file.Path;

import tiercache.core.port.out.CacheStore;
import tiercache.core.service.ExpirationPolicy;
import tiercache.spi.CacheAdapterConfig;
import tiercache.spi.CacheProviderException;
import tiercache.spi.CacheStoreProvider;

/**
 * File cache store provider.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>tiercache.file.directory - Directory holding one file per key (required)</li>
 * </ul>
 */
public class FileCacheStoreProvider implements CacheStoreProvider {

    static final String DIRECTORY = "tiercache.file.directory";

    @Override
    public String name() {
        return "file";
    }

    @Override
    public String description() {
        return "One file per key under a local directory";
    }

    @Override
    public CacheStore createStore(CacheAdapterConfig config, ExpirationPolicy policy) {
        final var directory = config.get(DIRECTORY)
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new CacheProviderException("File cache requires " + DIRECTORY));
        return new FileCacheStore(Path.of(directory), policy);
    }
}
