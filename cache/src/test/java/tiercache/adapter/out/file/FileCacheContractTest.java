package tiercache.adapter.out.file;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.stream.Stream;

import org.junit.jupiter.api.AfterEach;

import tiercache.Caches;
import tiercache.core.model.CacheKind;
import tiercache.core.port.in.Cache;
import tiercache.core.port.in.CacheContractTest;

/**
 * Contract test implementation for the file store.
 */
class FileCacheContractTest extends CacheContractTest {

    private Path directory;

    @Override
    protected Cache createCache(Duration ttl, Clock clock) {
        try {
            directory = Files.createTempDirectory("tiercache-contract");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return Caches.builder(CacheKind.FILE)
                .ttl(ttl)
                .clock(clock)
                .directory(directory.resolve("cache"))
                .sweeper(false)
                .build();
    }

    @AfterEach
    void deleteDirectory() throws IOException {
        if (directory == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        }
    }
}
