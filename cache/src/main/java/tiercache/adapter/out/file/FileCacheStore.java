package tiercache.adapter.out.file;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.jboss.logging.Logger;

import tiercache.core.exception.CacheIoException;
import tiercache.core.model.CacheEntry;
import tiercache.core.model.CacheKind;
import tiercache.core.model.EntryStatus;
import tiercache.core.port.out.CacheStore;
import tiercache.core.service.ExpirationPolicy;

/**
 * File-per-key implementation of CacheStore.
 *
 * <p>Each entry is a file named exactly as its key, placed directly under the
 * base directory. The file holds the raw payload with no header. There is no
 * metadata besides the file itself: the last-modified time stands for the write
 * instant, so an entry expires at {@code mtime + ttl}. Touching a cache file from
 * outside changes its freshness.
 *
 * <p>Expiry can only be as precise as the file system's timestamps. On
 * file systems with coarse modification times (one second on HFS+, two seconds
 * on FAT) the stored time is truncated, so entries may expire up to that much
 * earlier than the TTL says.
 *
 * <p>{@link #flush()} and the expiry sweeper only cover files written through
 * this store instance; other files in the directory are left alone.
 */
public class FileCacheStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(FileCacheStore.class);

    private final Path directory;
    private final ExpirationPolicy policy;
    private final Set<String> knownKeys = ConcurrentHashMap.newKeySet();

    /**
     * Create a store rooted at {@code directory}, creating it if needed.
     *
     * @throws CacheIoException if the directory cannot be created or is not writable
     */
    public FileCacheStore(Path directory, ExpirationPolicy policy) {
        if (directory == null) {
            throw new IllegalArgumentException("Cache directory cannot be null");
        }
        this.directory = directory.toAbsolutePath().normalize();
        this.policy = policy;

        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new CacheIoException("Cannot create cache directory " + this.directory, e);
        }
        if (!Files.isDirectory(this.directory) || !Files.isWritable(this.directory)) {
            throw new CacheIoException(
                    "Cache directory is not writable: " + this.directory,
                    new IOException("Not a writable directory: " + this.directory));
        }
        LOG.infof("File cache store using %s", this.directory);
    }

    @Override
    public CacheKind kind() {
        return CacheKind.FILE;
    }

    @Override
    public boolean expiresNatively() {
        return false;
    }

    public Path directory() {
        return directory;
    }

    @Override
    public Optional<EntryStatus> probe(String key) {
        final var file = resolve(key);
        try {
            return Optional.of(new EntryStatus(expiryOf(file)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CacheIoException("Cannot stat cache file for " + key, key, e);
        }
    }

    @Override
    public Optional<CacheEntry> read(String key) {
        final var file = resolve(key);
        try {
            final var expiresAt = expiryOf(file);
            return Optional.of(new CacheEntry(Files.readAllBytes(file), expiresAt));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CacheIoException("Cannot read cache file for " + key, key, e);
        }
    }

    @Override
    public void write(String key, byte[] payload, Instant writtenAt) {
        final var file = resolve(key);
        try {
            Files.write(
                    file,
                    payload,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING);
            Files.setLastModifiedTime(file, FileTime.from(writtenAt));
        } catch (IOException e) {
            throw new CacheIoException("Cannot create cache file on the given path: " + file, key, e);
        }
        knownKeys.add(key);
        LOG.debugf("Wrote %s (%d bytes)", file, payload.length);
    }

    @Override
    public void delete(String key) {
        final var file = resolve(key);
        knownKeys.remove(key);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warnv("Could not delete cache file {0}: {1}", file, e.getMessage());
        }
    }

    @Override
    public void flush() {
        for (String key : Set.copyOf(knownKeys)) {
            delete(key);
        }
    }

    @Override
    public Set<String> keys() {
        return Set.copyOf(knownKeys);
    }

    private Instant expiryOf(Path file) throws IOException {
        final var writtenAt = Files.getLastModifiedTime(file).toInstant();
        return policy.expiresAt(writtenAt).orElse(null);
    }

    private Path resolve(String key) {
        if (key == null
                || key.isEmpty()
                || key.equals(".")
                || key.equals("..")
                || key.indexOf('/') >= 0
                || key.indexOf('\\') >= 0
                || key.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Key cannot be used as a cache file name: " + key);
        }
        return directory.resolve(key);
    }
}
