package tiercache.core.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Existence metadata for an entry, obtained without reading its payload.
 *
 * @param expiresAt the expiry instant, or null when the entry never expires or
 *                  the store expires entries itself
 */
public record EntryStatus(Instant expiresAt) {

    public static final EntryStatus PERSISTENT = new EntryStatus(null);

    public Optional<Instant> expiry() {
        return Optional.ofNullable(expiresAt);
    }
}
