package tiercache.core.model;

import java.time.Instant;

/**
 * A stored payload together with the instant it stops being fresh.
 *
 * <p>{@code expiresAt} is null when the entry never expires, and always null for
 * stores that expire entries natively. The payload is copied on the way in and
 * on the way out, so callers never share the stored array.
 *
 * @param payload the encoded value, never null
 * @param expiresAt the expiry instant, or null
 */
public record CacheEntry(byte[] payload, Instant expiresAt) {

    public CacheEntry {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }
}
