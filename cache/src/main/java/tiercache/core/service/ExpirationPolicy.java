package tiercache.core.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Time-to-live rules shared by every local store.
 *
 * <p>A zero TTL means entries never expire. For a positive TTL an entry written
 * at {@code t} expires at {@code t + ttl} and is stale at any instant strictly
 * after that; at exactly {@code t + ttl} it is still fresh.
 */
public final class ExpirationPolicy {

    private final Duration ttl;
    private final Clock clock;

    private ExpirationPolicy(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Create a policy on the system clock.
     *
     * @param ttl the time-to-live; null, zero or negative means never expire
     */
    public static ExpirationPolicy of(Duration ttl) {
        return of(ttl, Clock.systemUTC());
    }

    /**
     * Create a policy on the given clock.
     *
     * @param ttl the time-to-live; null, zero or negative means never expire
     * @param clock the clock used for write instants and staleness checks
     */
    public static ExpirationPolicy of(Duration ttl, Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        final var normalized = ttl == null || ttl.isNegative() ? Duration.ZERO : ttl;
        return new ExpirationPolicy(normalized, clock);
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Whether entries written under this policy ever become stale.
     */
    public boolean expires() {
        return !ttl.isZero();
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Compute the expiry instant for an entry written at {@code writtenAt}.
     *
     * @return the expiry instant, or empty when entries never expire
     */
    public Optional<Instant> expiresAt(Instant writtenAt) {
        if (!expires()) {
            return Optional.empty();
        }
        return Optional.of(writtenAt.plus(ttl));
    }

    /**
     * Check an expiry instant against the current time.
     *
     * @param expiresAt the expiry instant, or null for entries that never expire
     */
    public boolean isStale(Instant expiresAt) {
        return isStale(expiresAt, now());
    }

    public boolean isStale(Instant expiresAt, Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
