package turkey.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import turkey.core.config.LockoutConfig;
import turkey.core.model.auth.FailedAttemptRecord;
import turkey.core.model.auth.LockoutStatus;
import turkey.core.model.auth.LockoutTier;
import turkey.core.util.SecureHash;

/**
 * Brute-force protection for credential checks.
 *
 * <p>Failures are counted per origin and claimed identity, so spraying many
 * identities from one origin and hammering one identity from many origins are
 * both throttled without one requester's typos locking out everyone behind the
 * same address.
 *
 * <p>Lockout escalates with the failure count (default: 5 failures lock for
 * 5 minutes, 10 for 15 minutes, 20 for an hour). Failures that keep arriving
 * while a key is locked move it up the tiers. A success clears the record, and
 * so does the end of a lockout: the next failure after that counts from one.
 * Records idle for longer than the widest tier are discarded by {@link #sweepStale()}.
 *
 * <p>State is process-local. Updates for one key are serialized through
 * {@link ConcurrentMap#compute}, so concurrent failures never lose increments.
 */
@ApplicationScoped
public class LockoutTracker {

    private static final Logger LOG = Logger.getLogger(LockoutTracker.class);

    private static final String KEY_SEPARATOR = "|";

    private final ConcurrentMap<String, FailedAttemptRecord> records = new ConcurrentHashMap<>();
    private final LockoutConfig config;
    private final List<LockoutTier> tiers;
    private final Duration widestTier;
    private final Clock clock;

    @Inject
    public LockoutTracker(LockoutConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.tiers = config.tiers().stream()
                .map(LockoutTier::parse)
                .sorted(Comparator.comparingInt(LockoutTier::threshold))
                .toList();
        if (tiers.isEmpty()) {
            throw new IllegalArgumentException("At least one lockout tier is required");
        }
        this.widestTier = tiers.stream()
                .map(LockoutTier::duration)
                .max(Comparator.naturalOrder())
                .orElseThrow();
    }

    /**
     * Record a failed attempt and escalate the lockout if a tier is reached.
     *
     * @param origin   network origin (e.g. client IP)
     * @param identity claimed identity, may be null
     * @return lockout state after recording
     */
    public LockoutStatus recordFailure(String origin, String identity) {
        if (!config.enabled()) {
            return LockoutStatus.open(0);
        }
        final var key = key(origin, identity);
        final var now = clock.instant();

        final var updated = records.compute(key, (k, existing) -> {
            final var live = existing == null || existing.lockoutEndedBy(now) ? null : existing;
            final var count = live == null ? 1 : live.count() + 1;
            final var tier = tierFor(count);
            final var lockedUntil = tier != null
                    ? now.plus(tier.duration())
                    : live != null ? live.lockedUntil() : null;
            return new FailedAttemptRecord(count, now, lockedUntil);
        });

        if (updated.isLockedAt(now)) {
            final var duration = Duration.between(now, updated.lockedUntil());
            LOG.warnv(
                    "Lockout after {0} failed attempts: origin={1}, identity={2}, duration={3}",
                    updated.count(), origin, SecureHash.forLog(identity), duration);
            return LockoutStatus.locked(duration, updated.count());
        }

        LOG.debugf("Failed attempt %d for origin=%s identity=%s",
                updated.count(), origin, SecureHash.forLog(identity));
        return LockoutStatus.open(updated.count());
    }

    /**
     * Clear all state for the key after a successful authentication.
     */
    public void recordSuccess(String origin, String identity) {
        if (records.remove(key(origin, identity)) != null) {
            LOG.debugf("Cleared failed attempts for origin=%s identity=%s", origin, SecureHash.forLog(identity));
        }
    }

    /**
     * Check whether the key is locked out. A record whose lockout has ended is removed here.
     */
    public boolean isLockedOut(String origin, String identity) {
        return check(origin, identity).locked();
    }

    /**
     * Current lockout state with the remaining lockout time.
     */
    public LockoutStatus check(String origin, String identity) {
        if (!config.enabled()) {
            return LockoutStatus.open(0);
        }
        final var key = key(origin, identity);
        final var now = clock.instant();

        final var current = records.computeIfPresent(
                key, (k, existing) -> existing.lockoutEndedBy(now) ? null : existing);

        if (current == null) {
            return LockoutStatus.open(0);
        }
        if (current.isLockedAt(now)) {
            return LockoutStatus.locked(Duration.between(now, current.lockedUntil()), current.count());
        }
        return LockoutStatus.open(current.count());
    }

    /**
     * Discard unlocked records with no failure for longer than the widest tier.
     *
     * @return number of records discarded
     */
    public int sweepStale() {
        final var now = clock.instant();
        final var cutoff = now.minus(widestTier);
        final var before = records.size();
        records.entrySet().removeIf(entry -> {
            final var record = entry.getValue();
            return !record.isLockedAt(now) && record.lastAttemptAt().isBefore(cutoff);
        });
        final var removed = Math.max(0, before - records.size());
        if (removed > 0) {
            LOG.debugf("Discarded %d stale failed-attempt records", removed);
        }
        return removed;
    }

    /**
     * Number of tracked keys, for monitoring.
     */
    public int trackedKeys() {
        return records.size();
    }

    private LockoutTier tierFor(int count) {
        LockoutTier reached = null;
        for (var tier : tiers) {
            if (count >= tier.threshold()) {
                reached = tier;
            }
        }
        return reached;
    }

    private String key(String origin, String identity) {
        final var safeOrigin = origin == null || origin.isBlank() ? "unknown" : origin;
        if (identity == null || identity.isBlank() || config.trackByOriginOnly()) {
            return safeOrigin;
        }
        return safeOrigin + KEY_SEPARATOR + identity.trim().toLowerCase(Locale.ROOT);
    }
}
