package turkey.core.service.auth;

import java.time.Clock;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turkey.core.config.RevocationConfig;
import turkey.core.model.auth.RevokedTokenEntry;
import turkey.spi.RevokedTokenRepository;

/**
 * JTI denylist for revoking individual access tokens before their natural expiry.
 *
 * <p>Each entry lives only as long as the token it names: once {@code expiresAt}
 * passes, the token fails on its own exp claim and the entry is dead weight.
 * Lookups ignore expired entries and delete them when seen; the sweep removes
 * the rest.
 */
@ApplicationScoped
public class RevocationDenylist {

    private static final Logger LOG = Logger.getLogger(RevocationDenylist.class);

    private final RevokedTokenRepository repository;
    private final RevocationConfig config;
    private final Clock clock;

    @Inject
    public RevocationDenylist(RevokedTokenRepository repository, RevocationConfig config, Clock clock) {
        this.repository = repository;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Revoke a token by jti.
     *
     * <p>Revoking a jti twice is not an error; the first entry stays.
     *
     * @param jti       token identifier
     * @param userId    token subject
     * @param appId     application the token was issued for, may be null
     * @param expiresAt the token's own expiry
     * @param reason    revocation reason, defaults to the configured reason when null
     * @return Uni with true if a new entry was written
     */
    public Uni<Boolean> revoke(String jti, String userId, String appId, Instant expiresAt, String reason) {
        if (jti == null || jti.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("jti is required"));
        }
        final var now = clock.instant();
        if (!expiresAt.isAfter(now)) {
            LOG.debugf("Skipping revocation of already-expired token %s", jti);
            return Uni.createFrom().item(false);
        }

        final var entry = new RevokedTokenEntry(
                jti, userId, appId, reason == null || reason.isBlank() ? config.defaultReason() : reason, expiresAt, now);

        return repository.insertIfAbsent(entry).invoke(inserted -> {
            if (inserted) {
                LOG.infov("Revoked access token {0} for user {1} (reason: {2})", jti, userId, entry.reason());
            } else {
                LOG.debugf("Access token %s was already revoked", jti);
            }
        });
    }

    /**
     * Check whether a jti is revoked and the revocation is still meaningful.
     */
    public Uni<Boolean> isRevoked(String jti) {
        if (jti == null) {
            return Uni.createFrom().item(false);
        }
        final var now = clock.instant();
        return repository.find(jti).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            if (found.get().isLiveAt(now)) {
                return Uni.createFrom().item(true);
            }
            return repository
                    .delete(jti)
                    .onFailure()
                    .invoke(e -> LOG.debugf("Opportunistic delete of expired denylist entry %s failed: %s",
                            jti, e.getMessage()))
                    .onFailure()
                    .recoverWithNull()
                    .replaceWith(false);
        });
    }

    /**
     * Delete every entry whose token has expired.
     *
     * @return Uni with the number of entries removed
     */
    public Uni<Integer> sweepExpired() {
        return repository.deleteExpired(clock.instant()).invoke(removed -> {
            if (removed > 0) {
                LOG.infov("Purged {0} expired denylist entries", removed);
            }
        });
    }

    /**
     * Number of live entries, for monitoring.
     */
    public Uni<Long> count() {
        return repository.countLive(clock.instant());
    }
}
