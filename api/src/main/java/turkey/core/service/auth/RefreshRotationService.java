package turkey.core.service.auth;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turkey.core.config.TokenConfig;
import turkey.core.model.auth.IssuedRefreshToken;
import turkey.core.model.auth.RefreshTokenRecord;
import turkey.core.util.SecureHash;
import turkey.spi.RefreshTokenRepository;

/**
 * Single-use refresh tokens with rotation.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 * issued → (validated-and-rotated → issued')* → revoked
 * issued → expired
 * </pre>
 *
 * <p>Only the SHA-256 of a secret is stored. Validation collapses every failure
 * (unknown, expired, revoked, already rotated) into an empty result so callers
 * cannot tell them apart. Replay of a rotated-away token simply fails; its
 * successors are left alone.
 */
@ApplicationScoped
public class RefreshRotationService {

    private static final Logger LOG = Logger.getLogger(RefreshRotationService.class);

    private final RefreshTokenRepository repository;
    private final SecureTokenGenerator generator;
    private final TokenConfig config;
    private final Clock clock;

    @Inject
    public RefreshRotationService(
            RefreshTokenRepository repository, SecureTokenGenerator generator, TokenConfig config, Clock clock) {
        this.repository = repository;
        this.generator = generator;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Mint and persist a new refresh token.
     */
    public Uni<IssuedRefreshToken> issue(String userId) {
        final var secret = generator.refreshSecret();
        return issue(secret, userId);
    }

    /**
     * Persist a refresh token for a caller-generated secret.
     *
     * @param rawSecret secret that will be handed to the client
     * @param userId    owner
     * @return Uni with the secret and its stored record
     */
    public Uni<IssuedRefreshToken> issue(String rawSecret, String userId) {
        final var record = newRecord(rawSecret, userId);
        return repository
                .store(record)
                .invoke(() -> LOG.debugf("Issued refresh token %s for user %s", record.id(), userId))
                .replaceWith(new IssuedRefreshToken(rawSecret, record));
    }

    /**
     * Look up a usable record for a presented secret.
     *
     * @return Uni with the record, or empty for any kind of invalid token
     */
    public Uni<Optional<RefreshTokenRecord>> validate(String rawSecret) {
        if (rawSecret == null || rawSecret.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var now = clock.instant();
        return repository
                .findByHash(SecureHash.sha256Hex(rawSecret))
                .map(found -> found.filter(record -> record.isUsableAt(now)));
    }

    /**
     * Replace a validated record with a successor holding {@code newRawSecret}.
     *
     * <p>Successor creation and predecessor revocation happen as one step in the
     * repository. If the predecessor was rotated or revoked concurrently, nothing
     * is stored and the result is empty.
     *
     * @return Uni with the successor, or empty if this call lost the race
     */
    public Uni<Optional<IssuedRefreshToken>> rotate(String oldRecordId, String newRawSecret, String userId) {
        final var successor = newRecord(newRawSecret, userId);
        return repository.rotate(oldRecordId, successor, clock.instant()).map(won -> {
            if (!won) {
                LOG.warnv("Refresh token {0} for user {1} was already used or revoked; rotation refused",
                        oldRecordId, userId);
                return Optional.<IssuedRefreshToken>empty();
            }
            LOG.debugf("Rotated refresh token %s -> %s", oldRecordId, successor.id());
            return Optional.of(new IssuedRefreshToken(newRawSecret, successor));
        });
    }

    /**
     * Validate a presented secret and rotate it in one call.
     *
     * @return Uni with the successor, or empty if the secret is invalid or lost a concurrent rotation
     */
    public Uni<Optional<IssuedRefreshToken>> validateAndRotate(String rawSecret) {
        return validate(rawSecret).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(Optional.<IssuedRefreshToken>empty());
            }
            final var record = found.get();
            return rotate(record.id(), generator.refreshSecret(), record.userId());
        });
    }

    /**
     * Revoke one record.
     *
     * @return Uni with true if the record was usable and is now revoked
     */
    public Uni<Boolean> revoke(String recordId) {
        return repository.revoke(recordId, clock.instant());
    }

    /**
     * Revoke every unrevoked record of a user.
     *
     * @return Uni with the number of records revoked
     */
    public Uni<Integer> revokeAllForUser(String userId) {
        return repository.revokeAllForUser(userId, clock.instant()).invoke(count -> {
            if (count > 0) {
                LOG.infov("Revoked {0} refresh token(s) for user {1}", count, userId);
            }
        });
    }

    /**
     * Delete records that expired before {@code cutoff}. Safe to run repeatedly.
     *
     * @return Uni with the number of records removed
     */
    public Uni<Integer> sweepExpired(Instant cutoff) {
        return repository.deleteExpiredBefore(cutoff).invoke(removed -> {
            if (removed > 0) {
                LOG.infov("Purged {0} expired refresh tokens", removed);
            }
        });
    }

    private RefreshTokenRecord newRecord(String rawSecret, String userId) {
        final var now = clock.instant();
        return RefreshTokenRecord.issued(
                generator.recordId(),
                userId,
                SecureHash.sha256Hex(rawSecret),
                now,
                now.plus(config.refreshTokenTtl()));
    }
}
