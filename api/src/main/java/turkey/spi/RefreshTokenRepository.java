package turkey.spi;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import turkey.core.model.auth.RefreshTokenRecord;

/**
 * SPI for refresh token persistence.
 *
 * <p>Records are looked up by the SHA-256 hash of the raw secret; raw secrets
 * never reach this layer.
 */
public interface RefreshTokenRepository {

    /**
     * Persist a new refresh token record.
     */
    Uni<Void> store(RefreshTokenRecord record);

    /**
     * Find a record by token hash, regardless of revocation or expiry.
     */
    Uni<Optional<RefreshTokenRecord>> findByHash(String tokenHash);

    /**
     * Find a record by id, regardless of revocation or expiry.
     */
    Uni<Optional<RefreshTokenRecord>> findById(String id);

    /**
     * Replace a predecessor with its successor as one atomic step.
     *
     * <p>Succeeds only if the predecessor exists, is unrevoked and has not expired
     * at {@code at}. On success the predecessor is revoked with {@code replacedById}
     * pointing to the successor and the successor is stored. On failure nothing
     * changes. Of several concurrent calls for the same predecessor at most one
     * returns true.
     *
     * @param predecessorId record being rotated away
     * @param successor     new record
     * @param at            rotation time
     * @return Uni with true if this call performed the rotation
     */
    Uni<Boolean> rotate(String predecessorId, RefreshTokenRecord successor, Instant at);

    /**
     * Revoke a record if it is not already revoked.
     *
     * @return Uni with true if the record transitioned to revoked
     */
    Uni<Boolean> revoke(String id, Instant at);

    /**
     * Revoke every unrevoked record owned by {@code userId}.
     *
     * @return Uni with the number of records revoked
     */
    Uni<Integer> revokeAllForUser(String userId, Instant at);

    /**
     * Delete records whose expiry is before {@code cutoff}.
     *
     * @return Uni with the number of records removed
     */
    Uni<Integer> deleteExpiredBefore(Instant cutoff);
}
