package turkey.spi;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import turkey.core.model.auth.RevokedTokenEntry;

/**
 * SPI for the access-token JTI denylist.
 */
public interface RevokedTokenRepository {

    /**
     * Insert an entry unless one already exists for the jti.
     *
     * @return Uni with true if inserted, false if the jti was already present
     */
    Uni<Boolean> insertIfAbsent(RevokedTokenEntry entry);

    /**
     * Find an entry by jti, including expired entries not yet purged.
     */
    Uni<Optional<RevokedTokenEntry>> find(String jti);

    /**
     * Delete an entry by jti. Deleting a missing entry is a no-op.
     */
    Uni<Void> delete(String jti);

    /**
     * Delete every entry with {@code expiresAt <= now}.
     *
     * @return Uni with the number of entries removed
     */
    Uni<Integer> deleteExpired(Instant now);

    /**
     * Count entries with {@code expiresAt > now}.
     */
    Uni<Long> countLive(Instant now);
}
