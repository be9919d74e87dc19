package turkey.core.model.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted refresh token. Only the SHA-256 hash of the secret is stored.
 *
 * @param id           record identifier
 * @param userId       owner
 * @param tokenHash    hex SHA-256 of the raw secret
 * @param createdAt    when the token was issued
 * @param expiresAt    hard expiry
 * @param revokedAt    when the token was revoked or rotated away (null while usable)
 * @param replacedById successor record when revoked by rotation
 */
public record RefreshTokenRecord(
        String id,
        String userId,
        String tokenHash,
        Instant createdAt,
        Instant expiresAt,
        Instant revokedAt,
        String replacedById) {

    public RefreshTokenRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(tokenHash, "tokenHash is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
    }

    public static RefreshTokenRecord issued(
            String id, String userId, String tokenHash, Instant createdAt, Instant expiresAt) {
        return new RefreshTokenRecord(id, userId, tokenHash, createdAt, expiresAt, null, null);
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    /**
     * A token validates only while unrevoked and unexpired.
     */
    public boolean isUsableAt(Instant now) {
        return revokedAt == null && now.isBefore(expiresAt);
    }

    public RefreshTokenRecord revoke(Instant at, String successorId) {
        return new RefreshTokenRecord(id, userId, tokenHash, createdAt, expiresAt, at, successorId);
    }
}
