package turkey.core.model.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Denylist entry for an explicitly revoked access token.
 *
 * <p>{@code expiresAt} is copied from the token's own exp claim; after that
 * the token fails verification on its own and the entry can be purged.
 *
 * @param jti       revoked token identifier
 * @param userId    token subject
 * @param appId     application the token was issued for, may be null
 * @param reason    free-form revocation reason
 * @param expiresAt expiry of the underlying token
 * @param createdAt when the revocation was recorded
 */
public record RevokedTokenEntry(
        String jti, String userId, String appId, String reason, Instant expiresAt, Instant createdAt) {

    public RevokedTokenEntry {
        Objects.requireNonNull(jti, "jti is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
    }

    public boolean isLiveAt(Instant now) {
        return expiresAt.isAfter(now);
    }
}
