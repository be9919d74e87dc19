package turkey.core.port.in;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKeySet;

import turkey.core.model.auth.TokenPair;
import turkey.core.model.auth.TokenVerificationResult;
import turkey.core.model.auth.UserAccount;

/**
 * Token lifecycle operations exposed to the surrounding identity backend.
 */
public interface TokenLifecycle {

    /**
     * Mint an access token and a persisted refresh token for a verified user.
     *
     * @param audience requesting application, or null for the default audience
     */
    default Uni<TokenPair> issueTokenPair(UserAccount user, String audience) {
        return issueTokenPair(user, audience, null);
    }

    /**
     * Mint a pair whose access token carries the given scope.
     *
     * @param scope space-separated scopes, or null for none. Refreshed pairs carry no scope.
     */
    Uni<TokenPair> issueTokenPair(UserAccount user, String audience, String scope);

    /**
     * Exchange a refresh token for a new pair. The presented token is spent.
     *
     * @return Uni with the new pair, empty for any invalid, used or expired token
     */
    Uni<Optional<TokenPair>> rotateRefresh(String rawRefreshToken, String audience);

    /**
     * Put a jti on the denylist until {@code expiresAt}.
     *
     * @return Uni with true if a new denylist entry was written
     */
    Uni<Boolean> revokeAccessToken(String jti, String userId, String appId, Instant expiresAt, String reason);

    /**
     * Put a presented access token on the denylist. The token must carry a valid
     * signature from one of our keys; expired tokens are accepted and ignored.
     *
     * @return Uni with true if a new denylist entry was written
     */
    Uni<Boolean> revokeAccessToken(String accessToken, String reason);

    Uni<Boolean> isAccessTokenRevoked(String jti);

    /**
     * Verify a bearer access token.
     */
    Uni<TokenVerificationResult> verifyAccessToken(String accessToken, String expectedAudience);

    /**
     * Invalidate every access and refresh token of a user.
     *
     * @return Uni with the user's new token version, empty if the user is unknown
     */
    Uni<Optional<Long>> globalLogout(String userId);

    /**
     * Revoke a single refresh token. Unknown or already spent tokens are a no-op.
     *
     * @return Uni with true if a token was revoked
     */
    Uni<Boolean> logout(String rawRefreshToken);

    /**
     * Public keys relying parties use to verify access tokens.
     */
    Uni<JsonWebKeySet> getPublicKeySet();
}
