package turkey.core.model.auth;

import java.time.Instant;

/**
 * Introspection view of a presented token, tagged by token kind.
 */
public sealed interface TokenInspection {

    /**
     * A signed access token and its verification outcome.
     */
    record AccessToken(TokenVerificationResult verification) implements TokenInspection {}

    /**
     * An opaque refresh token. {@code active} is false for unknown, used, revoked or expired tokens.
     */
    record RefreshToken(boolean active, String userId, Instant expiresAt) implements TokenInspection {

        public static RefreshToken inactive() {
            return new RefreshToken(false, null, null);
        }
    }

    /**
     * Neither a refresh token nor a compact JWS.
     */
    record Unrecognized() implements TokenInspection {}
}
