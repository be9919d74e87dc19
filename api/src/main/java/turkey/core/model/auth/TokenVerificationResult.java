package turkey.core.model.auth;

import java.util.Objects;

/**
 * Result of verifying a bearer access token.
 */
public sealed interface TokenVerificationResult {

    /**
     * Token verified.
     *
     * @param claims claims carried by the token
     */
    record Valid(AccessTokenClaims claims) implements TokenVerificationResult {
        public Valid {
            Objects.requireNonNull(claims, "claims is required");
        }
    }

    /**
     * Token rejected.
     *
     * @param code   failure classification
     * @param detail internal detail for logs, never sent to clients
     */
    record Invalid(AuthErrorCode code, String detail) implements TokenVerificationResult {
        public Invalid {
            Objects.requireNonNull(code, "code is required");
        }
    }

    static TokenVerificationResult invalid(AuthErrorCode code, String detail) {
        return new Invalid(code, detail);
    }

    default boolean isValid() {
        return this instanceof Valid;
    }
}
