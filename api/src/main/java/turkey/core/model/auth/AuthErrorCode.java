package turkey.core.model.auth;

/**
 * Authentication failure taxonomy.
 *
 * <p>Each code is distinguishable so callers can react differently; whether the
 * distinction is exposed to the end client is the caller's decision.
 */
public enum AuthErrorCode {
    INVALID_CREDENTIALS,
    TOKEN_MALFORMED,
    TOKEN_EXPIRED,
    TOKEN_NOT_YET_VALID,
    SIGNATURE_INVALID,
    AUDIENCE_MISMATCH,
    ISSUER_MISMATCH,
    TOKEN_VERSION_STALE,
    TOKEN_REVOKED,
    REFRESH_TOKEN_INVALID_OR_USED,
    KEY_NOT_FOUND,
    NO_ACTIVE_SIGNING_KEY,
    ACCOUNT_LOCKED_OUT,
    RATE_LIMITED;

    /**
     * Routine outcomes that need no alerting.
     */
    public boolean isRoutine() {
        return this == TOKEN_EXPIRED || this == TOKEN_NOT_YET_VALID || this == TOKEN_VERSION_STALE;
    }
}
