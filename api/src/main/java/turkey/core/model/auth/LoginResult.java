package turkey.core.model.auth;

import java.time.Duration;

/**
 * Result of a password login attempt.
 */
public sealed interface LoginResult {

    record Success(UserAccount user, TokenPair tokens) implements LoginResult {}

    record InvalidCredentials(LockoutStatus lockout) implements LoginResult {}

    record LockedOut(Duration retryAfter) implements LoginResult {}

    default AuthErrorCode errorCode() {
        if (this instanceof InvalidCredentials invalid) {
            return invalid.lockout().locked() ? AuthErrorCode.ACCOUNT_LOCKED_OUT : AuthErrorCode.INVALID_CREDENTIALS;
        }
        if (this instanceof LockedOut) {
            return AuthErrorCode.ACCOUNT_LOCKED_OUT;
        }
        return null;
    }
}
