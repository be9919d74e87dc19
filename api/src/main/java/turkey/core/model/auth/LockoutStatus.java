package turkey.core.model.auth;

import java.time.Duration;

/**
 * Outcome of recording a failed attempt or checking a lockout.
 *
 * @param locked     whether the key is currently locked out
 * @param retryAfter remaining lockout time, {@link Duration#ZERO} when not locked
 * @param failures   failures recorded for the key
 */
public record LockoutStatus(boolean locked, Duration retryAfter, int failures) {

    public static LockoutStatus open(int failures) {
        return new LockoutStatus(false, Duration.ZERO, failures);
    }

    public static LockoutStatus locked(Duration retryAfter, int failures) {
        return new LockoutStatus(true, retryAfter, failures);
    }
}
