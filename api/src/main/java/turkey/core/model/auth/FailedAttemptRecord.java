package turkey.core.model.auth;

import java.time.Instant;

/**
 * Failed authentication attempts for one origin/identity key.
 *
 * @param count         failures since the last success or the end of the last lockout
 * @param lastAttemptAt time of the latest failure
 * @param lockedUntil   end of the current lockout, null when not locked
 */
public record FailedAttemptRecord(int count, Instant lastAttemptAt, Instant lockedUntil) {

    public boolean isLockedAt(Instant now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    /**
     * True once a lockout was imposed and has run out; the record is then discarded.
     */
    public boolean lockoutEndedBy(Instant now) {
        return lockedUntil != null && !lockedUntil.isAfter(now);
    }
}
