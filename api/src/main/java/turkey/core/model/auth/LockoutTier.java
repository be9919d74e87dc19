package turkey.core.model.auth;

import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * Lockout escalation step: reaching {@code threshold} failures locks for {@code duration}.
 */
public record LockoutTier(int threshold, Duration duration) {

    public LockoutTier {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be positive: " + threshold);
        }
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("duration must be positive: " + duration);
        }
    }

    /**
     * Parse a {@code threshold:ISO-8601-duration} pair such as {@code 5:PT5M}.
     */
    public static LockoutTier parse(String value) {
        final var separator = value.indexOf(':');
        if (separator < 1) {
            throw new IllegalArgumentException("Lockout tier must look like 5:PT5M, got " + value);
        }
        try {
            return new LockoutTier(
                    Integer.parseInt(value.substring(0, separator).trim()),
                    Duration.parse(value.substring(separator + 1).trim()));
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid lockout tier: " + value, e);
        }
    }
}
