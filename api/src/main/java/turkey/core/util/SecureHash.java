package turkey.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Utility for cryptographically secure hashing of secrets and sensitive identifiers.
 *
 * <p>Refresh secrets are stored only as their full SHA-256 digest. Identities
 * such as emails are logged as a truncated digest so log lines stay
 * correlatable without exposing the value.
 */
public final class SecureHash {

    private static final int MAX_HEX_CHARS = 64;
    private static final int LOG_HEX_CHARS = 12;

    private SecureHash() {}

    /**
     * Return the lowercase hex SHA-256 digest of the input string.
     */
    public static String sha256Hex(String input) {
        return HexFormat.of().formatHex(digest(input));
    }

    /**
     * Return a truncated SHA-256 hex digest of the input string.
     *
     * @param input    the string to hash
     * @param hexChars number of hex characters to return (1-64)
     * @return truncated hex digest
     * @throws IllegalArgumentException if hexChars is less than 1 or greater than 64
     */
    public static String truncatedSha256(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        return sha256Hex(input).substring(0, hexChars);
    }

    /**
     * Short digest for log lines; null-safe.
     */
    public static String forLog(String input) {
        return input == null ? "-" : truncatedSha256(input, LOG_HEX_CHARS);
    }

    private static byte[] digest(String input) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 must be available on every JVM", e);
        }
    }
}
