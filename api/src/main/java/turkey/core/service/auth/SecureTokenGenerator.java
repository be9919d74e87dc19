package turkey.core.service.auth;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generate identifiers and secrets for keys and tokens.
 *
 * <p>Prefixes make token kinds recognizable on sight: {@code rt_} for refresh
 * secrets, {@code at_} for access-token ids, {@code key_} for key ids.
 */
@ApplicationScoped
public class SecureTokenGenerator {

    public static final String REFRESH_TOKEN_PREFIX = "rt_";
    public static final String ACCESS_TOKEN_ID_PREFIX = "at_";
    public static final String KEY_ID_PREFIX = "key_";

    private static final int REFRESH_SECRET_BYTES = 32; // 256 bits
    private static final int ID_BYTES = 16;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    /**
     * Generate a refresh secret: {@code rt_} followed by 64 hex characters.
     */
    public String refreshSecret() {
        return REFRESH_TOKEN_PREFIX + randomHex(REFRESH_SECRET_BYTES);
    }

    public String accessTokenId() {
        return ACCESS_TOKEN_ID_PREFIX + randomHex(ID_BYTES);
    }

    public String keyId() {
        return KEY_ID_PREFIX + randomHex(ID_BYTES);
    }

    /**
     * Storage id for a refresh token record; not secret.
     */
    public String recordId() {
        return UUID.randomUUID().toString();
    }

    private static String randomHex(int bytes) {
        final var buffer = new byte[bytes];
        SECURE_RANDOM.nextBytes(buffer);
        return HEX.formatHex(buffer);
    }
}
