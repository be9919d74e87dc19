package turkey.core.model.auth;

import java.security.KeyFactory;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Comparator;
import java.util.Objects;

/**
 * ECDSA P-256 signing key with lifecycle metadata.
 *
 * <p>The {@code kid} is carried in every token header so verifiers can pick
 * the matching public key. Retired keys keep their public half until every
 * token they signed has expired.
 *
 * @param kid        Unique key identifier (used as JWT 'kid' header)
 * @param algorithm  JWS algorithm, always {@value #ALGORITHM}
 * @param privateKey EC private key for signing (null for verification-only copies)
 * @param publicKey  EC public key for verification and JWKS exposure
 * @param status     Current lifecycle status
 * @param createdAt  When the key was generated
 * @param retiredAt  When the key was retired (null while active)
 */
public record SigningKeyRecord(
        String kid,
        String algorithm,
        ECPrivateKey privateKey,
        ECPublicKey publicKey,
        KeyStatus status,
        Instant createdAt,
        Instant retiredAt) {

    public static final String ALGORITHM = "ES256";

    /**
     * Signing precedence: the later {@code createdAt} wins, equal timestamps are
     * ordered by kid. Every component that picks "the newest active key" uses
     * this ordering so they agree on the same key.
     */
    public static final Comparator<SigningKeyRecord> SIGNING_ORDER =
            Comparator.comparing(SigningKeyRecord::createdAt).thenComparing(SigningKeyRecord::kid);

    public SigningKeyRecord {
        Objects.requireNonNull(kid, "kid is required");
        Objects.requireNonNull(publicKey, "publicKey is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        if (algorithm == null) {
            algorithm = ALGORITHM;
        }
        if (status == KeyStatus.RETIRED && retiredAt == null) {
            throw new IllegalArgumentException("retiredAt is required for RETIRED keys");
        }
    }

    /**
     * Create a new active key.
     */
    public static SigningKeyRecord active(
            String kid, ECPrivateKey privateKey, ECPublicKey publicKey, Instant createdAt) {
        return new SigningKeyRecord(kid, ALGORITHM, privateKey, publicKey, KeyStatus.ACTIVE, createdAt, null);
    }

    /**
     * Transition this key to RETIRED status.
     */
    public SigningKeyRecord retire(Instant at) {
        if (status != KeyStatus.ACTIVE) {
            throw new IllegalStateException("Can only retire ACTIVE keys, current status: " + status);
        }
        return new SigningKeyRecord(kid, algorithm, privateKey, publicKey, KeyStatus.RETIRED, createdAt, at);
    }

    public boolean isActive() {
        return status == KeyStatus.ACTIVE;
    }

    /**
     * Check if this key can be used for signing (has private key and is ACTIVE).
     */
    public boolean canSign() {
        return privateKey != null && isActive();
    }

    /**
     * Check if a token signed by this key could still be unexpired at {@code now}.
     *
     * @param now              evaluation time
     * @param verificationTail how long after retirement signed tokens may still be live
     *                         (access-token lifetime plus clock skew)
     */
    public boolean canVerifyAt(Instant now, Duration verificationTail) {
        if (isActive()) {
            return true;
        }
        return now.isBefore(retiredAt.plus(verificationTail));
    }

    /**
     * Create a verification-only copy without the private key.
     */
    public SigningKeyRecord withoutPrivateKey() {
        return new SigningKeyRecord(kid, algorithm, null, publicKey, status, createdAt, retiredAt);
    }

    /**
     * Encode the private key as base64 PKCS8.
     */
    public String encodedPrivateKey() {
        return privateKey == null ? null : Base64.getEncoder().encodeToString(privateKey.getEncoded());
    }

    /**
     * Encode the public key as base64 X.509 SubjectPublicKeyInfo.
     */
    public String encodedPublicKey() {
        return Base64.getEncoder().encodeToString(publicKey.getEncoded());
    }

    /**
     * Parse an EC private key from PEM or base64-encoded PKCS8 format.
     *
     * @param keyData PEM-encoded or raw base64 PKCS8 private key
     * @return the parsed EC private key
     * @throws IllegalArgumentException if the key data is invalid
     */
    public static ECPrivateKey parsePrivateKey(String keyData) {
        try {
            final var keyBytes = Base64.getDecoder().decode(stripPem(keyData, "PRIVATE KEY"));
            final var keyFactory = KeyFactory.getInstance("EC");
            return (ECPrivateKey) keyFactory.generatePrivate(new PKCS8EncodedKeySpec(keyBytes));
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse EC private key", e);
        }
    }

    /**
     * Parse an EC public key from PEM or base64-encoded X.509 format.
     *
     * @param keyData PEM-encoded or raw base64 SPKI public key
     * @return the parsed EC public key
     * @throws IllegalArgumentException if the key data is invalid
     */
    public static ECPublicKey parsePublicKey(String keyData) {
        try {
            final var keyBytes = Base64.getDecoder().decode(stripPem(keyData, "PUBLIC KEY"));
            final var keyFactory = KeyFactory.getInstance("EC");
            return (ECPublicKey) keyFactory.generatePublic(new X509EncodedKeySpec(keyBytes));
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse EC public key", e);
        }
    }

    private static String stripPem(String keyData, String label) {
        return keyData.replace("-----BEGIN " + label + "-----", "")
                .replace("-----END " + label + "-----", "")
                .replaceAll("\\s", "");
    }
}
