package turkey.core.service.auth;

import java.time.Clock;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.jwx.JsonWebStructure;
import org.jose4j.lang.JoseException;

import turkey.core.config.RevocationConfig;
import turkey.core.config.TokenConfig;
import turkey.core.model.auth.AccessTokenClaims;
import turkey.core.model.auth.AuthErrorCode;
import turkey.core.model.auth.SigningKeyRecord;
import turkey.core.model.auth.TokenVerificationResult;
import turkey.spi.UserDirectory;

/**
 * Verifies access tokens issued by {@link TokenIssuer}.
 *
 * <p>Checks, in order: structure, kid resolution against the active and
 * recently retired keys, signature, issuer, audience, exp/nbf, the user's
 * current token version and, when enabled, the JTI denylist. Every failure is a
 * {@link TokenVerificationResult.Invalid}; only storage errors fail the Uni.
 */
@ApplicationScoped
public class TokenVerifier {

    private static final Logger LOG = Logger.getLogger(TokenVerifier.class);

    private static final AlgorithmConstraints ES256_ONLY = new AlgorithmConstraints(
            AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.ECDSA_USING_P256_CURVE_AND_SHA256);

    private final KeyManager keyManager;
    private final UserDirectory userDirectory;
    private final RevocationDenylist denylist;
    private final TokenConfig tokenConfig;
    private final RevocationConfig revocationConfig;
    private final Clock clock;

    @Inject
    public TokenVerifier(
            KeyManager keyManager,
            UserDirectory userDirectory,
            RevocationDenylist denylist,
            TokenConfig tokenConfig,
            RevocationConfig revocationConfig,
            Clock clock) {
        this.keyManager = keyManager;
        this.userDirectory = userDirectory;
        this.denylist = denylist;
        this.tokenConfig = tokenConfig;
        this.revocationConfig = revocationConfig;
        this.clock = clock;
    }

    /**
     * Fully verify an access token.
     *
     * @param token            compact JWS
     * @param expectedAudience audience to require, or null to accept any
     * @return Uni with the verification result
     */
    public Uni<TokenVerificationResult> verify(String token, String expectedAudience) {
        return verifySignature(token, expectedAudience, false)
                .flatMap(result -> {
                    if (!(result instanceof TokenVerificationResult.Valid valid)) {
                        return Uni.createFrom().item(result);
                    }
                    return checkTokenVersion(valid.claims());
                })
                .flatMap(result -> {
                    if (!(result instanceof TokenVerificationResult.Valid valid) || !revocationConfig.enabled()) {
                        return Uni.createFrom().item(result);
                    }
                    return checkDenylist(valid.claims());
                })
                .invoke(result -> {
                    if (result instanceof TokenVerificationResult.Invalid invalid) {
                        LOG.debugf("Access token rejected: %s (%s)", invalid.code(), invalid.detail());
                    }
                });
    }

    /**
     * Verify signature, issuer and structure only.
     *
     * <p>Used when revoking a presented token: the token version and denylist are
     * irrelevant there, and an expired token yields its claims so the caller can
     * see there is nothing left to revoke.
     */
    public Uni<TokenVerificationResult> verifySignatureAllowExpired(String token) {
        return verifySignature(token, null, true);
    }

    private Uni<TokenVerificationResult> verifySignature(String token, String expectedAudience, boolean allowExpired) {
        if (token == null || token.isBlank()) {
            return invalid(AuthErrorCode.TOKEN_MALFORMED, "token missing");
        }

        final JsonWebStructure structure;
        try {
            structure = JsonWebStructure.fromCompactSerialization(token);
        } catch (JoseException e) {
            return invalid(AuthErrorCode.TOKEN_MALFORMED, "not a compact JWS");
        }

        if (!AlgorithmIdentifiers.ECDSA_USING_P256_CURVE_AND_SHA256.equals(structure.getAlgorithmHeaderValue())) {
            return invalid(AuthErrorCode.SIGNATURE_INVALID, "unexpected alg " + structure.getAlgorithmHeaderValue());
        }
        final var kid = structure.getKeyIdHeaderValue();
        if (kid == null || kid.isBlank()) {
            return invalid(AuthErrorCode.TOKEN_MALFORMED, "kid header missing");
        }

        return keyManager.getVerificationKey(kid).map(key -> key.map(
                        k -> consume(token, k, expectedAudience, allowExpired))
                .orElseGet(() -> TokenVerificationResult.invalid(
                        AuthErrorCode.SIGNATURE_INVALID, "no verification key for kid " + kid)));
    }

    private TokenVerificationResult consume(
            String token, SigningKeyRecord key, String expectedAudience, boolean allowExpired) {
        final var builder = new JwtConsumerBuilder()
                .setVerificationKey(key.publicKey())
                .setJwsAlgorithmConstraints(ES256_ONLY)
                .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
                .setAllowedClockSkewInSeconds((int) tokenConfig.clockSkew().toSeconds());

        if (allowExpired) {
            builder.setSkipAllValidators();
        } else {
            builder.setRequireExpirationTime()
                    .setRequireNotBefore()
                    .setRequireIssuedAt()
                    .setRequireSubject()
                    .setRequireJwtId()
                    .setExpectedIssuer(tokenConfig.issuer());
            if (expectedAudience != null) {
                builder.setExpectedAudience(expectedAudience);
            } else {
                builder.setSkipDefaultAudienceValidation();
            }
        }

        try {
            final var jwtClaims = builder.build().process(token).getJwtClaims();
            if (allowExpired && !tokenConfig.issuer().equals(jwtClaims.getIssuer())) {
                return TokenVerificationResult.invalid(AuthErrorCode.ISSUER_MISMATCH, "issuer mismatch");
            }
            return toClaims(jwtClaims, key.kid(), expectedAudience);
        } catch (InvalidJwtException e) {
            return classify(e);
        } catch (MalformedClaimException e) {
            return TokenVerificationResult.invalid(AuthErrorCode.TOKEN_MALFORMED, e.getMessage());
        }
    }

    private TokenVerificationResult toClaims(JwtClaims jwt, String kid, String expectedAudience)
            throws MalformedClaimException {
        final var audiences = jwt.getAudience();
        if (audiences == null || audiences.isEmpty()) {
            return TokenVerificationResult.invalid(AuthErrorCode.TOKEN_MALFORMED, "aud claim missing");
        }
        final var role = jwt.getStringClaimValue(TokenIssuer.CLAIM_ROLE);
        final var version = jwt.getClaimValue(TokenIssuer.CLAIM_TOKEN_VERSION);
        if (role == null || !(version instanceof Number)) {
            return TokenVerificationResult.invalid(AuthErrorCode.TOKEN_MALFORMED, "role or tokenVersion missing");
        }
        if (jwt.getSubject() == null || jwt.getJwtId() == null || jwt.getExpirationTime() == null) {
            return TokenVerificationResult.invalid(AuthErrorCode.TOKEN_MALFORMED, "required claim missing");
        }

        final var issuedAt = jwt.getIssuedAt() != null ? toInstant(jwt.getIssuedAt()) : null;
        final var notBefore = jwt.getNotBefore() != null ? toInstant(jwt.getNotBefore()) : issuedAt;
        if (issuedAt == null) {
            return TokenVerificationResult.invalid(AuthErrorCode.TOKEN_MALFORMED, "iat claim missing");
        }

        final var audience = expectedAudience != null ? expectedAudience : audiences.get(0);
        return new TokenVerificationResult.Valid(new AccessTokenClaims(
                jwt.getIssuer(),
                audience,
                jwt.getSubject(),
                role,
                ((Number) version).longValue(),
                jwt.getJwtId(),
                jwt.getStringClaimValue(TokenIssuer.CLAIM_APP_ID),
                jwt.getStringClaimValue(TokenIssuer.CLAIM_SCOPE),
                issuedAt,
                notBefore,
                toInstant(jwt.getExpirationTime()),
                kid));
    }

    private Uni<TokenVerificationResult> checkTokenVersion(AccessTokenClaims claims) {
        return userDirectory.getTokenVersion(claims.subject()).map(current -> {
            if (current.isEmpty()) {
                return TokenVerificationResult.invalid(AuthErrorCode.TOKEN_VERSION_STALE, "subject no longer exists");
            }
            if (current.get() != claims.tokenVersion()) {
                return TokenVerificationResult.invalid(
                        AuthErrorCode.TOKEN_VERSION_STALE,
                        "token version " + claims.tokenVersion() + " != current " + current.get());
            }
            return new TokenVerificationResult.Valid(claims);
        });
    }

    private Uni<TokenVerificationResult> checkDenylist(AccessTokenClaims claims) {
        return denylist.isRevoked(claims.jti())
                .map(revoked -> revoked
                        ? TokenVerificationResult.invalid(AuthErrorCode.TOKEN_REVOKED, "jti " + claims.jti() + " revoked")
                        : new TokenVerificationResult.Valid(claims));
    }

    /**
     * Map jose4j error codes to the failure taxonomy. A token can fail several
     * checks at once; the most security-relevant code wins.
     */
    static TokenVerificationResult classify(InvalidJwtException e) {
        final AuthErrorCode code;
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID) || e.hasErrorCode(ErrorCodes.SIGNATURE_MISSING)) {
            code = AuthErrorCode.SIGNATURE_INVALID;
        } else if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID) || e.hasErrorCode(ErrorCodes.ISSUER_MISSING)) {
            code = AuthErrorCode.ISSUER_MISMATCH;
        } else if (e.hasErrorCode(ErrorCodes.AUDIENCE_INVALID) || e.hasErrorCode(ErrorCodes.AUDIENCE_MISSING)) {
            code = AuthErrorCode.AUDIENCE_MISMATCH;
        } else if (e.hasExpired()) {
            code = AuthErrorCode.TOKEN_EXPIRED;
        } else if (e.hasErrorCode(ErrorCodes.NOT_YET_VALID)) {
            code = AuthErrorCode.TOKEN_NOT_YET_VALID;
        } else {
            code = AuthErrorCode.TOKEN_MALFORMED;
        }
        return TokenVerificationResult.invalid(code, summarize(e));
    }

    private static String summarize(InvalidJwtException e) {
        final var details = e.getErrorDetails();
        if (details == null || details.isEmpty()) {
            return "invalid token";
        }
        return details.get(0).getErrorMessage();
    }

    private static Instant toInstant(NumericDate date) {
        return Instant.ofEpochSecond(date.getValue());
    }

    private static Uni<TokenVerificationResult> invalid(AuthErrorCode code, String detail) {
        return Uni.createFrom().item(TokenVerificationResult.invalid(code, detail));
    }
}
