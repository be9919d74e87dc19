package turkey.core.service.auth;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.lang.JoseException;

import turkey.core.config.TokenConfig;
import turkey.core.model.auth.AccessTokenClaims;
import turkey.core.model.auth.IssuedAccessToken;
import turkey.core.model.auth.SigningKeyRecord;
import turkey.core.model.auth.UserAccount;

/**
 * ES256 access-token issuer.
 *
 * <p>Signs with the {@link KeyManager}'s current signing key and puts its kid
 * in the JWS header.
 */
@ApplicationScoped
public class TokenIssuer {

    private static final Logger LOG = Logger.getLogger(TokenIssuer.class);

    static final String CLAIM_ROLE = "role";
    static final String CLAIM_TOKEN_VERSION = "tokenVersion";
    static final String CLAIM_APP_ID = "appId";
    static final String CLAIM_SCOPE = "scope";

    private final KeyManager keyManager;
    private final TokenConfig config;
    private final SecureTokenGenerator generator;
    private final Clock clock;

    @Inject
    public TokenIssuer(KeyManager keyManager, TokenConfig config, SecureTokenGenerator generator, Clock clock) {
        this.keyManager = keyManager;
        this.config = config;
        this.generator = generator;
        this.clock = clock;
    }

    /**
     * Issue an access token for a user.
     *
     * @param user     token subject; its current token version is embedded
     * @param audience requesting application, or null for the configured default
     * @return Uni with the signed token; fails if no signing key can be obtained
     */
    public Uni<IssuedAccessToken> issue(UserAccount user, String audience) {
        return issue(user, audience, null);
    }

    /**
     * Issue an access token carrying a scope claim.
     *
     * @param scope space-separated scopes; null or blank issues an empty scope
     */
    public Uni<IssuedAccessToken> issue(UserAccount user, String audience, String scope) {
        Objects.requireNonNull(user, "user is required");
        final var aud = audience == null || audience.isBlank() ? config.defaultAudience() : audience;
        final var granted = scope == null ? "" : scope.trim();
        return keyManager.getSigningKey().map(key -> sign(key, user, aud, granted));
    }

    private IssuedAccessToken sign(SigningKeyRecord key, UserAccount user, String audience, String scope) {
        final var issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        final var claims = new AccessTokenClaims(
                config.issuer(),
                audience,
                user.id(),
                user.role(),
                user.tokenVersion(),
                generator.accessTokenId(),
                user.appId(),
                scope,
                issuedAt,
                issuedAt,
                issuedAt.plus(config.accessTokenTtl()),
                key.kid());

        try {
            final var token = signClaims(toJwtClaims(claims), key);
            LOG.debugf("Issued access token %s for user %s (aud=%s, kid=%s)",
                    claims.jti(), user.id(), audience, key.kid());
            return new IssuedAccessToken(token, claims);
        } catch (JoseException e) {
            throw new TokenIssuanceException("Failed to sign token: " + e.getMessage(), e);
        }
    }

    private JwtClaims toJwtClaims(AccessTokenClaims claims) {
        final var jwt = new JwtClaims();
        jwt.setIssuer(claims.issuer());
        jwt.setAudience(claims.audience());
        jwt.setSubject(claims.subject());
        jwt.setJwtId(claims.jti());
        jwt.setIssuedAt(NumericDate.fromSeconds(claims.issuedAt().getEpochSecond()));
        jwt.setNotBefore(NumericDate.fromSeconds(claims.notBefore().getEpochSecond()));
        jwt.setExpirationTime(NumericDate.fromSeconds(claims.expiresAt().getEpochSecond()));
        jwt.setClaim(CLAIM_ROLE, claims.role());
        jwt.setClaim(CLAIM_TOKEN_VERSION, claims.tokenVersion());
        if (claims.appId() != null) {
            jwt.setClaim(CLAIM_APP_ID, claims.appId());
        }
        jwt.setClaim(CLAIM_SCOPE, claims.scope());
        return jwt;
    }

    private String signClaims(JwtClaims claims, SigningKeyRecord key) throws JoseException {
        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key.privateKey());
        jws.setKeyIdHeaderValue(key.kid());
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.ECDSA_USING_P256_CURVE_AND_SHA256);
        jws.setHeader("typ", "JWT");
        return jws.getCompactSerialization();
    }

    /**
     * Exception thrown when token signing fails.
     */
    public static class TokenIssuanceException extends RuntimeException {
        public TokenIssuanceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
