package turkey.core.service.auth;

import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKeySet;

import turkey.core.config.TokenConfig;
import turkey.core.model.auth.TokenPair;
import turkey.core.model.auth.TokenVerificationResult;
import turkey.core.model.auth.UserAccount;
import turkey.core.port.in.TokenLifecycle;
import turkey.spi.UserDirectory;

/**
 * Composes issuance, refresh rotation, revocation and global logout.
 */
@ApplicationScoped
public class TokenLifecycleService implements TokenLifecycle {

    private static final Logger LOG = Logger.getLogger(TokenLifecycleService.class);

    private final TokenIssuer issuer;
    private final TokenVerifier verifier;
    private final RefreshRotationService refreshTokens;
    private final RevocationDenylist denylist;
    private final PublicKeySetService publicKeys;
    private final SecureTokenGenerator generator;
    private final UserDirectory users;
    private final TokenConfig config;

    @Inject
    public TokenLifecycleService(
            TokenIssuer issuer,
            TokenVerifier verifier,
            RefreshRotationService refreshTokens,
            RevocationDenylist denylist,
            PublicKeySetService publicKeys,
            SecureTokenGenerator generator,
            UserDirectory users,
            TokenConfig config) {
        this.issuer = issuer;
        this.verifier = verifier;
        this.refreshTokens = refreshTokens;
        this.denylist = denylist;
        this.publicKeys = publicKeys;
        this.generator = generator;
        this.users = users;
        this.config = config;
    }

    @Override
    public Uni<TokenPair> issueTokenPair(UserAccount user, String audience, String scope) {
        return issuer.issue(user, audience, scope)
                .flatMap(access -> refreshTokens
                        .issue(user.id())
                        .map(refresh -> TokenPair.bearer(access, refresh.rawSecret(), expiresInSeconds())));
    }

    /**
     * The access token is minted before the refresh token is spent, so a signing
     * failure leaves the presented refresh token usable. If another caller spends
     * the token first, the minted access token is simply dropped.
     */
    @Override
    public Uni<Optional<TokenPair>> rotateRefresh(String rawRefreshToken, String audience) {
        return refreshTokens.validate(rawRefreshToken).flatMap(found -> {
            if (found.isEmpty()) {
                LOG.debug("Refresh rejected: token invalid, used or expired");
                return Uni.createFrom().item(Optional.<TokenPair>empty());
            }
            final var record = found.get();
            return users.getById(record.userId()).flatMap(user -> {
                if (user.isEmpty()) {
                    LOG.warnv("Refresh token {0} belongs to unknown user {1}", record.id(), record.userId());
                    return Uni.createFrom().item(Optional.<TokenPair>empty());
                }
                return issuer.issue(user.get(), audience)
                        .flatMap(access -> refreshTokens
                                .rotate(record.id(), generator.refreshSecret(), record.userId())
                                .map(successor -> successor.map(
                                        refresh -> TokenPair.bearer(access, refresh.rawSecret(), expiresInSeconds()))));
            });
        });
    }

    @Override
    public Uni<Boolean> revokeAccessToken(String jti, String userId, String appId, Instant expiresAt, String reason) {
        return denylist.revoke(jti, userId, appId, expiresAt, reason);
    }

    @Override
    public Uni<Boolean> revokeAccessToken(String accessToken, String reason) {
        return verifier.verifySignatureAllowExpired(accessToken).flatMap(result -> {
            if (result instanceof TokenVerificationResult.Valid valid) {
                final var claims = valid.claims();
                final var appId = claims.appId() != null ? claims.appId() : claims.audience();
                return denylist.revoke(claims.jti(), claims.subject(), appId, claims.expiresAt(), reason);
            }
            final var invalid = (TokenVerificationResult.Invalid) result;
            LOG.debugf("Not revoking unverifiable token: %s", invalid.code());
            return Uni.createFrom().item(false);
        });
    }

    @Override
    public Uni<Boolean> isAccessTokenRevoked(String jti) {
        return denylist.isRevoked(jti);
    }

    @Override
    public Uni<TokenVerificationResult> verifyAccessToken(String accessToken, String expectedAudience) {
        return verifier.verify(accessToken, expectedAudience);
    }

    /**
     * Bumping the version first makes every outstanding access token stale at once;
     * refresh tokens are revoked afterwards. A failure between the two steps leaves
     * refresh tokens alive, so callers should retry the whole operation.
     */
    @Override
    public Uni<Optional<Long>> globalLogout(String userId) {
        return users.bumpTokenVersion(userId).flatMap(newVersion -> {
            if (newVersion.isEmpty()) {
                LOG.warnv("Global logout requested for unknown user {0}", userId);
                return Uni.createFrom().item(Optional.<Long>empty());
            }
            return refreshTokens.revokeAllForUser(userId).map(revoked -> {
                LOG.infov(
                        "Global logout for user {0}: token version now {1}, {2} refresh token(s) revoked",
                        userId, newVersion.get(), revoked);
                return newVersion;
            });
        });
    }

    @Override
    public Uni<Boolean> logout(String rawRefreshToken) {
        return refreshTokens.validate(rawRefreshToken).flatMap(found -> found
                .map(record -> refreshTokens.revoke(record.id()))
                .orElseGet(() -> Uni.createFrom().item(false)));
    }

    @Override
    public Uni<JsonWebKeySet> getPublicKeySet() {
        return publicKeys.getPublicKeySet();
    }

    private long expiresInSeconds() {
        return config.accessTokenTtl().toSeconds();
    }
}
