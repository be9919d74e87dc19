package turkey.core.service.auth;

import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import turkey.core.model.auth.TokenInspection;

/**
 * Administrative token introspection.
 *
 * <p>The token kind is decided up front from its shape (refresh prefix or compact
 * JWS), and only the matching validator runs.
 */
@ApplicationScoped
public class TokenIntrospectionService {

    private static final Pattern REFRESH_TOKEN =
            Pattern.compile(Pattern.quote(SecureTokenGenerator.REFRESH_TOKEN_PREFIX) + "[0-9a-f]{64}");
    private static final Pattern COMPACT_JWS = Pattern.compile("[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+");

    /**
     * Kind of a presented token, decided by shape alone.
     */
    public enum TokenKind {
        ACCESS_TOKEN,
        REFRESH_TOKEN,
        UNRECOGNIZED
    }

    private final TokenVerifier verifier;
    private final RefreshRotationService refreshTokens;

    @Inject
    public TokenIntrospectionService(TokenVerifier verifier, RefreshRotationService refreshTokens) {
        this.verifier = verifier;
        this.refreshTokens = refreshTokens;
    }

    public static TokenKind classify(String token) {
        if (token == null) {
            return TokenKind.UNRECOGNIZED;
        }
        if (REFRESH_TOKEN.matcher(token).matches()) {
            return TokenKind.REFRESH_TOKEN;
        }
        if (COMPACT_JWS.matcher(token).matches()) {
            return TokenKind.ACCESS_TOKEN;
        }
        return TokenKind.UNRECOGNIZED;
    }

    /**
     * Inspect a token of either kind.
     */
    public Uni<TokenInspection> inspect(String token) {
        return switch (classify(token)) {
            case REFRESH_TOKEN -> refreshTokens.validate(token).map(found -> found
                    .<TokenInspection>map(record ->
                            new TokenInspection.RefreshToken(true, record.userId(), record.expiresAt()))
                    .orElseGet(TokenInspection.RefreshToken::inactive));
            case ACCESS_TOKEN -> verifier.verify(token, null).map(TokenInspection.AccessToken::new);
            case UNRECOGNIZED -> Uni.createFrom().item(new TokenInspection.Unrecognized());
        };
    }
}
