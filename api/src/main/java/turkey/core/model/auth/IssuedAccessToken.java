package turkey.core.model.auth;

/**
 * A signed access token together with the claims it was minted from.
 *
 * @param token  compact JWS serialization
 * @param claims the claims inside the token
 */
public record IssuedAccessToken(String token, AccessTokenClaims claims) {}
