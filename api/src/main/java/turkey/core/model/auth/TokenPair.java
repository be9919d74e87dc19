package turkey.core.model.auth;

/**
 * Access token plus refresh token handed to a client after login or refresh.
 *
 * @param accessToken  signed access token
 * @param refreshToken opaque refresh secret, only its hash is stored
 * @param tokenType    always "Bearer"
 * @param expiresIn    access-token lifetime in seconds
 * @param claims       claims of the access token
 */
public record TokenPair(
        String accessToken, String refreshToken, String tokenType, long expiresIn, AccessTokenClaims claims) {

    public static final String BEARER = "Bearer";

    public static TokenPair bearer(IssuedAccessToken access, String refreshToken, long expiresIn) {
        return new TokenPair(access.token(), refreshToken, BEARER, expiresIn, access.claims());
    }
}
