package turkey.core.model.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Claims carried by a signed access token.
 *
 * @param issuer       iss claim
 * @param audience     aud claim (requesting application)
 * @param subject      sub claim (user id)
 * @param role         user role at issuance
 * @param tokenVersion user token version at issuance
 * @param jti          unique token identifier, used as the denylist key
 * @param appId        application scope of the user, may be null
 * @param scope        space-separated scopes granted at issuance, empty when none
 * @param issuedAt     iat claim
 * @param notBefore    nbf claim
 * @param expiresAt    exp claim
 * @param keyId        kid header of the signing key
 */
public record AccessTokenClaims(
        String issuer,
        String audience,
        String subject,
        String role,
        long tokenVersion,
        String jti,
        String appId,
        String scope,
        Instant issuedAt,
        Instant notBefore,
        Instant expiresAt,
        String keyId) {

    public AccessTokenClaims {
        Objects.requireNonNull(issuer, "issuer is required");
        Objects.requireNonNull(audience, "audience is required");
        Objects.requireNonNull(subject, "subject is required");
        Objects.requireNonNull(role, "role is required");
        Objects.requireNonNull(jti, "jti is required");
        Objects.requireNonNull(issuedAt, "issuedAt is required");
        Objects.requireNonNull(notBefore, "notBefore is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
        if (scope == null) {
            scope = "";
        }
    }
}
