package turkey.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for access and refresh token issuance.
 *
 * <p>Example configuration:
 * <pre>{@code
 * turkey.auth.token.issuer=https://turkey.example.com
 * turkey.auth.token.default-audience=renoodles-api
 * turkey.auth.token.access-token-ttl=PT15M
 * turkey.auth.token.refresh-token-ttl=P90D
 * turkey.auth.token.clock-skew=PT30S
 * }</pre>
 */
@ConfigMapping(prefix = "turkey.auth.token")
public interface TokenConfig {

    /**
     * Value of the iss claim, also required on verification.
     */
    @WithDefault("https://turkey.example.com")
    String issuer();

    /**
     * Audience used when a caller does not name one.
     */
    @WithName("default-audience")
    @WithDefault("renoodles-api")
    String defaultAudience();

    /**
     * Access-token lifetime. Keep it short; revocation before expiry needs the denylist.
     */
    @WithName("access-token-ttl")
    @WithDefault("PT15M")
    Duration accessTokenTtl();

    /**
     * Refresh-token lifetime.
     */
    @WithName("refresh-token-ttl")
    @WithDefault("P90D")
    Duration refreshTokenTtl();

    /**
     * Tolerated clock difference when checking exp and nbf.
     */
    @WithName("clock-skew")
    @WithDefault("PT30S")
    Duration clockSkew();
}
