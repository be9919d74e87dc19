package turkey.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for signing key lifecycle and publication.
 *
 * <p>Example configuration:
 * <pre>{@code
 * turkey.auth.keys.retention-period=P30D
 * turkey.auth.keys.cache-refresh-interval=PT5M
 * turkey.auth.keys.jwks-cache-max-age=PT15M
 * turkey.auth.keys.jwks-stale-while-revalidate=PT1M
 * }</pre>
 */
@ConfigMapping(prefix = "turkey.auth.keys")
public interface KeyConfig {

    /**
     * How long retired keys are kept before deletion.
     *
     * <p>Never shorter than the access-token lifetime plus clock skew; shorter
     * values are raised to that floor.
     */
    @WithName("retention-period")
    @WithDefault("P30D")
    Duration retentionPeriod();

    /**
     * How often the in-process key cache is reloaded from storage, so keys
     * rotated by another instance are picked up.
     */
    @WithName("cache-refresh-interval")
    @WithDefault("PT5M")
    Duration cacheRefreshInterval();

    /**
     * max-age advertised on the key set endpoint.
     */
    @WithName("jwks-cache-max-age")
    @WithDefault("PT15M")
    Duration jwksCacheMaxAge();

    /**
     * stale-while-revalidate advertised on the key set endpoint.
     */
    @WithName("jwks-stale-while-revalidate")
    @WithDefault("PT1M")
    Duration jwksStaleWhileRevalidate();
}
