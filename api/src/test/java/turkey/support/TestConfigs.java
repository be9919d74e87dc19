package turkey.support;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import turkey.core.config.KeyConfig;
import turkey.core.config.LockoutConfig;
import turkey.core.config.RevocationConfig;
import turkey.core.config.SweepConfig;
import turkey.core.config.TokenConfig;

/**
 * Mocked configuration interfaces carrying the production defaults.
 * Tests re-stub individual values where they need to.
 */
public final class TestConfigs {

    public static final String ISSUER = "https://issuer.test";
    public static final String DEFAULT_AUDIENCE = "app1";

    private TestConfigs() {}

    public static TokenConfig tokenConfig() {
        final var config = mock(TokenConfig.class);
        when(config.issuer()).thenReturn(ISSUER);
        when(config.defaultAudience()).thenReturn(DEFAULT_AUDIENCE);
        when(config.accessTokenTtl()).thenReturn(Duration.ofMinutes(15));
        when(config.refreshTokenTtl()).thenReturn(Duration.ofDays(90));
        when(config.clockSkew()).thenReturn(Duration.ofSeconds(30));
        return config;
    }

    public static KeyConfig keyConfig() {
        final var config = mock(KeyConfig.class);
        when(config.retentionPeriod()).thenReturn(Duration.ofDays(30));
        when(config.cacheRefreshInterval()).thenReturn(Duration.ofMinutes(5));
        when(config.jwksCacheMaxAge()).thenReturn(Duration.ofMinutes(15));
        when(config.jwksStaleWhileRevalidate()).thenReturn(Duration.ofMinutes(1));
        return config;
    }

    public static RevocationConfig revocationConfig() {
        final var config = mock(RevocationConfig.class);
        when(config.enabled()).thenReturn(true);
        when(config.defaultReason()).thenReturn("manual_revocation");
        return config;
    }

    public static LockoutConfig lockoutConfig() {
        final var config = mock(LockoutConfig.class);
        when(config.enabled()).thenReturn(true);
        when(config.tiers()).thenReturn(List.of("5:PT5M", "10:PT15M", "20:PT1H"));
        when(config.trackByOriginOnly()).thenReturn(false);
        return config;
    }

    public static SweepConfig sweepConfig() {
        final var config = mock(SweepConfig.class);
        when(config.interval()).thenReturn(Duration.ofHours(24));
        when(config.runOnStart()).thenReturn(false);
        return config;
    }
}
