package turkey.core.config;

import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for failed-login lockout.
 *
 * <p>Tiers are {@code threshold:duration} pairs. Reaching a threshold locks the
 * key for the paired duration; the highest reached tier applies.
 *
 * <pre>{@code
 * turkey.auth.lockout.enabled=true
 * turkey.auth.lockout.tiers=5:PT5M,10:PT15M,20:PT1H
 * turkey.auth.lockout.track-by-origin-only=false
 * }</pre>
 */
@ConfigMapping(prefix = "turkey.auth.lockout")
public interface LockoutConfig {

    @WithDefault("true")
    boolean enabled();

    @WithDefault("5:PT5M,10:PT15M,20:PT1H")
    List<String> tiers();

    /**
     * Ignore the claimed identity and key lockouts by origin alone.
     */
    @WithName("track-by-origin-only")
    @WithDefault("false")
    boolean trackByOriginOnly();
}
