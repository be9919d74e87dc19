package turkey.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the access-token JTI denylist.
 *
 * <pre>{@code
 * turkey.auth.revocation.enabled=true
 * turkey.auth.revocation.default-reason=manual_revocation
 * }</pre>
 */
@ConfigMapping(prefix = "turkey.auth.revocation")
public interface RevocationConfig {

    /**
     * Whether token verification consults the denylist.
     */
    @WithDefault("true")
    boolean enabled();

    @WithName("default-reason")
    @WithDefault("manual_revocation")
    String defaultReason();
}
