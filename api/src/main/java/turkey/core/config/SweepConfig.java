package turkey.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the background expiry sweep.
 *
 * <pre>{@code
 * turkey.auth.sweep.interval=PT24H
 * turkey.auth.sweep.run-on-start=true
 * }</pre>
 */
@ConfigMapping(prefix = "turkey.auth.sweep")
public interface SweepConfig {

    @WithDefault("PT24H")
    Duration interval();

    @WithName("run-on-start")
    @WithDefault("true")
    boolean runOnStart();
}
