package turkey.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Storage backend selection.
 *
 * <pre>{@code
 * turkey.storage.type=redis
 * turkey.storage.timeout=PT2S
 * }</pre>
 */
@ConfigMapping(prefix = "turkey.storage")
public interface StorageConfig {

    /**
     * Backend type: {@code memory} or {@code redis}.
     */
    @WithDefault("memory")
    String type();

    /**
     * Per-operation timeout for remote storage calls.
     */
    @WithDefault("PT2S")
    Duration timeout();
}
