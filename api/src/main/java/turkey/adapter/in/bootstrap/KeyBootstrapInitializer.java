package turkey.adapter.in.bootstrap;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import turkey.core.service.auth.KeyManager;

/**
 * Ensures an active signing key exists on application startup.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>If storage is unavailable: startup FAILS</li>
 *   <li>If another instance bootstraps concurrently: its key is adopted, no second key is created</li>
 * </ul>
 */
@ApplicationScoped
public class KeyBootstrapInitializer {

    private static final Logger LOG = Logger.getLogger(KeyBootstrapInitializer.class);
    private static final Duration STARTUP_TIMEOUT = Duration.ofSeconds(30);

    private final KeyManager keyManager;

    @Inject
    public KeyBootstrapInitializer(KeyManager keyManager) {
        this.keyManager = keyManager;
    }

    void onStart(@Observes StartupEvent event) {
        try {
            final var key = keyManager.getSigningKey().await().atMost(STARTUP_TIMEOUT);
            LOG.infov("Signing key ready: kid={0}, created={1}", key.kid(), key.createdAt());
        } catch (RuntimeException e) {
            LOG.error("========================================");
            LOG.errorf(e, "SIGNING KEY BOOTSTRAP FAILED: %s", e.getMessage());
            LOG.error("========================================");
            throw e;
        }
    }
}
