package turkey.adapter.out.auth;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turkey.spi.CredentialVerifier;

/**
 * Fallback credential verifier used until a deployment supplies its own.
 *
 * <p>Rejects every credential, so login fails closed when no identity backend
 * has been wired in.
 */
@ApplicationScoped
@DefaultBean
public class UnconfiguredCredentialVerifier implements CredentialVerifier {

    private static final Logger LOG = Logger.getLogger(UnconfiguredCredentialVerifier.class);

    private final AtomicBoolean warned = new AtomicBoolean();

    @Override
    public Uni<Optional<String>> verify(String identity, String secret) {
        if (warned.compareAndSet(false, true)) {
            LOG.warn("No CredentialVerifier bean provided; all login attempts will be rejected");
        }
        return Uni.createFrom().item(Optional.empty());
    }
}
