package turkey.adapter.out.storage.memory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turkey.core.model.auth.KeyStatus;
import turkey.core.model.auth.SigningKeyRecord;
import turkey.spi.SigningKeyRepository;

/**
 * In-memory implementation of SigningKeyRepository.
 *
 * <p>Keys are lost on restart and not shared across instances, so every
 * instance bootstraps its own key. Use for development, tests, and
 * single-instance deployments that accept re-keying on restart.
 */
public class InMemorySigningKeyRepository implements SigningKeyRepository {

    private static final Logger LOG = Logger.getLogger(InMemorySigningKeyRepository.class);

    private final Map<String, SigningKeyRecord> keys = new ConcurrentHashMap<>();

    public InMemorySigningKeyRepository() {
        LOG.info("Initialized in-memory signing key repository");
    }

    @Override
    public Uni<Void> store(SigningKeyRecord key) {
        return Uni.createFrom().item(() -> {
            synchronized (keys) {
                keys.put(key.kid(), key);
            }
            return null;
        });
    }

    @Override
    public Uni<SigningKeyRecord> storeIfNoneActive(SigningKeyRecord candidate) {
        return Uni.createFrom().item(() -> {
            synchronized (keys) {
                final var existing = newestActive();
                if (existing.isPresent()) {
                    return existing.get();
                }
                keys.put(candidate.kid(), candidate);
                return candidate;
            }
        });
    }

    @Override
    public Uni<Optional<SigningKeyRecord>> findById(String kid) {
        return Uni.createFrom().item(() -> Optional.ofNullable(keys.get(kid)));
    }

    @Override
    public Uni<List<SigningKeyRecord>> findByStatus(KeyStatus status) {
        return Uni.createFrom().item(() -> keys.values().stream()
                .filter(key -> key.status() == status)
                .toList());
    }

    @Override
    public Uni<List<SigningKeyRecord>> findAll() {
        return Uni.createFrom().item(() -> List.copyOf(keys.values()));
    }

    @Override
    public Uni<RetireOutcome> retire(String kid, Instant at) {
        return Uni.createFrom().item(() -> {
            synchronized (keys) {
                final var key = keys.get(kid);
                if (key == null) {
                    return RetireOutcome.NOT_FOUND;
                }
                if (!key.isActive()) {
                    return RetireOutcome.ALREADY_RETIRED;
                }
                final var activeCount =
                        keys.values().stream().filter(SigningKeyRecord::isActive).count();
                if (activeCount <= 1) {
                    return RetireOutcome.LAST_ACTIVE;
                }
                keys.put(kid, key.retire(at));
                return RetireOutcome.RETIRED;
            }
        });
    }

    @Override
    public Uni<Void> delete(String kid) {
        return Uni.createFrom().item(() -> {
            synchronized (keys) {
                keys.remove(kid);
            }
            return null;
        });
    }

    private Optional<SigningKeyRecord> newestActive() {
        return keys.values().stream()
                .filter(SigningKeyRecord::isActive)
                .max(SigningKeyRecord.SIGNING_ORDER);
    }
}
