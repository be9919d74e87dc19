package turkey.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turkey.core.model.auth.RevokedTokenEntry;
import turkey.spi.RevokedTokenRepository;

/**
 * In-memory implementation of RevokedTokenRepository.
 *
 * <p>Expired entries are removed by the expiry sweep, not by a private timer.
 *
 * <p><strong>Warning:</strong> revocations are lost on restart and not shared across instances.
 */
public class InMemoryRevokedTokenRepository implements RevokedTokenRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryRevokedTokenRepository.class);

    private final ConcurrentMap<String, RevokedTokenEntry> entries = new ConcurrentHashMap<>();

    public InMemoryRevokedTokenRepository() {
        LOG.info("Initialized in-memory revoked token repository");
    }

    @Override
    public Uni<Boolean> insertIfAbsent(RevokedTokenEntry entry) {
        return Uni.createFrom().item(() -> entries.putIfAbsent(entry.jti(), entry) == null);
    }

    @Override
    public Uni<Optional<RevokedTokenEntry>> find(String jti) {
        return Uni.createFrom().item(() -> Optional.ofNullable(entries.get(jti)));
    }

    @Override
    public Uni<Void> delete(String jti) {
        return Uni.createFrom().item(() -> {
            entries.remove(jti);
            return null;
        });
    }

    @Override
    public Uni<Integer> deleteExpired(Instant now) {
        return Uni.createFrom().item(() -> {
            var removed = 0;
            for (var entry : entries.values()) {
                if (!entry.isLiveAt(now) && entries.remove(entry.jti(), entry)) {
                    removed++;
                }
            }
            return removed;
        });
    }

    @Override
    public Uni<Long> countLive(Instant now) {
        return Uni.createFrom().item(() -> entries.values().stream()
                .filter(entry -> entry.isLiveAt(now))
                .count());
    }
}
