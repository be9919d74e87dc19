package turkey.adapter.out.storage.memory;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turkey.core.model.auth.RefreshTokenRecord;
import turkey.spi.RefreshTokenRepository;

/**
 * In-memory implementation of RefreshTokenRepository.
 *
 * <p>All mutations go through one monitor, which makes {@link #rotate} a single
 * atomic step: the predecessor check, its revocation and the successor insert
 * cannot interleave with another rotation of the same token.
 *
 * <p><strong>Warning:</strong> tokens are lost on restart and not shared across instances.
 */
public class InMemoryRefreshTokenRepository implements RefreshTokenRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryRefreshTokenRepository.class);

    private final Object lock = new Object();
    // guarded by lock
    private final Map<String, RefreshTokenRecord> byId = new HashMap<>();
    // guarded by lock
    private final Map<String, String> idByHash = new HashMap<>();

    public InMemoryRefreshTokenRepository() {
        LOG.info("Initialized in-memory refresh token repository");
    }

    @Override
    public Uni<Void> store(RefreshTokenRecord record) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                put(record);
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<RefreshTokenRecord>> findByHash(String tokenHash) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                final var id = idByHash.get(tokenHash);
                return Optional.ofNullable(id == null ? null : byId.get(id));
            }
        });
    }

    @Override
    public Uni<Optional<RefreshTokenRecord>> findById(String id) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                return Optional.ofNullable(byId.get(id));
            }
        });
    }

    @Override
    public Uni<Boolean> rotate(String predecessorId, RefreshTokenRecord successor, Instant at) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                final var predecessor = byId.get(predecessorId);
                if (predecessor == null || !predecessor.isUsableAt(at)) {
                    return false;
                }
                put(predecessor.revoke(at, successor.id()));
                put(successor);
                return true;
            }
        });
    }

    @Override
    public Uni<Boolean> revoke(String id, Instant at) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                final var record = byId.get(id);
                if (record == null || record.isRevoked()) {
                    return false;
                }
                put(record.revoke(at, null));
                return true;
            }
        });
    }

    @Override
    public Uni<Integer> revokeAllForUser(String userId, Instant at) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                final var toRevoke = byId.values().stream()
                        .filter(r -> r.userId().equals(userId) && !r.isRevoked())
                        .toList();
                toRevoke.forEach(r -> put(r.revoke(at, null)));
                return toRevoke.size();
            }
        });
    }

    @Override
    public Uni<Integer> deleteExpiredBefore(Instant cutoff) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                final var expired = byId.values().stream()
                        .filter(r -> r.expiresAt().isBefore(cutoff))
                        .toList();
                for (var record : expired) {
                    byId.remove(record.id());
                    idByHash.remove(record.tokenHash());
                }
                return expired.size();
            }
        });
    }

    private void put(RefreshTokenRecord record) {
        byId.put(record.id(), record);
        idByHash.put(record.tokenHash(), record.id());
    }
}
