package turkey.spi;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import turkey.core.model.auth.KeyStatus;
import turkey.core.model.auth.SigningKeyRecord;

/**
 * SPI for signing key storage and retrieval.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Private keys MUST never be logged</li>
 *   <li>{@link #storeIfNoneActive} and {@link #retire} MUST be atomic with respect to each other</li>
 *   <li>All operations MUST be non-blocking (return Uni)</li>
 * </ul>
 *
 * <p>Deployments can replace the built-in adapters via CDI:
 * <pre>{@code
 * @Alternative
 * @Priority(1)
 * @ApplicationScoped
 * public class VaultSigningKeyRepository implements SigningKeyRepository {
 *     // Custom implementation
 * }
 * }</pre>
 */
public interface SigningKeyRepository {

    /**
     * Store a new signing key with its current status.
     *
     * @param key The signing key with metadata
     * @return Uni completing when stored
     */
    Uni<Void> store(SigningKeyRecord key);

    /**
     * Store {@code candidate} only if no ACTIVE key exists.
     *
     * <p>This is the bootstrap insert-if-absent: when several processes race on
     * a cold store, exactly one candidate wins and every caller receives the
     * same authoritative key.
     *
     * @param candidate freshly generated ACTIVE key
     * @return Uni with the newest ACTIVE key after the operation (the candidate if it won)
     */
    Uni<SigningKeyRecord> storeIfNoneActive(SigningKeyRecord candidate);

    /**
     * Get a key by its ID.
     *
     * @param kid The key identifier
     * @return Uni with the key if found, empty otherwise
     */
    Uni<Optional<SigningKeyRecord>> findById(String kid);

    /**
     * Get all keys with the specified status.
     *
     * @param status The status to filter by
     * @return Uni with list of keys with the given status
     */
    Uni<List<SigningKeyRecord>> findByStatus(KeyStatus status);

    /**
     * Get all keys (for administrative purposes).
     *
     * @return Uni with list of all keys
     */
    Uni<List<SigningKeyRecord>> findAll();

    /**
     * Retire an ACTIVE key unless it is the only ACTIVE key left.
     *
     * @param kid The key identifier
     * @param at  retirement timestamp
     * @return Uni with the outcome
     */
    Uni<RetireOutcome> retire(String kid, Instant at);

    /**
     * Delete a key from storage.
     *
     * <p>Only RETIRED keys past the retention period may be deleted; deleting
     * anything else would break verification of live tokens.
     *
     * @param kid The key identifier
     * @return Uni completing when deleted
     */
    Uni<Void> delete(String kid);

    /**
     * Outcome of {@link #retire(String, Instant)}.
     */
    enum RetireOutcome {
        RETIRED,
        NOT_FOUND,
        ALREADY_RETIRED,
        LAST_ACTIVE
    }
}
