package turkey.adapter.out.storage.redis;

import java.time.Duration;

import io.quarkus.redis.datasource.keys.ReactiveKeyScanCursor;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Helper for applying timeouts and failure handling to Redis operations.
 *
 * <p>Authentication sits on the latency-critical path, so no Redis call may hang.
 *
 * <h2>Operation Modes</h2>
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: fails with {@link RedisTimeoutException} on timeout,
 *       propagates other failures. Used for every read and write the token engine depends on.</li>
 *   <li>{@link #withTimeoutSilent} - Fire-and-forget: logs but ignores timeout or any failure.
 *       Used for opportunistic cleanup whose failure changes nothing observable.</li>
 *   <li>{@link #scanWithTimeout} - Fail-fast key scan: every SCAN page is bounded on its own,
 *       so a sweep over many keys is not cut short while a stalled page still fails.</li>
 * </ul>
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final String repositoryName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param repositoryName the repository name for log lines
     */
    public RedisTimeoutHelper(Duration timeout, String repositoryName) {
        this.timeout = timeout;
        this.repositoryName = repositoryName;
    }

    /**
     * Apply timeout to an operation that should fail on timeout.
     *
     * @param operation the Redis operation
     * @param operationName name for logging
     * @param <T> the result type
     * @return a Uni that fails with RedisTimeoutException on timeout; other failures propagate
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation.ifNoItem().after(timeout).failWith(() -> {
            LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
            return new RedisTimeoutException(operationName, repositoryName);
        });
    }

    /**
     * Walk a key scan page by page, applying the timeout to each page.
     *
     * @param cursor the scan cursor, not yet advanced
     * @param operationName name for logging
     * @param <K> the key type
     * @return a Multi of the scanned keys that fails with RedisTimeoutException if a page times out
     */
    public <K> Multi<K> scanWithTimeout(ReactiveKeyScanCursor<K> cursor, String operationName) {
        return Multi.createBy()
                .repeating()
                .uni(() -> withTimeout(cursor.next(), operationName))
                .whilst(page -> cursor.hasNext())
                .onItem()
                .transformToIterable(page -> page);
    }

    /**
     * Apply timeout with silent failure.
     *
     * @param operation the Redis operation
     * @param operationName name for logging
     * @return a Uni that completes with void on timeout or failure
     */
    public Uni<Void> withTimeoutSilent(Uni<Void> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (silent): {0} in {1} after {2}",
                            operationName, repositoryName, timeout);
                    return null;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Redis operation failure (silent): {0} in {1}: {2}",
                            operationName, repositoryName, error.getMessage());
                    return null;
                });
    }

    /**
     * Exception indicating a Redis operation timeout.
     */
    public static class RedisTimeoutException extends RuntimeException {
        private final String operation;
        private final String repository;

        public RedisTimeoutException(String operation, String repository) {
            super("Redis operation timeout: " + operation + " in " + repository);
            this.operation = operation;
            this.repository = repository;
        }

        /** Returns the name of the operation that timed out. */
        public String getOperation() {
            return operation;
        }

        /** Returns the repository where the timeout occurred. */
        public String getRepository() {
            return repository;
        }
    }
}
