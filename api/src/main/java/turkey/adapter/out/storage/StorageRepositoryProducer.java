package turkey.adapter.out.storage;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import turkey.adapter.out.storage.memory.InMemoryRefreshTokenRepository;
import turkey.adapter.out.storage.memory.InMemoryRevokedTokenRepository;
import turkey.adapter.out.storage.memory.InMemorySigningKeyRepository;
import turkey.adapter.out.storage.redis.RedisRefreshTokenRepository;
import turkey.adapter.out.storage.redis.RedisRevokedTokenRepository;
import turkey.adapter.out.storage.redis.RedisSigningKeyRepository;
import turkey.adapter.out.storage.redis.RedisTimeoutHelper;
import turkey.core.config.StorageConfig;
import turkey.spi.RefreshTokenRepository;
import turkey.spi.RevokedTokenRepository;
import turkey.spi.SigningKeyRepository;
import turkey.spi.StorageProviderException;

/**
 * CDI producer for the token engine's repositories.
 *
 * <p>Backend selection follows {@code turkey.storage.type}:
 * <ul>
 *   <li>{@code memory} (default) - process-local maps, for tests and single-instance deployments</li>
 *   <li>{@code redis} - shared state through the Quarkus Redis client; required when
 *       more than one instance issues or verifies tokens</li>
 * </ul>
 *
 * <p>Requesting {@code redis} without a configured Redis client fails startup
 * rather than silently falling back to memory.
 */
@ApplicationScoped
public class StorageRepositoryProducer {

    private static final Logger LOG = Logger.getLogger(StorageRepositoryProducer.class);

    static final String MEMORY = "memory";
    static final String REDIS = "redis";

    private final StorageConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSourceInstance;

    @Inject
    public StorageRepositoryProducer(StorageConfig config, Instance<ReactiveRedisDataSource> redisDataSourceInstance) {
        this.config = config;
        this.redisDataSourceInstance = redisDataSourceInstance;
    }

    @Produces
    @ApplicationScoped
    public SigningKeyRepository signingKeyRepository() {
        if (useRedis()) {
            return new RedisSigningKeyRepository(redis(), timeoutHelper("signingKeys"));
        }
        return new InMemorySigningKeyRepository();
    }

    @Produces
    @ApplicationScoped
    public RefreshTokenRepository refreshTokenRepository() {
        if (useRedis()) {
            return new RedisRefreshTokenRepository(redis(), timeoutHelper("refreshTokens"));
        }
        return new InMemoryRefreshTokenRepository();
    }

    @Produces
    @ApplicationScoped
    public RevokedTokenRepository revokedTokenRepository() {
        if (useRedis()) {
            return new RedisRevokedTokenRepository(redis(), timeoutHelper("revokedTokens"));
        }
        return new InMemoryRevokedTokenRepository();
    }

    boolean useRedis() {
        final var type = config.type() == null ? MEMORY : config.type().trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case MEMORY:
                LOG.debug("Using in-memory token storage");
                return false;
            case REDIS:
                LOG.debug("Using Redis token storage");
                return true;
            default:
                throw new StorageProviderException(
                        "Unknown storage type: " + config.type() + ". Available: [" + MEMORY + ", " + REDIS + "]");
        }
    }

    private ReactiveRedisDataSource redis() {
        if (!redisDataSourceInstance.isResolvable()) {
            throw new StorageProviderException(
                    "turkey.storage.type=redis but no Redis client is configured. Set quarkus.redis.hosts.");
        }
        return redisDataSourceInstance.get();
    }

    private RedisTimeoutHelper timeoutHelper(String repositoryName) {
        return new RedisTimeoutHelper(config.timeout(), repositoryName);
    }
}
