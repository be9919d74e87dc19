package turkey.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;

import jakarta.enterprise.inject.Instance;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import turkey.adapter.out.storage.memory.InMemoryRefreshTokenRepository;
import turkey.adapter.out.storage.memory.InMemoryRevokedTokenRepository;
import turkey.adapter.out.storage.memory.InMemorySigningKeyRepository;
import turkey.adapter.out.storage.redis.RedisRefreshTokenRepository;
import turkey.adapter.out.storage.redis.RedisRevokedTokenRepository;
import turkey.adapter.out.storage.redis.RedisSigningKeyRepository;
import turkey.core.config.StorageConfig;
import turkey.spi.StorageProviderException;

@DisplayName("StorageRepositoryProducer")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class StorageRepositoryProducerTest {

    @Mock
    private StorageConfig config;

    @Mock
    private Instance<ReactiveRedisDataSource> redisInstance;

    @Mock
    private ReactiveRedisDataSource redis;

    private StorageRepositoryProducer producer;

    @BeforeEach
    void setUp() {
        when(config.timeout()).thenReturn(Duration.ofSeconds(2));
        when(redisInstance.get()).thenReturn(redis);
        producer = new StorageRepositoryProducer(config, redisInstance);
    }

    @Nested
    @DisplayName("memory")
    class Memory {

        @Test
        @DisplayName("should produce in-memory repositories without touching Redis")
        void shouldProduceInMemory() {
            when(config.type()).thenReturn("memory");

            assertInstanceOf(InMemorySigningKeyRepository.class, producer.signingKeyRepository());
            assertInstanceOf(InMemoryRefreshTokenRepository.class, producer.refreshTokenRepository());
            assertInstanceOf(InMemoryRevokedTokenRepository.class, producer.revokedTokenRepository());
            verifyNoInteractions(redisInstance);
        }

        @Test
        @DisplayName("should default to memory when no type is set")
        void shouldDefaultToMemory() {
            when(config.type()).thenReturn(null);

            assertFalse(producer.useRedis());
        }
    }

    @Nested
    @DisplayName("redis")
    class Redis {

        @Test
        @DisplayName("should produce Redis repositories when a client is configured")
        void shouldProduceRedis() {
            when(config.type()).thenReturn(" Redis ");
            when(redisInstance.isResolvable()).thenReturn(true);

            assertTrue(producer.useRedis());
            assertInstanceOf(RedisSigningKeyRepository.class, producer.signingKeyRepository());
            assertInstanceOf(RedisRefreshTokenRepository.class, producer.refreshTokenRepository());
            assertInstanceOf(RedisRevokedTokenRepository.class, producer.revokedTokenRepository());
        }

        @Test
        @DisplayName("should fail instead of falling back when no client is configured")
        void shouldFailWithoutClient() {
            when(config.type()).thenReturn("redis");
            when(redisInstance.isResolvable()).thenReturn(false);

            assertThrows(StorageProviderException.class, () -> producer.signingKeyRepository());
        }
    }

    @Test
    @DisplayName("should reject an unknown storage type")
    void shouldRejectUnknownType() {
        when(config.type()).thenReturn("cassandra");

        assertThrows(StorageProviderException.class, () -> producer.refreshTokenRepository());
    }
}
