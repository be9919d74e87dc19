package turkey.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.keys.ReactiveKeyScanCursor;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import turkey.adapter.out.storage.redis.RedisTimeoutHelper.RedisTimeoutException;

@DisplayName("RedisRefreshTokenRepository")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RedisRefreshTokenRepositoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String USER_KEY = "turkey:rt:user:u1";
    private static final String RECORD_KEY = "turkey:rt:rt_1";
    private static final String LOOKUP_KEY = "turkey:rt:hash:abc123";

    @Mock
    private ReactiveRedisDataSource redis;

    @Mock
    private ReactiveHashCommands<String, String, String> hashCommands;

    @Mock
    private ReactiveValueCommands<String, String> valueCommands;

    @Mock
    private ReactiveSetCommands<String, String> setCommands;

    @Mock
    private ReactiveKeyCommands<String> keyCommands;

    @Mock
    private ReactiveKeyScanCursor<String> cursor;

    private RedisRefreshTokenRepository repository;

    @BeforeEach
    void setUp() {
        when(redis.hash(String.class, String.class, String.class)).thenReturn(hashCommands);
        when(redis.value(String.class, String.class)).thenReturn(valueCommands);
        when(redis.set(String.class, String.class)).thenReturn(setCommands);
        when(redis.key(String.class)).thenReturn(keyCommands);
        when(keyCommands.scan(any(KeyScanArgs.class))).thenReturn(cursor);
        when(cursor.next()).thenReturn(Uni.createFrom().item(Set.of(USER_KEY)));
        when(cursor.hasNext()).thenReturn(false);
        when(setCommands.smembers(USER_KEY)).thenReturn(Uni.createFrom().item(Set.of("rt_1")));
        repository = new RedisRefreshTokenRepository(
                redis, new RedisTimeoutHelper(Duration.ofMillis(50), "refreshTokens"));
    }

    private static Map<String, String> record(Instant expiresAt) {
        return Map.of(
                "id", "rt_1",
                "userId", "u1",
                "tokenHash", "abc123",
                "createdAt", String.valueOf(expiresAt.minus(Duration.ofDays(90)).toEpochMilli()),
                "expiresAt", String.valueOf(expiresAt.toEpochMilli()));
    }

    @Nested
    @DisplayName("deleteExpiredBefore()")
    class DeleteExpiredBefore {

        @Test
        @DisplayName("should delete records past the cutoff and prune the user index")
        void shouldDeleteAndPrune() {
            when(hashCommands.hgetall(RECORD_KEY)).thenReturn(Uni.createFrom().item(record(NOW.minusSeconds(1))));
            when(keyCommands.del(RECORD_KEY, LOOKUP_KEY)).thenReturn(Uni.createFrom().item(2));
            when(setCommands.srem(USER_KEY, "rt_1")).thenReturn(Uni.createFrom().item(1));

            assertEquals(1, repository.deleteExpiredBefore(NOW).await().atMost(TIMEOUT));
            verify(setCommands).srem(USER_KEY, "rt_1");
        }

        @Test
        @DisplayName("should prune index entries whose record Redis already expired")
        void shouldPruneDanglingIds() {
            when(hashCommands.hgetall(RECORD_KEY)).thenReturn(Uni.createFrom().item(Map.of()));
            when(setCommands.srem(USER_KEY, "rt_1")).thenReturn(Uni.createFrom().item(1));

            assertEquals(1, repository.deleteExpiredBefore(NOW).await().atMost(TIMEOUT));
            verify(keyCommands, never()).del(RECORD_KEY, LOOKUP_KEY);
        }

        @Test
        @DisplayName("should fail with RedisTimeoutException when a record delete stalls")
        void shouldTimeOutStalledDelete() {
            when(hashCommands.hgetall(RECORD_KEY)).thenReturn(Uni.createFrom().item(record(NOW.minusSeconds(1))));
            when(keyCommands.del(RECORD_KEY, LOOKUP_KEY)).thenReturn(Uni.createFrom().nothing());

            final var exception = assertThrows(
                    RedisTimeoutException.class,
                    () -> repository.deleteExpiredBefore(NOW).await().atMost(TIMEOUT));

            assertEquals("deleteExpiredRefreshToken", exception.getOperation());
        }

        @Test
        @DisplayName("should fail with RedisTimeoutException when pruning the index stalls")
        void shouldTimeOutStalledPrune() {
            when(hashCommands.hgetall(RECORD_KEY)).thenReturn(Uni.createFrom().item(Map.of()));
            when(setCommands.srem(USER_KEY, "rt_1")).thenReturn(Uni.createFrom().nothing());

            final var exception = assertThrows(
                    RedisTimeoutException.class,
                    () -> repository.deleteExpiredBefore(NOW).await().atMost(TIMEOUT));

            assertEquals("pruneUserRefreshTokens", exception.getOperation());
        }

        @Test
        @DisplayName("should fail with RedisTimeoutException when the key scan stalls")
        void shouldTimeOutStalledScan() {
            when(cursor.next()).thenReturn(Uni.createFrom().nothing());

            final var exception = assertThrows(
                    RedisTimeoutException.class,
                    () -> repository.deleteExpiredBefore(NOW).await().atMost(TIMEOUT));

            assertEquals("scanRefreshTokenUsers", exception.getOperation());
        }
    }
}
