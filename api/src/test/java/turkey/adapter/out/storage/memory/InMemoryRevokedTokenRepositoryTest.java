package turkey.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import turkey.core.model.auth.RevokedTokenEntry;

@DisplayName("InMemoryRevokedTokenRepository")
class InMemoryRevokedTokenRepositoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryRevokedTokenRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRevokedTokenRepository();
    }

    private static RevokedTokenEntry entry(String jti, Instant expiresAt) {
        return new RevokedTokenEntry(jti, "u1", "app1", "test", expiresAt, NOW);
    }

    @Test
    @DisplayName("should insert a jti only once")
    void shouldInsertOnce() {
        assertTrue(repository.insertIfAbsent(entry("at-1", NOW.plusSeconds(60))).await().atMost(TIMEOUT));
        assertFalse(repository.insertIfAbsent(entry("at-1", NOW.plusSeconds(120))).await().atMost(TIMEOUT));

        assertEquals(
                NOW.plusSeconds(60),
                repository.find("at-1").await().atMost(TIMEOUT).orElseThrow().expiresAt());
    }

    @Test
    @DisplayName("should purge and count by expiry")
    void shouldPurgeExpired() {
        repository.insertIfAbsent(entry("at-1", NOW)).await().atMost(TIMEOUT);
        repository.insertIfAbsent(entry("at-2", NOW.plusSeconds(60))).await().atMost(TIMEOUT);

        assertEquals(1L, repository.countLive(NOW).await().atMost(TIMEOUT));
        assertEquals(1, repository.deleteExpired(NOW).await().atMost(TIMEOUT));
        assertTrue(repository.find("at-1").await().atMost(TIMEOUT).isEmpty());
        assertTrue(repository.find("at-2").await().atMost(TIMEOUT).isPresent());
    }

    @Test
    @DisplayName("should treat deleting a missing entry as a no-op")
    void shouldDeleteMissing() {
        repository.delete("missing").await().atMost(TIMEOUT);

        assertEquals(0L, repository.countLive(NOW).await().atMost(TIMEOUT));
    }
}
