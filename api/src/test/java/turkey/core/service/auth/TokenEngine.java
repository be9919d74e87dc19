package turkey.core.service.auth;

import java.time.Duration;

import turkey.adapter.out.storage.memory.InMemoryRefreshTokenRepository;
import turkey.adapter.out.storage.memory.InMemoryRevokedTokenRepository;
import turkey.adapter.out.storage.memory.InMemorySigningKeyRepository;
import turkey.adapter.out.storage.memory.InMemoryUserDirectory;
import turkey.core.config.KeyConfig;
import turkey.core.config.RevocationConfig;
import turkey.core.config.TokenConfig;
import turkey.core.model.auth.UserAccount;
import turkey.support.MutableClock;
import turkey.support.TestConfigs;

/**
 * The token engine wired over in-memory storage and a test clock.
 */
final class TokenEngine {

    static final Duration TIMEOUT = Duration.ofSeconds(5);

    final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    final TokenConfig tokenConfig = TestConfigs.tokenConfig();
    final KeyConfig keyConfig = TestConfigs.keyConfig();
    final RevocationConfig revocationConfig = TestConfigs.revocationConfig();

    final InMemorySigningKeyRepository keyRepository = new InMemorySigningKeyRepository();
    final InMemoryRefreshTokenRepository refreshRepository = new InMemoryRefreshTokenRepository();
    final InMemoryRevokedTokenRepository revokedRepository = new InMemoryRevokedTokenRepository();
    final InMemoryUserDirectory users = new InMemoryUserDirectory();

    final SecureTokenGenerator generator = new SecureTokenGenerator();
    final KeyManager keyManager = new KeyManager(keyRepository, tokenConfig, keyConfig, generator, clock);
    final RevocationDenylist denylist = new RevocationDenylist(revokedRepository, revocationConfig, clock);
    final TokenIssuer issuer = new TokenIssuer(keyManager, tokenConfig, generator, clock);
    final TokenVerifier verifier =
            new TokenVerifier(keyManager, users, denylist, tokenConfig, revocationConfig, clock);
    final RefreshRotationService refreshTokens =
            new RefreshRotationService(refreshRepository, generator, tokenConfig, clock);
    final PublicKeySetService publicKeys = new PublicKeySetService(keyManager);
    final TokenLifecycleService lifecycle = new TokenLifecycleService(
            issuer, verifier, refreshTokens, denylist, publicKeys, generator, users, tokenConfig);

    UserAccount user(String id, String role, long tokenVersion) {
        final var user = new UserAccount(id, role, null, tokenVersion);
        users.save(user);
        return user;
    }
}
