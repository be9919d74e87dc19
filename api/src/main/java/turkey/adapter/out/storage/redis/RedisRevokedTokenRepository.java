package turkey.adapter.out.storage.redis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turkey.core.model.auth.RevokedTokenEntry;
import turkey.spi.RevokedTokenRepository;

/**
 * Redis implementation of RevokedTokenRepository.
 *
 * <p>Key format: {@code turkey:revoked:{jti}} (hash). Each entry carries a
 * PEXPIREAT at the token's own expiry, so Redis bounds the denylist by itself
 * and the sweep only catches stragglers.
 */
public class RedisRevokedTokenRepository implements RevokedTokenRepository {

    private static final Logger LOG = Logger.getLogger(RedisRevokedTokenRepository.class);

    private static final String KEY_PREFIX = "turkey:revoked:";

    private static final String FIELD_JTI = "jti";
    private static final String FIELD_USER_ID = "userId";
    private static final String FIELD_APP_ID = "appId";
    private static final String FIELD_REASON = "reason";
    private static final String FIELD_EXPIRES_AT = "expiresAt";
    private static final String FIELD_CREATED_AT = "createdAt";

    /**
     * KEYS: entry hash. ARGV: expiresAt millis, field/value pairs...
     * Returns 1 if inserted, 0 if present.
     */
    private static final String INSERT_SCRIPT =
            """
            if redis.call('EXISTS', KEYS[1]) == 1 then
                return 0
            end
            redis.call('HSET', KEYS[1], unpack(ARGV, 2))
            redis.call('PEXPIREAT', KEYS[1], ARGV[1])
            return 1
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisRevokedTokenRepository(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = timeoutHelper;
        LOG.info("Initialized Redis revoked token repository");
    }

    @Override
    public Uni<Boolean> insertIfAbsent(RevokedTokenEntry entry) {
        final var args = new ArrayList<String>();
        args.add(INSERT_SCRIPT);
        args.add("1");
        args.add(KEY_PREFIX + entry.jti());
        args.add(RedisHashes.millis(entry.expiresAt()));
        args.addAll(RedisHashes.pairs(
                FIELD_JTI, entry.jti(),
                FIELD_USER_ID, entry.userId(),
                FIELD_APP_ID, entry.appId(),
                FIELD_REASON, entry.reason(),
                FIELD_EXPIRES_AT, RedisHashes.millis(entry.expiresAt()),
                FIELD_CREATED_AT, RedisHashes.millis(entry.createdAt())));

        return timeoutHelper
                .withTimeout(redisDataSource.execute("EVAL", args.toArray(new String[0])), "insertRevokedToken")
                .map(response -> response != null && response.toLong() == 1L);
    }

    @Override
    public Uni<Optional<RevokedTokenEntry>> find(String jti) {
        return timeoutHelper
                .withTimeout(hashCommands.hgetall(KEY_PREFIX + jti), "findRevokedToken")
                .map(fields -> Optional.ofNullable(fromHash(fields)));
    }

    @Override
    public Uni<Void> delete(String jti) {
        return timeoutHelper.withTimeoutSilent(
                keyCommands.del(KEY_PREFIX + jti).replaceWithVoid(), "deleteRevokedToken");
    }

    @Override
    public Uni<Integer> deleteExpired(Instant now) {
        return scanEntries()
                .onItem()
                .transformToUniAndConcatenate(key -> expiresAt(key).flatMap(expires -> {
                    if (expires == null || Long.parseLong(expires) > now.toEpochMilli()) {
                        return Uni.createFrom().item(0);
                    }
                    return timeoutHelper.withTimeout(keyCommands.del(key), "deleteExpiredRevokedToken");
                }))
                .collect()
                .with(Collectors.summingInt(Integer::intValue));
    }

    @Override
    public Uni<Long> countLive(Instant now) {
        return scanEntries()
                .onItem()
                .transformToUniAndConcatenate(this::expiresAt)
                .filter(expires -> expires != null && Long.parseLong(expires) > now.toEpochMilli())
                .collect()
                .with(Collectors.counting());
    }

    private Uni<String> expiresAt(String key) {
        return timeoutHelper.withTimeout(hashCommands.hget(key, FIELD_EXPIRES_AT), "readRevokedTokenExpiry");
    }

    private Multi<String> scanEntries() {
        return timeoutHelper.scanWithTimeout(
                keyCommands.scan(new KeyScanArgs().match(KEY_PREFIX + "*").count(1000)), "scanRevokedTokens");
    }

    private static RevokedTokenEntry fromHash(Map<String, String> fields) {
        if (fields == null || fields.isEmpty() || fields.get(FIELD_JTI) == null) {
            return null;
        }
        return new RevokedTokenEntry(
                fields.get(FIELD_JTI),
                fields.get(FIELD_USER_ID),
                fields.get(FIELD_APP_ID),
                fields.get(FIELD_REASON),
                RedisHashes.instant(fields, FIELD_EXPIRES_AT),
                RedisHashes.instant(fields, FIELD_CREATED_AT));
    }
}
