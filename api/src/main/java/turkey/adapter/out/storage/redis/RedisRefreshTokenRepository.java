package turkey.adapter.out.storage.redis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turkey.core.model.auth.RefreshTokenRecord;
import turkey.spi.RefreshTokenRepository;

/**
 * Redis implementation of RefreshTokenRepository.
 *
 * <p>Key format:
 * <ul>
 *   <li>Record (hash): {@code turkey:rt:{id}}</li>
 *   <li>Hash lookup (string → id): {@code turkey:rt:hash:{tokenHash}}</li>
 *   <li>Per-user ids (set): {@code turkey:rt:user:{userId}}</li>
 * </ul>
 *
 * <p>Records and lookups expire on their own at {@code expiresAt}. Rotation and
 * revocation are Lua scripts so the "still unrevoked" check and the write are
 * one step. The expiry sweep prunes per-user sets of ids Redis already expired.
 */
public class RedisRefreshTokenRepository implements RefreshTokenRepository {

    private static final Logger LOG = Logger.getLogger(RedisRefreshTokenRepository.class);

    private static final String RECORD_PREFIX = "turkey:rt:";
    private static final String HASH_PREFIX = "turkey:rt:hash:";
    private static final String USER_PREFIX = "turkey:rt:user:";

    private static final String FIELD_ID = "id";
    private static final String FIELD_USER_ID = "userId";
    private static final String FIELD_TOKEN_HASH = "tokenHash";
    private static final String FIELD_CREATED_AT = "createdAt";
    private static final String FIELD_EXPIRES_AT = "expiresAt";
    private static final String FIELD_REVOKED_AT = "revokedAt";
    private static final String FIELD_REPLACED_BY = "replacedById";

    /**
     * Store a record with its lookup and user index.
     *
     * <p>KEYS: record hash, hash lookup, user set. ARGV: id, expiresAt millis, field/value pairs...
     */
    private static final String STORE_SCRIPT =
            """
            redis.call('HSET', KEYS[1], unpack(ARGV, 3))
            redis.call('PEXPIREAT', KEYS[1], ARGV[2])
            redis.call('SET', KEYS[2], ARGV[1])
            redis.call('PEXPIREAT', KEYS[2], ARGV[2])
            redis.call('SADD', KEYS[3], ARGV[1])
            return 1
            """;

    /**
     * Revoke the predecessor and store the successor, only if the predecessor is usable.
     *
     * <p>KEYS: predecessor hash, successor hash, successor lookup, user set.
     * ARGV: now millis, successor id, successor expiresAt millis, successor field/value pairs...
     */
    private static final String ROTATE_SCRIPT =
            """
            if redis.call('EXISTS', KEYS[1]) == 0 then
                return 0
            end
            if redis.call('HEXISTS', KEYS[1], 'revokedAt') == 1 then
                return 0
            end
            local expires = tonumber(redis.call('HGET', KEYS[1], 'expiresAt'))
            if expires == nil or expires <= tonumber(ARGV[1]) then
                return 0
            end
            redis.call('HSET', KEYS[1], 'revokedAt', ARGV[1], 'replacedById', ARGV[2])
            redis.call('HSET', KEYS[2], unpack(ARGV, 4))
            redis.call('PEXPIREAT', KEYS[2], ARGV[3])
            redis.call('SET', KEYS[3], ARGV[2])
            redis.call('PEXPIREAT', KEYS[3], ARGV[3])
            redis.call('SADD', KEYS[4], ARGV[2])
            return 1
            """;

    /**
     * Revoke a record if present and unrevoked.
     *
     * <p>KEYS: record hash. ARGV: now millis.
     */
    private static final String REVOKE_SCRIPT =
            """
            if redis.call('EXISTS', KEYS[1]) == 0 then
                return 0
            end
            if redis.call('HEXISTS', KEYS[1], 'revokedAt') == 1 then
                return 0
            end
            redis.call('HSET', KEYS[1], 'revokedAt', ARGV[1])
            return 1
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveSetCommands<String, String> setCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisRefreshTokenRepository(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.setCommands = redisDataSource.set(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = timeoutHelper;
        LOG.info("Initialized Redis refresh token repository");
    }

    @Override
    public Uni<Void> store(RefreshTokenRecord record) {
        final var args = new ArrayList<String>();
        args.add(STORE_SCRIPT);
        args.add("3");
        args.add(RECORD_PREFIX + record.id());
        args.add(HASH_PREFIX + record.tokenHash());
        args.add(USER_PREFIX + record.userId());
        args.add(record.id());
        args.add(RedisHashes.millis(record.expiresAt()));
        args.addAll(fields(record));

        return timeoutHelper
                .withTimeout(redisDataSource.execute("EVAL", args.toArray(new String[0])), "storeRefreshToken")
                .replaceWithVoid();
    }

    @Override
    public Uni<Optional<RefreshTokenRecord>> findByHash(String tokenHash) {
        return timeoutHelper
                .withTimeout(valueCommands.get(HASH_PREFIX + tokenHash), "findRefreshTokenByHash")
                .flatMap(id -> id == null ? Uni.createFrom().item(Optional.<RefreshTokenRecord>empty()) : findById(id));
    }

    @Override
    public Uni<Optional<RefreshTokenRecord>> findById(String id) {
        return timeoutHelper
                .withTimeout(hashCommands.hgetall(RECORD_PREFIX + id), "findRefreshTokenById")
                .map(fields -> Optional.ofNullable(fromHash(fields)));
    }

    @Override
    public Uni<Boolean> rotate(String predecessorId, RefreshTokenRecord successor, Instant at) {
        final var args = new ArrayList<String>();
        args.add(ROTATE_SCRIPT);
        args.add("4");
        args.add(RECORD_PREFIX + predecessorId);
        args.add(RECORD_PREFIX + successor.id());
        args.add(HASH_PREFIX + successor.tokenHash());
        args.add(USER_PREFIX + successor.userId());
        args.add(RedisHashes.millis(at));
        args.add(successor.id());
        args.add(RedisHashes.millis(successor.expiresAt()));
        args.addAll(fields(successor));

        return timeoutHelper
                .withTimeout(redisDataSource.execute("EVAL", args.toArray(new String[0])), "rotateRefreshToken")
                .map(response -> response != null && response.toLong() == 1L);
    }

    @Override
    public Uni<Boolean> revoke(String id, Instant at) {
        final var eval = redisDataSource.execute("EVAL", REVOKE_SCRIPT, "1", RECORD_PREFIX + id, RedisHashes.millis(at));
        return timeoutHelper
                .withTimeout(eval, "revokeRefreshToken")
                .map(response -> response != null && response.toLong() == 1L);
    }

    @Override
    public Uni<Integer> revokeAllForUser(String userId, Instant at) {
        return timeoutHelper
                .withTimeout(setCommands.smembers(USER_PREFIX + userId), "listUserRefreshTokens")
                .onItem()
                .transformToMulti(ids -> Multi.createFrom().iterable(ids))
                .onItem()
                .transformToUniAndConcatenate(id -> revoke(id, at))
                .filter(Boolean::booleanValue)
                .collect()
                .asList()
                .map(revoked -> revoked.size());
    }

    /**
     * Redis expires records itself at {@code expiresAt}. This removes what is
     * left: records past the cutoff that still exist, and per-user index entries
     * whose record is gone.
     */
    @Override
    public Uni<Integer> deleteExpiredBefore(Instant cutoff) {
        final var args = new KeyScanArgs().match(USER_PREFIX + "*").count(1000);
        return timeoutHelper
                .scanWithTimeout(keyCommands.scan(args), "scanRefreshTokenUsers")
                .onItem()
                .transformToUniAndConcatenate(userKey -> pruneUserIndex(userKey, cutoff))
                .collect()
                .with(Collectors.summingInt(Integer::intValue));
    }

    private Uni<Integer> pruneUserIndex(String userKey, Instant cutoff) {
        return timeoutHelper
                .withTimeout(setCommands.smembers(userKey), "listUserRefreshTokens")
                .onItem()
                .transformToMulti(ids -> Multi.createFrom().iterable(ids))
                .onItem()
                .transformToUniAndConcatenate(id -> findById(id).flatMap(found -> {
                    if (found.isPresent() && !found.get().expiresAt().isBefore(cutoff)) {
                        return Uni.createFrom().item(0);
                    }
                    final Uni<Integer> deleteRecord = found.isPresent()
                            ? timeoutHelper
                                    .withTimeout(
                                            keyCommands.del(RECORD_PREFIX + id, HASH_PREFIX + found.get().tokenHash()),
                                            "deleteExpiredRefreshToken")
                                    .replaceWith(1)
                            : Uni.createFrom().item(1);
                    return deleteRecord.call(() -> timeoutHelper.withTimeout(
                            setCommands.srem(userKey, id), "pruneUserRefreshTokens"));
                }))
                .collect()
                .with(Collectors.summingInt(Integer::intValue));
    }

    private static List<String> fields(RefreshTokenRecord record) {
        return RedisHashes.pairs(
                FIELD_ID, record.id(),
                FIELD_USER_ID, record.userId(),
                FIELD_TOKEN_HASH, record.tokenHash(),
                FIELD_CREATED_AT, RedisHashes.millis(record.createdAt()),
                FIELD_EXPIRES_AT, RedisHashes.millis(record.expiresAt()),
                FIELD_REVOKED_AT, RedisHashes.millis(record.revokedAt()),
                FIELD_REPLACED_BY, record.replacedById());
    }

    private static RefreshTokenRecord fromHash(Map<String, String> fields) {
        if (fields == null || fields.isEmpty() || fields.get(FIELD_ID) == null) {
            return null;
        }
        return new RefreshTokenRecord(
                fields.get(FIELD_ID),
                fields.get(FIELD_USER_ID),
                fields.get(FIELD_TOKEN_HASH),
                RedisHashes.instant(fields, FIELD_CREATED_AT),
                RedisHashes.instant(fields, FIELD_EXPIRES_AT),
                RedisHashes.instant(fields, FIELD_REVOKED_AT),
                fields.get(FIELD_REPLACED_BY));
    }
}
