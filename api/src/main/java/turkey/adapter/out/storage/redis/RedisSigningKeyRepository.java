package turkey.adapter.out.storage.redis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turkey.core.model.auth.KeyStatus;
import turkey.core.model.auth.SigningKeyRecord;
import turkey.spi.SigningKeyRepository;

/**
 * Redis implementation of SigningKeyRepository, shared by every instance.
 *
 * <p>Key format:
 * <ul>
 *   <li>Key record (hash): {@code turkey:keys:{kid}}</li>
 *   <li>All kids (set): {@code turkey:keys:index}</li>
 *   <li>Active kids (set): {@code turkey:keys:active}</li>
 * </ul>
 *
 * <p>Bootstrap and retirement run as Lua scripts so the "no active key" and
 * "last active key" checks are atomic across instances. Private keys are
 * stored as base64 PKCS8; protect the Redis instance accordingly.
 */
public class RedisSigningKeyRepository implements SigningKeyRepository {

    private static final Logger LOG = Logger.getLogger(RedisSigningKeyRepository.class);

    private static final String KEY_PREFIX = "turkey:keys:";
    private static final String INDEX_KEY = "turkey:keys:index";
    private static final String ACTIVE_KEY = "turkey:keys:active";

    private static final String FIELD_KID = "kid";
    private static final String FIELD_ALG = "alg";
    private static final String FIELD_STATUS = "status";
    private static final String FIELD_CREATED_AT = "createdAt";
    private static final String FIELD_RETIRED_AT = "retiredAt";
    private static final String FIELD_PRIVATE_KEY = "privateKey";
    private static final String FIELD_PUBLIC_KEY = "publicKey";

    /**
     * Store a key record, optionally only when no key is active.
     *
     * <p>KEYS: index set, active set, record hash.
     * ARGV: conditional flag, kid, active flag, field/value pairs...
     * Returns 1 if stored, 0 if skipped.
     */
    private static final String STORE_SCRIPT =
            """
            if ARGV[1] == '1' and redis.call('SCARD', KEYS[2]) > 0 then
                return 0
            end
            redis.call('DEL', KEYS[3])
            redis.call('HSET', KEYS[3], unpack(ARGV, 4))
            redis.call('SADD', KEYS[1], ARGV[2])
            if ARGV[3] == '1' then
                redis.call('SADD', KEYS[2], ARGV[2])
            else
                redis.call('SREM', KEYS[2], ARGV[2])
            end
            return 1
            """;

    /**
     * Retire a key unless it is the last active one.
     *
     * <p>KEYS: active set, record hash. ARGV: kid, retiredAt millis.
     */
    private static final String RETIRE_SCRIPT =
            """
            if redis.call('EXISTS', KEYS[2]) == 0 then
                return 'NOT_FOUND'
            end
            if redis.call('SISMEMBER', KEYS[1], ARGV[1]) == 0 then
                return 'ALREADY_RETIRED'
            end
            if redis.call('SCARD', KEYS[1]) <= 1 then
                return 'LAST_ACTIVE'
            end
            redis.call('SREM', KEYS[1], ARGV[1])
            redis.call('HSET', KEYS[2], 'status', 'RETIRED', 'retiredAt', ARGV[2])
            return 'RETIRED'
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveSetCommands<String, String> setCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisSigningKeyRepository(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.setCommands = redisDataSource.set(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = timeoutHelper;
        LOG.info("Initialized Redis signing key repository");
    }

    @Override
    public Uni<Void> store(SigningKeyRecord key) {
        return timeoutHelper
                .withTimeout(runStore(key, false), "storeKey")
                .replaceWithVoid();
    }

    @Override
    public Uni<SigningKeyRecord> storeIfNoneActive(SigningKeyRecord candidate) {
        return timeoutHelper
                .withTimeout(runStore(candidate, true), "storeKeyIfNoneActive")
                .flatMap(stored -> {
                    if (stored) {
                        return Uni.createFrom().item(candidate);
                    }
                    return findByStatus(KeyStatus.ACTIVE).map(active -> active.stream()
                            .max(SigningKeyRecord.SIGNING_ORDER)
                            .orElseThrow(() -> new IllegalStateException(
                                    "Active key set non-empty but no active key record found")));
                });
    }

    private Uni<Boolean> runStore(SigningKeyRecord key, boolean onlyIfNoneActive) {
        final var args = new ArrayList<String>();
        args.add(STORE_SCRIPT);
        args.add("3");
        args.add(INDEX_KEY);
        args.add(ACTIVE_KEY);
        args.add(KEY_PREFIX + key.kid());
        args.add(onlyIfNoneActive ? "1" : "0");
        args.add(key.kid());
        args.add(key.isActive() ? "1" : "0");
        args.addAll(RedisHashes.pairs(
                FIELD_KID, key.kid(),
                FIELD_ALG, key.algorithm(),
                FIELD_STATUS, key.status().name(),
                FIELD_CREATED_AT, RedisHashes.millis(key.createdAt()),
                FIELD_RETIRED_AT, RedisHashes.millis(key.retiredAt()),
                FIELD_PRIVATE_KEY, key.encodedPrivateKey(),
                FIELD_PUBLIC_KEY, key.encodedPublicKey()));

        return redisDataSource
                .execute("EVAL", args.toArray(new String[0]))
                .map(response -> response != null && response.toLong() == 1L);
    }

    @Override
    public Uni<Optional<SigningKeyRecord>> findById(String kid) {
        return timeoutHelper
                .withTimeout(hashCommands.hgetall(KEY_PREFIX + kid), "findKeyById")
                .map(fields -> Optional.ofNullable(fromHash(fields)));
    }

    @Override
    public Uni<List<SigningKeyRecord>> findByStatus(KeyStatus status) {
        return findAll().map(keys ->
                keys.stream().filter(key -> key.status() == status).toList());
    }

    @Override
    public Uni<List<SigningKeyRecord>> findAll() {
        return timeoutHelper
                .withTimeout(setCommands.smembers(INDEX_KEY), "listKeyIds")
                .onItem()
                .transformToMulti(kids -> Multi.createFrom().iterable(kids))
                .onItem()
                .transformToUniAndConcatenate(this::findById)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect()
                .asList();
    }

    @Override
    public Uni<RetireOutcome> retire(String kid, Instant at) {
        final var eval = redisDataSource.execute(
                "EVAL",
                RETIRE_SCRIPT,
                "2",
                ACTIVE_KEY,
                KEY_PREFIX + kid,
                kid,
                RedisHashes.millis(at));
        return timeoutHelper
                .withTimeout(eval, "retireKey")
                .map(response -> RetireOutcome.valueOf(response.toString()));
    }

    @Override
    public Uni<Void> delete(String kid) {
        return timeoutHelper
                .withTimeout(
                        keyCommands
                                .del(KEY_PREFIX + kid)
                                .call(() -> setCommands.srem(INDEX_KEY, kid))
                                .call(() -> setCommands.srem(ACTIVE_KEY, kid)),
                        "deleteKey")
                .replaceWithVoid()
                .invoke(() -> LOG.debugf("Deleted signing key %s from Redis", kid));
    }

    private static SigningKeyRecord fromHash(Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return null;
        }
        final var privateKey = fields.get(FIELD_PRIVATE_KEY);
        return new SigningKeyRecord(
                fields.get(FIELD_KID),
                fields.get(FIELD_ALG),
                privateKey != null ? SigningKeyRecord.parsePrivateKey(privateKey) : null,
                SigningKeyRecord.parsePublicKey(fields.get(FIELD_PUBLIC_KEY)),
                KeyStatus.valueOf(fields.get(FIELD_STATUS)),
                RedisHashes.instant(fields, FIELD_CREATED_AT),
                RedisHashes.instant(fields, FIELD_RETIRED_AT));
    }
}
