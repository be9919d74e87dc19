package turkey.core.service.auth;

import java.security.InvalidAlgorithmParameterException;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turkey.core.config.KeyConfig;
import turkey.core.config.TokenConfig;
import turkey.core.model.auth.KeyStatus;
import turkey.core.model.auth.SigningKeyRecord;
import turkey.core.port.in.SigningKeyAdministration;
import turkey.spi.SigningKeyRepository;
import turkey.spi.SigningKeyRepository.RetireOutcome;

/**
 * Owns the signing key lifecycle: generation, lazy bootstrap, rotation,
 * retirement and the in-process key cache.
 *
 * <h2>Signing key selection</h2>
 * The newest ACTIVE key signs. Several keys may be ACTIVE during a graceful
 * rotation; all of them verify.
 *
 * <h2>Bootstrap</h2>
 * When storage holds no ACTIVE key, the first caller of {@link #getSigningKey()}
 * generates one. Concurrent callers in this process share a single in-flight
 * bootstrap; across processes the repository's insert-if-absent picks one winner.
 *
 * <h2>Thread Safety</h2>
 * The cache is a single immutable {@link CacheState} behind an atomic reference.
 * Each reload takes a sequence number before it reads storage, and a snapshot
 * is installed only if no reload that started later has been installed already.
 * A slow reload that read storage before a rotation can therefore never
 * overwrite the snapshot the rotation installed.
 *
 * <p>Reloads triggered by reads (the schedule, a kid miss, the first lookup)
 * share one in-flight reload. Reloads after a write always start a new one, so
 * they read storage after the write.
 */
@ApplicationScoped
public class KeyManager implements SigningKeyAdministration {

    private static final Logger LOG = Logger.getLogger(KeyManager.class);

    private static final String CURVE = "secp256r1";
    private static final Duration MISS_REFRESH_INTERVAL = Duration.ofSeconds(30);
    private static final Comparator<SigningKeyRecord> NEWEST_FIRST = SigningKeyRecord.SIGNING_ORDER.reversed();

    private final SigningKeyRepository repository;
    private final TokenConfig tokenConfig;
    private final KeyConfig keyConfig;
    private final SecureTokenGenerator generator;
    private final Clock clock;

    /**
     * Immutable cache state snapshot.
     */
    private record CacheState(
            SigningKeyRecord signingKey,
            Map<String, SigningKeyRecord> verificationKeyMap,
            List<SigningKeyRecord> verificationKeys,
            Instant lastRefresh,
            long sequence) {

        static final CacheState EMPTY = new CacheState(null, Map.of(), List.of(), null, 0L);
    }

    private final AtomicReference<CacheState> cache = new AtomicReference<>(CacheState.EMPTY);
    private final AtomicLong reloadSequence = new AtomicLong();

    private final Object reloadLock = new Object();

    // guarded by reloadLock
    private Uni<CacheState> reloadInFlight;

    private final Object bootstrapLock = new Object();

    // guarded by bootstrapLock
    private Uni<SigningKeyRecord> bootstrapInFlight;

    @Inject
    public KeyManager(
            SigningKeyRepository repository,
            TokenConfig tokenConfig,
            KeyConfig keyConfig,
            SecureTokenGenerator generator,
            Clock clock) {
        this.repository = repository;
        this.tokenConfig = tokenConfig;
        this.keyConfig = keyConfig;
        this.generator = generator;
        this.clock = clock;
    }

    /**
     * Generate a fresh P-256 key pair with a new kid. Nothing is persisted.
     *
     * @throws IllegalStateException if the JVM cannot generate EC keys
     */
    public SigningKeyRecord generateKeyPair() {
        try {
            final var keyGen = KeyPairGenerator.getInstance("EC");
            keyGen.initialize(new ECGenParameterSpec(CURVE));
            final var keyPair = keyGen.generateKeyPair();
            return SigningKeyRecord.active(
                    generator.keyId(),
                    (ECPrivateKey) keyPair.getPrivate(),
                    (ECPublicKey) keyPair.getPublic(),
                    clock.instant());
        } catch (NoSuchAlgorithmException | InvalidAlgorithmParameterException e) {
            throw new IllegalStateException("EC P-256 key generation not available", e);
        }
    }

    /**
     * Store a key as ACTIVE and reload the cache.
     */
    public Uni<Void> activateAndPersist(SigningKeyRecord key) {
        if (!key.canSign()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Key " + key.kid() + " cannot sign"));
        }
        return repository
                .store(key)
                .invoke(() -> LOG.infov("Signing key {0} activated", key.kid()))
                .flatMap(v -> refreshCache())
                .replaceWithVoid();
    }

    /**
     * Get the key used for new signatures, bootstrapping one if storage has none.
     *
     * @return Uni with the current signing key; fails with
     *         {@link NoActiveSigningKeyException} if bootstrap could not produce one
     */
    public Uni<SigningKeyRecord> getSigningKey() {
        final var key = cache.get().signingKey();
        if (key != null) {
            return Uni.createFrom().item(key);
        }
        return loadOrBootstrap();
    }

    private Uni<SigningKeyRecord> loadOrBootstrap() {
        synchronized (bootstrapLock) {
            final var key = cache.get().signingKey();
            if (key != null) {
                return Uni.createFrom().item(key);
            }
            if (bootstrapInFlight == null) {
                bootstrapInFlight = sharedReload()
                        .flatMap(state -> state.signingKey() != null
                                ? Uni.createFrom().item(state.signingKey())
                                : bootstrapKey())
                        .onTermination()
                        .invoke(this::clearBootstrap)
                        .memoize()
                        .indefinitely();
            }
            return bootstrapInFlight;
        }
    }

    private void clearBootstrap() {
        synchronized (bootstrapLock) {
            bootstrapInFlight = null;
        }
    }

    private Uni<SigningKeyRecord> bootstrapKey() {
        return Uni.createFrom()
                .item(this::generateKeyPair)
                .flatMap(candidate -> repository.storeIfNoneActive(candidate).invoke(winner -> {
                    if (winner.kid().equals(candidate.kid())) {
                        LOG.infov("Bootstrapped signing key {0}", winner.kid());
                    } else {
                        LOG.infov("Signing key {0} was bootstrapped concurrently, discarding {1}",
                                winner.kid(), candidate.kid());
                    }
                }))
                .flatMap(winner -> refreshCache())
                .map(state -> {
                    if (state.signingKey() == null) {
                        throw new NoActiveSigningKeyException("No active signing key after bootstrap");
                    }
                    return state.signingKey();
                });
    }

    /**
     * Public halves of every ACTIVE key, newest first.
     */
    public Uni<List<SigningKeyRecord>> listActivePublicKeys() {
        return repository.findByStatus(KeyStatus.ACTIVE).map(keys -> keys.stream()
                .sorted(NEWEST_FIRST)
                .map(SigningKeyRecord::withoutPrivateKey)
                .toList());
    }

    /**
     * Keys that can still verify a live token: every ACTIVE key plus RETIRED keys
     * whose signed tokens may not have expired yet. Newest first, without private keys.
     */
    public Uni<List<SigningKeyRecord>> listVerificationKeys() {
        final var state = cache.get();
        final Uni<CacheState> source =
                state.lastRefresh() == null ? sharedReload() : Uni.createFrom().item(state);
        final var now = clock.instant();
        return source.map(s -> s.verificationKeys().stream()
                .filter(k -> k.canVerifyAt(now, verificationTail()))
                .toList());
    }

    /**
     * Resolve the key named by a token's kid header.
     *
     * <p>A miss triggers one cache reload (at most every few seconds) so keys
     * rotated in by another instance are found.
     */
    public Uni<Optional<SigningKeyRecord>> getVerificationKey(String kid) {
        final var state = cache.get();
        final var cached = state.verificationKeyMap().get(kid);
        if (cached != null || !missRefreshDue(state)) {
            return Uni.createFrom().item(usableForVerification(cached));
        }
        return sharedReload().map(s -> usableForVerification(s.verificationKeyMap().get(kid)));
    }

    private boolean missRefreshDue(CacheState state) {
        return state.lastRefresh() == null
                || state.lastRefresh().plus(MISS_REFRESH_INTERVAL).isBefore(clock.instant());
    }

    private Optional<SigningKeyRecord> usableForVerification(SigningKeyRecord key) {
        if (key == null || !key.canVerifyAt(clock.instant(), verificationTail())) {
            return Optional.empty();
        }
        return Optional.of(key);
    }

    /**
     * Retire a key.
     *
     * <p>Retiring an already retired key is a no-op.
     *
     * @throws KeyNotFoundException   (via Uni failure) if the kid is unknown
     * @throws LastActiveKeyException (via Uni failure) if the key is the only ACTIVE key
     */
    public Uni<Void> retire(String kid) {
        return repository.retire(kid, clock.instant()).flatMap(outcome -> switch (outcome) {
            case RETIRED -> {
                LOG.warnv("Signing key {0} retired", kid);
                yield refreshCache().replaceWithVoid();
            }
            case ALREADY_RETIRED -> {
                LOG.debugf("Signing key %s already retired", kid);
                yield Uni.createFrom().voidItem();
            }
            case NOT_FOUND -> Uni.createFrom().failure(new KeyNotFoundException("Key not found: " + kid));
            case LAST_ACTIVE -> Uni.createFrom()
                    .failure(new LastActiveKeyException(
                            "Refusing to retire " + kid + ": it is the last active signing key"));
        });
    }

    /**
     * Generate and activate a new key. Unless {@code gracefulKeepOld}, every
     * previously active key is retired afterwards.
     *
     * <p>The new key is stored before anything is retired, so the store never
     * passes through a state with no ACTIVE key.
     *
     * @return Uni with the new key, without private material
     */
    public Uni<SigningKeyRecord> rotate(boolean gracefulKeepOld) {
        return Uni.createFrom()
                .item(this::generateKeyPair)
                .flatMap(newKey -> repository
                        .store(newKey)
                        .flatMap(v -> gracefulKeepOld ? Uni.createFrom().item(0) : retireAllExcept(newKey.kid()))
                        .invoke(retired -> LOG.infov(
                                "Rotated signing key: new key {0}, {1} previous key(s) retired",
                                newKey.kid(), retired))
                        .flatMap(retired -> refreshCache())
                        .replaceWith(newKey.withoutPrivateKey()));
    }

    private Uni<Integer> retireAllExcept(String keepKid) {
        final var now = clock.instant();
        return repository
                .findByStatus(KeyStatus.ACTIVE)
                .onItem()
                .transformToMulti(keys -> Multi.createFrom().iterable(keys))
                .filter(key -> !key.kid().equals(keepKid))
                .onItem()
                .transformToUniAndConcatenate(key -> repository.retire(key.kid(), now))
                .filter(outcome -> outcome == RetireOutcome.RETIRED)
                .collect()
                .asList()
                .map(List::size);
    }

    /**
     * Delete retired keys past the retention period.
     *
     * @return Uni with the number of keys deleted
     */
    public Uni<Integer> deleteExpiredRetiredKeys() {
        final var cutoff = clock.instant().minus(retentionPeriod());
        return repository
                .findByStatus(KeyStatus.RETIRED)
                .map(retired -> retired.stream()
                        .filter(key -> key.retiredAt().isBefore(cutoff))
                        .toList())
                .flatMap(toDelete -> {
                    if (toDelete.isEmpty()) {
                        return Uni.createFrom().item(0);
                    }
                    LOG.infov("Deleting {0} retired signing key(s) past retention period", toDelete.size());
                    return Multi.createFrom()
                            .iterable(toDelete)
                            .onItem()
                            .transformToUniAndConcatenate(key -> repository
                                    .delete(key.kid())
                                    .invoke(() -> LOG.infov("Deleted retired key: {0}", key.kid())))
                            .collect()
                            .asList()
                            .flatMap(deleted -> refreshCache().replaceWith(deleted.size()));
                });
    }

    /**
     * Reload the key cache from storage.
     *
     * <p>Runs periodically so rotations done by other instances become visible.
     * If the reload fails, the previous snapshot stays in place.
     */
    @Scheduled(
            every = "${turkey.auth.keys.cache-refresh-interval:5m}",
            delayed = "${turkey.auth.keys.cache-refresh-interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> scheduledRefresh() {
        return sharedReload().replaceWithVoid();
    }

    /**
     * Join the reload already in flight, or start one.
     */
    private Uni<CacheState> sharedReload() {
        synchronized (reloadLock) {
            if (reloadInFlight == null) {
                reloadInFlight = refreshCache()
                        .onTermination()
                        .invoke(this::clearReload)
                        .memoize()
                        .indefinitely();
            }
            return reloadInFlight;
        }
    }

    private void clearReload() {
        synchronized (reloadLock) {
            reloadInFlight = null;
        }
    }

    /**
     * Start a new reload. The sequence number is taken on subscription, before storage is read.
     *
     * @return Uni with the snapshot in place once this reload finished, which is
     *         a newer one than this reload's own if a later reload won
     */
    private Uni<CacheState> refreshCache() {
        return Uni.createFrom()
                .deferred(() -> {
                    final var sequence = reloadSequence.incrementAndGet();
                    return repository.findAll().map(keys -> install(snapshot(keys, sequence)));
                })
                .onFailure()
                .invoke(e -> LOG.error("Failed to refresh signing key cache", e));
    }

    private CacheState install(CacheState candidate) {
        final var installed = cache.accumulateAndGet(
                candidate, (current, next) -> next.sequence() > current.sequence() ? next : current);
        if (installed == candidate) {
            LOG.debugf(
                    "Key cache refreshed: signing key %s, %d verification keys",
                    candidate.signingKey() != null ? candidate.signingKey().kid() : "none",
                    candidate.verificationKeys().size());
        } else {
            LOG.debugf(
                    "Discarded key cache snapshot %d, snapshot %d is newer",
                    candidate.sequence(), installed.sequence());
        }
        return installed;
    }

    private CacheState snapshot(List<SigningKeyRecord> keys, long sequence) {
        final var now = clock.instant();
        final var tail = verificationTail();

        final var signingKey = keys.stream()
                .filter(SigningKeyRecord::canSign)
                .max(SigningKeyRecord.SIGNING_ORDER)
                .orElse(null);

        final var verificationKeys = keys.stream()
                .filter(key -> key.canVerifyAt(now, tail))
                .sorted(NEWEST_FIRST)
                .map(SigningKeyRecord::withoutPrivateKey)
                .toList();

        final var keyMap = new HashMap<String, SigningKeyRecord>();
        for (var key : verificationKeys) {
            keyMap.put(key.kid(), key);
        }

        return new CacheState(signingKey, Map.copyOf(keyMap), verificationKeys, now, sequence);
    }

    /**
     * How long after retirement a key's signatures may still be live.
     */
    Duration verificationTail() {
        return tokenConfig.accessTokenTtl().plus(tokenConfig.clockSkew());
    }

    /**
     * Configured retention, raised to the verification tail if configured shorter.
     */
    Duration retentionPeriod() {
        final var configured = keyConfig.retentionPeriod();
        final var floor = verificationTail();
        return configured.compareTo(floor) < 0 ? floor : configured;
    }

    // SigningKeyAdministration

    @Override
    public Uni<SigningKeyRecord> generateKey() {
        return Uni.createFrom()
                .item(this::generateKeyPair)
                .flatMap(key -> activateAndPersist(key).replaceWith(key.withoutPrivateKey()));
    }

    @Override
    public Uni<Void> retireKey(String kid) {
        return retire(kid);
    }

    @Override
    public Uni<SigningKeyRecord> rotateKeys(boolean gracefulKeepOld) {
        LOG.warnv("Key rotation requested (gracefulKeepOld={0})", gracefulKeepOld);
        return rotate(gracefulKeepOld);
    }

    @Override
    public Uni<List<SigningKeyRecord>> listKeys() {
        return repository.findAll().map(keys -> keys.stream()
                .sorted(NEWEST_FIRST)
                .map(SigningKeyRecord::withoutPrivateKey)
                .toList());
    }

    /**
     * Exception thrown when a key is not found.
     */
    public static class KeyNotFoundException extends RuntimeException {
        public KeyNotFoundException(String message) {
            super(message);
        }
    }

    /**
     * Exception thrown when retiring a key would leave nothing to sign with.
     */
    public static class LastActiveKeyException extends RuntimeException {
        public LastActiveKeyException(String message) {
            super(message);
        }
    }

    /**
     * Exception thrown when no signing key is available for issuance.
     */
    public static class NoActiveSigningKeyException extends RuntimeException {
        public NoActiveSigningKeyException(String message) {
            super(message);
        }
    }
}
