package turkey.core.service.auth;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turkey.core.config.SweepConfig;

/**
 * Periodic reclamation of expired authentication state.
 *
 * <p>One scheduled task sweeps expired refresh tokens, expired denylist entries,
 * stale lockout records and retired keys past retention. Each sweep fails on its
 * own: an error is logged and the remaining sweeps still run; the next tick
 * retries. Sweeps are idempotent and safe alongside live validation.
 */
@ApplicationScoped
public class ExpirySweepJob {

    private static final Logger LOG = Logger.getLogger(ExpirySweepJob.class);

    private final RefreshRotationService refreshTokens;
    private final RevocationDenylist denylist;
    private final LockoutTracker lockout;
    private final KeyManager keyManager;
    private final SweepConfig config;
    private final Clock clock;

    /**
     * Counts removed by one sweep run; -1 marks a sweep that failed.
     */
    public record SweepReport(int refreshTokens, int denylistEntries, int lockoutRecords, int retiredKeys) {}

    @Inject
    public ExpirySweepJob(
            RefreshRotationService refreshTokens,
            RevocationDenylist denylist,
            LockoutTracker lockout,
            KeyManager keyManager,
            SweepConfig config,
            Clock clock) {
        this.refreshTokens = refreshTokens;
        this.denylist = denylist;
        this.lockout = lockout;
        this.keyManager = keyManager;
        this.config = config;
        this.clock = clock;
    }

    void onStart(@Observes StartupEvent event) {
        if (!config.runOnStart()) {
            return;
        }
        sweep().subscribe()
                .with(
                        report -> LOG.debug("Startup expiry sweep finished"),
                        failure -> LOG.error("Startup expiry sweep failed", failure));
    }

    @Scheduled(
            every = "${turkey.auth.sweep.interval:24h}",
            delayed = "${turkey.auth.sweep.interval:24h}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> scheduledSweep() {
        return sweep().replaceWithVoid();
    }

    /**
     * Run every sweep once.
     */
    public Uni<SweepReport> sweep() {
        final var now = clock.instant();
        return guarded("refresh tokens", refreshTokens.sweepExpired(now))
                .flatMap(refresh -> guarded("denylist", denylist.sweepExpired())
                        .flatMap(denied -> guarded("lockouts", Uni.createFrom().item(lockout::sweepStale))
                                .flatMap(lockouts -> guarded("retired keys", keyManager.deleteExpiredRetiredKeys())
                                        .map(keys -> new SweepReport(refresh, denied, lockouts, keys)))))
                .invoke(report -> LOG.infov(
                        "Expiry sweep: {0} refresh tokens, {1} denylist entries, {2} lockout records, {3} retired keys",
                        report.refreshTokens(), report.denylistEntries(), report.lockoutRecords(), report.retiredKeys()));
    }

    private static Uni<Integer> guarded(String name, Uni<Integer> sweep) {
        return sweep.onFailure().recoverWithItem(e -> {
            LOG.errorv(e, "Expiry sweep of {0} failed, will retry on next run", name);
            return -1;
        });
    }
}
