package tessera.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tessera.spi.FailedAttemptRepository;

/**
 * In-memory failed login and lockout tracking.
 *
 * <p>For development and single-instance deployments. Counters are lost on
 * restart and not shared across instances.
 */
public class InMemoryFailedAttemptRepository implements FailedAttemptRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryFailedAttemptRepository.class);

    /** Lockout history used for progressive lockout is kept this long after the last lockout. */
    static final Duration LOCKOUT_COUNT_RETENTION = Duration.ofDays(30);

    private final ConcurrentMap<String, AttemptWindow> attempts = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Lockout> lockouts = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LockoutHistory> lockoutCounts = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryFailedAttemptRepository(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "failed-attempt-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
    }

    @Override
    public Uni<Long> recordFailedAttempt(String key, Duration window) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var updated = attempts.compute(key, (k, existing) -> {
                if (existing == null || !now.isBefore(existing.expiresAt())) {
                    return new AttemptWindow(1, now.plus(window));
                }
                return new AttemptWindow(existing.count() + 1, now.plus(window));
            });
            return (long) updated.count();
        });
    }

    @Override
    public Uni<Long> getFailedAttemptCount(String key) {
        return Uni.createFrom().item(() -> {
            final var entry = attempts.get(key);
            if (entry == null || !clock.instant().isBefore(entry.expiresAt())) {
                return 0L;
            }
            return (long) entry.count();
        });
    }

    @Override
    public Uni<Void> clearFailedAttempts(String key) {
        return Uni.createFrom().item(() -> {
            attempts.remove(key);
            return null;
        });
    }

    @Override
    public Uni<Void> recordLockout(String key, Duration duration, String reason) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var expiresAt = now.plus(duration);
            lockoutCounts.compute(key, (k, existing) -> existing == null || isStale(existing, now)
                    ? new LockoutHistory(1, now)
                    : new LockoutHistory(existing.count() + 1, now));
            lockouts.put(key, new Lockout(expiresAt, reason));
            LOG.infof("Recorded lockout for %s: reason=%s, expires=%s", key, reason, expiresAt);
            return null;
        });
    }

    @Override
    public Uni<Instant> getLockoutExpiry(String key) {
        return Uni.createFrom().item(() -> {
            final var lockout = lockouts.get(key);
            if (lockout == null || !clock.instant().isBefore(lockout.expiresAt())) {
                return null;
            }
            return lockout.expiresAt();
        });
    }

    @Override
    public Uni<Void> clearLockout(String key) {
        return Uni.createFrom().item(() -> {
            lockouts.remove(key);
            LOG.infof("Cleared lockout for %s", key);
            return null;
        });
    }

    @Override
    public Uni<Integer> getLockoutCount(String key) {
        return Uni.createFrom().item(() -> {
            final var history = lockoutCounts.get(key);
            return history == null || isStale(history, clock.instant()) ? 0 : history.count();
        });
    }

    void cleanupExpired() {
        final var now = clock.instant();
        attempts.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().expiresAt()));
        lockouts.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().expiresAt()));
        lockoutCounts.entrySet().removeIf(entry -> isStale(entry.getValue(), now));
    }

    private static boolean isStale(LockoutHistory history, Instant now) {
        return !now.isBefore(history.lastLockedAt().plus(LOCKOUT_COUNT_RETENTION));
    }

    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record AttemptWindow(int count, Instant expiresAt) {}

    private record Lockout(Instant expiresAt, String reason) {}

    private record LockoutHistory(int count, Instant lastLockedAt) {}
}
