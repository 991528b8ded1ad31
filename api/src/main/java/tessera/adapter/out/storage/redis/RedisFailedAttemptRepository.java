package tessera.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tessera.spi.FailedAttemptRepository;

/**
 * Redis failed login and lockout tracking.
 *
 * <p>Key format:
 * <ul>
 *   <li>Failed attempts: {@code tessera:auth:failed:{key}} (counter with window TTL)</li>
 *   <li>Lockout: {@code tessera:auth:lockout:{key}} (hash with lockedAt, expiresAt, reason)</li>
 *   <li>Lockout count: {@code tessera:auth:lockout-count:{key}} (kept 30 days)</li>
 * </ul>
 *
 * <p>Every operation fails open: if Redis cannot be reached, logins are not
 * blocked.
 */
public class RedisFailedAttemptRepository implements FailedAttemptRepository {

    private static final Logger LOG = Logger.getLogger(RedisFailedAttemptRepository.class);

    private static final String FAILED_PREFIX = "tessera:auth:failed:";
    private static final String LOCKOUT_PREFIX = "tessera:auth:lockout:";
    private static final String LOCKOUT_COUNT_PREFIX = "tessera:auth:lockout-count:";
    private static final Duration LOCKOUT_COUNT_TTL = Duration.ofDays(30);

    private static final String FIELD_LOCKED_AT = "lockedAt";
    private static final String FIELD_EXPIRES_AT = "expiresAt";
    private static final String FIELD_REASON = "reason";

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;
    private final Clock clock;

    public RedisFailedAttemptRepository(
            ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper, Clock clock) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = timeoutHelper;
        this.clock = clock;
    }

    @Override
    public Uni<Long> recordFailedAttempt(String key, Duration window) {
        final var redisKey = FAILED_PREFIX + key;
        final var operation = valueCommands
                .incr(redisKey)
                .call(count -> keyCommands.expire(redisKey, window.toSeconds()))
                .invoke(count -> LOG.debugf("Recorded failed attempt for %s: count=%d", key, count));
        return timeoutHelper.withTimeoutFallback(operation, "recordFailedAttempt", () -> 0L);
    }

    @Override
    public Uni<Long> getFailedAttemptCount(String key) {
        final var operation = valueCommands
                .get(FAILED_PREFIX + key)
                .map(value -> value != null ? Long.parseLong(value) : 0L);
        return timeoutHelper.withTimeoutFallback(operation, "getFailedAttemptCount", () -> 0L);
    }

    @Override
    public Uni<Void> clearFailedAttempts(String key) {
        final var operation = keyCommands.del(FAILED_PREFIX + key).replaceWithVoid();
        return timeoutHelper.withTimeoutFallback(operation, "clearFailedAttempts", () -> null);
    }

    @Override
    public Uni<Void> recordLockout(String key, Duration duration, String reason) {
        final var lockoutKey = LOCKOUT_PREFIX + key;
        final var countKey = LOCKOUT_COUNT_PREFIX + key;
        final var now = clock.instant();
        final var expiresAt = now.plus(duration);
        final var fields = Map.of(
                FIELD_LOCKED_AT, String.valueOf(now.toEpochMilli()),
                FIELD_EXPIRES_AT, String.valueOf(expiresAt.toEpochMilli()),
                FIELD_REASON, reason != null ? reason : "max_failed_attempts");

        final var operation = hashCommands
                .hset(lockoutKey, fields)
                .call(() -> keyCommands.expire(lockoutKey, Math.max(1, duration.toSeconds())))
                .call(() -> valueCommands.incr(countKey))
                .call(() -> keyCommands.expire(countKey, LOCKOUT_COUNT_TTL.toSeconds()))
                .replaceWithVoid()
                .invoke(() -> LOG.infof("Recorded lockout for %s: reason=%s, expires=%s", key, reason, expiresAt));
        return timeoutHelper.withTimeoutFallback(operation, "recordLockout", () -> null);
    }

    @Override
    public Uni<Instant> getLockoutExpiry(String key) {
        final var operation = hashCommands.hget(LOCKOUT_PREFIX + key, FIELD_EXPIRES_AT).map(value -> {
            if (value == null) {
                return null;
            }
            final var expiresAt = Instant.ofEpochMilli(Long.parseLong(value));
            return expiresAt.isAfter(clock.instant()) ? expiresAt : null;
        });
        return timeoutHelper.withTimeoutFallback(operation, "getLockoutExpiry", () -> null);
    }

    @Override
    public Uni<Void> clearLockout(String key) {
        final var operation = keyCommands
                .del(LOCKOUT_PREFIX + key)
                .replaceWithVoid()
                .invoke(() -> LOG.infof("Cleared lockout for %s", key));
        return timeoutHelper.withTimeoutFallback(operation, "clearLockout", () -> null);
    }

    @Override
    public Uni<Integer> getLockoutCount(String key) {
        final var operation = valueCommands
                .get(LOCKOUT_COUNT_PREFIX + key)
                .map(value -> value != null ? Integer.parseInt(value) : 0);
        return timeoutHelper.withTimeoutFallback(operation, "getLockoutCount", () -> 0);
    }
}
