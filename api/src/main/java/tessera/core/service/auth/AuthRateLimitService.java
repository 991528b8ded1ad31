package tessera.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tessera.core.config.AuthRateLimitConfig;
import tessera.spi.FailedAttemptRepository;

/**
 * Login lockout (brute force protection) for password logins.
 *
 * <p>Failed attempts are tracked by client IP and by login identifier. When
 * either key reaches the configured threshold it is locked out; each further
 * lockout of the same key lasts longer, up to a cap.
 */
@ApplicationScoped
public class AuthRateLimitService {

    private static final Logger LOG = Logger.getLogger(AuthRateLimitService.class);

    private static final String IP_PREFIX = "ip:";
    private static final String USER_PREFIX = "user:";

    private final AuthRateLimitConfig config;
    private final FailedAttemptRepository repository;
    private final Clock clock;

    public AuthRateLimitService(AuthRateLimitConfig config, FailedAttemptRepository repository, Clock clock) {
        this.config = config;
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Check whether a login may proceed.
     *
     * @param ip         client IP address (may be null)
     * @param identifier login identifier (may be null)
     * @return rate limit decision
     */
    public Uni<RateLimitResult> checkLoginLimit(String ip, String identifier) {
        if (!config.enabled()) {
            return Uni.createFrom().item(RateLimitResult.allow());
        }

        final var ipKey = ipKey(ip);
        final var identifierKey = identifierKey(identifier);

        final Uni<RateLimitResult> ipCheck =
                ipKey != null ? checkLockout(ipKey) : Uni.createFrom().item(RateLimitResult.allow());

        return ipCheck.flatMap(ipResult -> {
            if (!ipResult.allowed() || identifierKey == null) {
                return Uni.createFrom().item(ipResult);
            }
            return checkLockout(identifierKey);
        });
    }

    private Uni<RateLimitResult> checkLockout(String key) {
        return repository.getLockoutExpiry(key).map(expiry -> {
            if (expiry == null || !expiry.isAfter(clock.instant())) {
                return RateLimitResult.allow();
            }
            LOG.debugf("Login blocked for %s: locked out until %s", key, expiry);
            return RateLimitResult.blocked(key, expiry);
        });
    }

    /**
     * Record a failed login. Locks the key out when the threshold is reached.
     *
     * @param ip         client IP address (may be null)
     * @param identifier login identifier (may be null)
     * @param reason     failure reason for logging
     * @return the more severe of the IP and identifier outcomes
     */
    public Uni<LockoutResult> recordFailedAttempt(String ip, String identifier, String reason) {
        if (!config.enabled()) {
            return Uni.createFrom().item(LockoutResult.notLocked(0));
        }

        final var ipKey = ipKey(ip);
        final var identifierKey = identifierKey(identifier);

        final Uni<LockoutResult> ipResult = ipKey != null
                ? recordAttemptAndMaybeLockout(ipKey, reason)
                : Uni.createFrom().item(LockoutResult.notLocked(0));

        return ipResult.flatMap(ipLockout -> {
            if (identifierKey == null) {
                return Uni.createFrom().item(ipLockout);
            }
            return recordAttemptAndMaybeLockout(identifierKey, reason).map(identifierLockout -> {
                if (ipLockout.lockedOut() || identifierLockout.lockedOut()) {
                    return ipLockout.lockedOut() ? ipLockout : identifierLockout;
                }
                return ipLockout.attempts() >= identifierLockout.attempts() ? ipLockout : identifierLockout;
            });
        });
    }

    private Uni<LockoutResult> recordAttemptAndMaybeLockout(String key, String reason) {
        return repository.recordFailedAttempt(key, config.failedAttemptWindow()).flatMap(count -> {
            if (count < config.maxFailedAttempts()) {
                LOG.debugf("Failed login recorded for %s: count=%d", key, count);
                return Uni.createFrom().item(LockoutResult.notLocked(count.intValue()));
            }

            return repository.getLockoutCount(key).flatMap(previousLockouts -> {
                final var duration = progressiveLockout(previousLockouts);
                return repository
                        .recordLockout(key, duration, reason)
                        .call(() -> repository.clearFailedAttempts(key))
                        .map(v -> {
                            LOG.warnf("Login lockout triggered for %s: attempts=%d, duration=%s", key, count, duration);
                            return LockoutResult.locked(key, count.intValue(), duration);
                        });
            });
        });
    }

    Duration progressiveLockout(int previousLockouts) {
        if (config.progressiveLockoutMultiplier() <= 1.0) {
            return config.lockoutDuration();
        }
        final var multiplier = Math.pow(config.progressiveLockoutMultiplier(), previousLockouts);
        final var progressive = Duration.ofSeconds((long) (config.lockoutDuration().toSeconds() * multiplier));
        return progressive.compareTo(config.maxLockoutDuration()) > 0 ? config.maxLockoutDuration() : progressive;
    }

    /**
     * Forget failed attempts after a successful login.
     */
    public Uni<Void> clearFailedAttempts(String ip, String identifier) {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }

        final var ipKey = ipKey(ip);
        final var identifierKey = identifierKey(identifier);

        final Uni<Void> ipClear = ipKey != null ? repository.clearFailedAttempts(ipKey) : Uni.createFrom().voidItem();
        return ipClear.flatMap(v -> identifierKey != null
                ? repository.clearFailedAttempts(identifierKey)
                : Uni.createFrom().voidItem());
    }

    public boolean isEnabled() {
        return config.enabled();
    }

    private String ipKey(String ip) {
        return ip != null && !ip.isBlank() && config.trackByIp() ? IP_PREFIX + ip : null;
    }

    private String identifierKey(String identifier) {
        return identifier != null && !identifier.isBlank() && config.trackByIdentifier()
                ? USER_PREFIX + identifier
                : null;
    }

    /**
     * Result of a lockout check.
     *
     * @param allowed       true if the login should proceed
     * @param key           the key that is locked (null if allowed)
     * @param lockoutExpiry when the lockout ends (null if allowed)
     */
    public record RateLimitResult(boolean allowed, String key, Instant lockoutExpiry) {

        public static RateLimitResult allow() {
            return new RateLimitResult(true, null, null);
        }

        public static RateLimitResult blocked(String key, Instant lockoutExpiry) {
            return new RateLimitResult(false, key, lockoutExpiry);
        }
    }

    /**
     * Result of recording a failed attempt.
     *
     * @param lockedOut true if this attempt triggered a lockout
     * @param key       the locked key (null if not locked)
     * @param attempts  attempt count for the key
     * @param duration  lockout duration (null if not locked)
     */
    public record LockoutResult(boolean lockedOut, String key, int attempts, Duration duration) {

        public static LockoutResult notLocked(int attempts) {
            return new LockoutResult(false, null, attempts, null);
        }

        public static LockoutResult locked(String key, int attempts, Duration duration) {
            return new LockoutResult(true, key, attempts, duration);
        }
    }
}
