package tessera.spi;

import java.time.Duration;
import java.time.Instant;

import io.smallrye.mutiny.Uni;

/**
 * SPI for tracking failed logins and lockouts.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Increment operations MUST be atomic</li>
 *   <li>Entries MUST expire automatically based on the supplied durations</li>
 *   <li>All operations MUST be non-blocking (return Uni)</li>
 * </ul>
 *
 * <h2>Key Format</h2>
 * <ul>
 *   <li>{@code ip:<address>} - Track by client IP address</li>
 *   <li>{@code user:<identifier>} - Track by login identifier</li>
 * </ul>
 *
 * @see tessera.adapter.out.storage.memory.InMemoryFailedAttemptRepository
 * @see tessera.adapter.out.storage.redis.RedisFailedAttemptRepository
 */
public interface FailedAttemptRepository {

    /**
     * Record a failed attempt and return the count within the window.
     *
     * @param key tracking key
     * @param windowDuration how long the counter lives after the last failure
     * @return the updated count
     */
    Uni<Long> recordFailedAttempt(String key, Duration windowDuration);

    /**
     * Get the current failed attempt count.
     */
    Uni<Long> getFailedAttemptCount(String key);

    /**
     * Forget failed attempts, typically after a successful login.
     */
    Uni<Void> clearFailedAttempts(String key);

    /**
     * Lock a key and increment its lockout count.
     */
    Uni<Void> recordLockout(String key, Duration lockoutDuration, String reason);

    /**
     * Get the lockout expiry, or null when the key is not locked.
     */
    Uni<Instant> getLockoutExpiry(String key);

    /**
     * Remove a lockout.
     */
    Uni<Void> clearLockout(String key);

    /**
     * Number of times the key has been locked before. Used for progressive lockout.
     */
    Uni<Integer> getLockoutCount(String key);
}
