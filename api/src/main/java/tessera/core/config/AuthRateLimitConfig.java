package tessera.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Login lockout settings, prefix {@code tessera.auth.rate-limit}.
 *
 * <p>Only local-password logins are counted. Counting by both client address
 * and identifier stops a single source hammering many accounts as well as many
 * sources hammering one account.
 */
@ConfigMapping(prefix = "tessera.auth.rate-limit")
public interface AuthRateLimitConfig {

    @WithDefault("true")
    boolean enabled();

    /** Failures per key that trigger a lockout. */
    @WithDefault("5")
    int maxFailedAttempts();

    /** First lockout length; later ones grow by {@link #progressiveLockoutMultiplier()}. */
    @WithDefault("PT15M")
    Duration lockoutDuration();

    /** Failures older than this no longer count. */
    @WithDefault("PT1H")
    Duration failedAttemptWindow();

    @WithDefault("true")
    boolean trackByIp();

    @WithDefault("true")
    boolean trackByIdentifier();

    /** 1.0 keeps every lockout at the base length. */
    @WithDefault("1.5")
    double progressiveLockoutMultiplier();

    /** Cap on a single lockout. */
    @WithDefault("PT24H")
    Duration maxLockoutDuration();
}
