package tessera.core.config;

import java.time.Duration;
import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for login sessions and refresh tokens.
 *
 * <p>Configuration prefix: {@code tessera.session}
 */
@ConfigMapping(prefix = "tessera.session")
public interface SessionConfig {

    /**
     * Refresh token lifetime. Each rotation issues a successor with a fresh lifetime.
     *
     * @return TTL (default: 14 days)
     */
    @WithDefault("P14D")
    Duration refreshTokenTtl();

    /**
     * Enabled credential strategies: local-password, external-provider, bearer-token.
     *
     * <p>An unknown name aborts startup.
     *
     * @return strategy names (default: local-password,bearer-token)
     */
    @WithDefault("local-password,bearer-token")
    List<String> strategies();

    /**
     * External provider strategy settings.
     */
    ExternalProviderConfig externalProvider();

    /**
     * Storage configuration.
     */
    StorageConfig storage();

    /**
     * Expired record sweep.
     */
    SweepConfig sweep();

    interface ExternalProviderConfig {

        /**
         * Create a local identity the first time a provider subject is seen.
         *
         * @return true to auto-provision (default: false)
         */
        @WithDefault("false")
        boolean autoProvision();
    }

    interface StorageConfig {

        /**
         * Storage provider name.
         *
         * <p>Available providers: redis, memory, or custom SPI name.
         *
         * @return provider name (default: redis)
         */
        @WithDefault("redis")
        String provider();

        /**
         * Redis-specific configuration.
         */
        RedisConfig redis();

        interface RedisConfig {

            /**
             * Key prefix for refresh-token data in Redis.
             *
             * @return key prefix (default: tessera:refresh:)
             */
            @WithDefault("tessera:refresh:")
            String keyPrefix();

            /**
             * Per-operation timeout. Timeouts surface as storage unavailable.
             *
             * @return timeout (default: 1 second)
             */
            @WithDefault("PT1S")
            Duration timeout();
        }
    }

    interface SweepConfig {

        /**
         * Enable the periodic sweep of expired records.
         *
         * @return true if enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Sweep interval in scheduler syntax, e.g. {@code 10m}.
         *
         * @return interval (default: 10m)
         */
        @WithDefault("10m")
        String interval();

        /**
         * How long records are kept after they expire.
         *
         * @return retention (default: 1 day)
         */
        @WithDefault("P1D")
        Duration retention();
    }
}
