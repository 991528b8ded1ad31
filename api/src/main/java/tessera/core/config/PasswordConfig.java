package tessera.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for password hashing.
 *
 * <p>Configuration prefix: {@code tessera.password}
 *
 * @see tessera.core.service.password.PasswordHasher
 */
@ConfigMapping(prefix = "tessera.password")
public interface PasswordConfig {

    /**
     * bcrypt cost exponent for new hashes (work = 2^cost).
     *
     * <p>Pick a value so that one hash takes roughly 100-400ms on production
     * hardware. Existing hashes with a different cost are migrated on the
     * next successful login.
     *
     * @return cost factor (default: 12)
     */
    @WithDefault("12")
    int costFactor();

    /**
     * bcrypt version identifier for new hashes: 2a, 2b or 2y.
     *
     * @return version (default: 2b)
     */
    @WithDefault("2b")
    String algorithmVersion();

    /**
     * Dedicated worker pool for hashing.
     */
    WorkerPoolConfig workerPool();

    interface WorkerPoolConfig {

        /**
         * Number of hashing threads.
         *
         * @return thread count (default: 4)
         */
        @WithDefault("4")
        int threads();

        /**
         * Pending hash operations allowed before new requests are rejected.
         *
         * @return queue capacity (default: 256)
         */
        @WithDefault("256")
        int queueCapacity();
    }
}
