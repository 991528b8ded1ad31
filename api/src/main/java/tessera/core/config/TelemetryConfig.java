package tessera.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for security event telemetry.
 *
 * <p>Configuration prefix: {@code tessera.telemetry}
 */
@ConfigMapping(prefix = "tessera.telemetry")
public interface TelemetryConfig {

    /**
     * Security event dispatching.
     */
    SecurityConfig security();

    interface SecurityConfig {

        /**
         * Dispatch security events to the registered handlers.
         *
         * @return true if enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
