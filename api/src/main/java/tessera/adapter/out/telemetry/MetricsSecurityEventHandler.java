package tessera.adapter.out.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import tessera.spi.SecurityEvent;
import tessera.spi.SecurityEventHandler;

/**
 * Records security events as Micrometer counters.
 *
 * <ul>
 *   <li>{@code tessera.security.events.total} - every event, by type and severity</li>
 *   <li>{@code tessera.security.auth.failures} - login failures, by reason and strategy</li>
 *   <li>{@code tessera.security.auth.lockouts} - lockouts, by key type</li>
 *   <li>{@code tessera.security.refresh.reuse} - refresh-token replays</li>
 *   <li>{@code tessera.security.sessions.revoked} - revocations, by reason</li>
 * </ul>
 */
public class MetricsSecurityEventHandler implements SecurityEventHandler {

    private MeterRegistry registry;

    public MetricsSecurityEventHandler() {
        // ServiceLoader
    }

    public MetricsSecurityEventHandler(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Called by the dispatcher after ServiceLoader instantiation.
     */
    public void setMeterRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return registry != null;
    }

    @Override
    public void handle(SecurityEvent event) {
        if (registry == null) {
            return;
        }

        Counter.builder("tessera.security.events.total")
                .description("Total security events")
                .tag("event_type", event.getClass().getSimpleName())
                .tag("severity", event.severity().name().toLowerCase())
                .register(registry)
                .increment();

        if (event instanceof SecurityEvent.AuthenticationFailure e) {
            Counter.builder("tessera.security.auth.failures")
                    .description("Login failures")
                    .tag("reason", e.reason())
                    .tag("method", e.attemptedMethod())
                    .register(registry)
                    .increment();
        } else if (event instanceof SecurityEvent.AuthenticationLockout e) {
            Counter.builder("tessera.security.auth.lockouts")
                    .description("Login lockouts (brute force protection)")
                    .tag("key_type", keyType(e.lockedKey()))
                    .register(registry)
                    .increment();
        } else if (event instanceof SecurityEvent.RefreshTokenReuse) {
            Counter.builder("tessera.security.refresh.reuse")
                    .description("Rotated or revoked refresh tokens presented again")
                    .register(registry)
                    .increment();
        } else if (event instanceof SecurityEvent.SessionRevoked e) {
            Counter.builder("tessera.security.sessions.revoked")
                    .description("Refresh token revocations")
                    .tag("reason", e.reason())
                    .register(registry)
                    .increment();
        }
    }

    private static String keyType(String lockedKey) {
        if (lockedKey == null) {
            return "unknown";
        }
        final var colon = lockedKey.indexOf(':');
        return colon > 0 ? lockedKey.substring(0, colon) : "unknown";
    }
}
