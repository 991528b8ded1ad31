package tessera.core.port.out;

import tessera.spi.SecurityEvent;

/**
 * Outbound port for raising security events.
 *
 * <p>Publishing is fire-and-forget and must not block or fail the caller.
 */
public interface SecurityEventPublisher {

    void publish(SecurityEvent event);
}
