package tessera.adapter.out.telemetry;

import org.jboss.logging.Logger;

import tessera.spi.SecurityEvent;
import tessera.spi.SecurityEventHandler;

/**
 * Writes security events to the {@code tessera.security} log category.
 *
 * <p>INFO events log at DEBUG, WARNING at WARN and CRITICAL at ERROR.
 */
public class LoggingSecurityEventHandler implements SecurityEventHandler {

    private static final Logger LOG = Logger.getLogger("tessera.security");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(SecurityEvent event) {
        final var message = format(event);
        switch (event.severity()) {
            case INFO -> LOG.debug(message);
            case WARNING -> LOG.warn(message);
            case CRITICAL -> LOG.error(message);
        }
    }

    static String format(SecurityEvent event) {
        if (event instanceof SecurityEvent.AuthenticationFailure e) {
            return String.format(
                    "AUTH_FAILURE: client=%s reason=%s method=%s failures=%d",
                    e.clientIdentifier(), e.reason(), e.attemptedMethod(), e.failureCount());
        }
        if (event instanceof SecurityEvent.AuthenticationLockout e) {
            return String.format(
                    "AUTH_LOCKOUT: client=%s key=%s attempts=%d duration=%ds",
                    e.clientIdentifier(), e.lockedKey(), e.failedAttempts(), e.lockoutSeconds());
        }
        if (event instanceof SecurityEvent.RefreshTokenReuse e) {
            return String.format(
                    "REFRESH_REUSE: client=%s subject=%s family=%s revoked=%d",
                    e.clientIdentifier(), e.subjectId(), e.familyId(), e.revokedRecords());
        }
        final var e = (SecurityEvent.SessionRevoked) event;
        return String.format(
                "SESSION_REVOKED: client=%s subject=%s reason=%s", e.clientIdentifier(), e.subjectId(), e.reason());
    }
}
