package tessera.spi;

import java.time.Instant;

/**
 * Something a security team may want to alert on. Events carry hashed client
 * addresses and subject ids only, never token material or secrets.
 */
public sealed interface SecurityEvent {

    Instant timestamp();

    /** Truncated SHA-256 of the client address, or {@code unknown}. */
    String clientIdentifier();

    Severity severity();

    enum Severity {
        INFO,
        WARNING,
        /** Likely token theft. */
        CRITICAL
    }

    /**
     * Login failure event.
     *
     * @param timestamp when the failure occurred
     * @param clientIdentifier hashed client IP
     * @param reason failure category (e.g., "invalid_credentials")
     * @param attemptedMethod strategy that was attempted
     * @param failureCount number of recent failures for this key
     */
    record AuthenticationFailure(
            Instant timestamp, String clientIdentifier, String reason, String attemptedMethod, int failureCount)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return failureCount >= 5 ? Severity.WARNING : Severity.INFO;
        }
    }

    /**
     * Lockout triggered after too many failed logins.
     *
     * @param timestamp when the lockout started
     * @param clientIdentifier hashed client IP
     * @param lockedKey the tracking key that was locked (ip:... or user:...)
     * @param failedAttempts attempts that triggered the lockout
     * @param lockoutSeconds lockout duration
     */
    record AuthenticationLockout(
            Instant timestamp, String clientIdentifier, String lockedKey, int failedAttempts, long lockoutSeconds)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    /**
     * A refresh token that was already rotated or revoked was presented again.
     * The whole family has been revoked.
     *
     * @param timestamp when the replay was detected
     * @param clientIdentifier hashed client IP
     * @param subjectId subject owning the family
     * @param familyId the revoked family
     * @param revokedRecords number of records transitioned to revoked
     */
    record RefreshTokenReuse(
            Instant timestamp, String clientIdentifier, String subjectId, String familyId, int revokedRecords)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.CRITICAL;
        }
    }

    /**
     * Refresh token or family revoked on request.
     *
     * @param timestamp when the revocation happened
     * @param clientIdentifier hashed client IP
     * @param subjectId the subject (may be null for single-token logout of an unknown token)
     * @param reason revocation reason (e.g., "logout", "logout_all", "password_change")
     */
    record SessionRevoked(Instant timestamp, String clientIdentifier, String subjectId, String reason)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }
}
