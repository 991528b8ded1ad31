package tessera.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import tessera.core.port.out.RefreshTokenRepository;

/**
 * A backend that holds refresh-token records and login failure counters.
 *
 * <p>Both repositories come from the same provider. The registry picks the
 * provider named by {@code tessera.session.storage.provider} if it is
 * available, otherwise the available provider with the highest priority.
 * Built in: {@code redis} (100) and {@code memory} (0, single instance only).
 */
public interface SessionStorageProvider {

    /** Name matched against {@code tessera.session.storage.provider}. */
    String name();

    /** Higher wins when the configured provider is unavailable. */
    int priority();

    /** May block briefly while a connection check completes. */
    boolean isAvailable();

    /**
     * The refresh-token store. Called once; the result is cached.
     *
     * <p>{@link RefreshTokenRepository#compareAndSetStatus} and
     * {@link RefreshTokenRepository#revokeFamily} must each be atomic in the
     * backend, across every instance sharing it.
     */
    RefreshTokenRepository createRefreshTokenRepository();

    /** The failed-login store. Called once; the result is cached. */
    FailedAttemptRepository createFailedAttemptRepository();

    /** Readiness contribution, or empty to let the caller report a plain UP. */
    Optional<HealthCheckResponse> healthCheck();
}
