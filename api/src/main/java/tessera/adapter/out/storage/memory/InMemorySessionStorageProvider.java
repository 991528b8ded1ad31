package tessera.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import tessera.core.port.out.RefreshTokenRepository;
import tessera.spi.FailedAttemptRepository;
import tessera.spi.SessionStorageProvider;

/**
 * In-memory session storage provider.
 *
 * <p>Always available; used as the fallback when Redis is not reachable.
 * Not suitable when more than one instance serves the same users.
 */
@ApplicationScoped
public class InMemorySessionStorageProvider implements SessionStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemorySessionStorageProvider.class);
    private static final int PRIORITY = 0;

    private final Clock clock;
    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private InMemoryRefreshTokenRepository refreshTokens;
    private InMemoryFailedAttemptRepository failedAttempts;

    public InMemorySessionStorageProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized RefreshTokenRepository createRefreshTokenRepository() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("Refresh tokens are stored in memory only: sessions are lost on restart "
                    + "and not shared between instances. Configure Redis for production.");
        }
        if (refreshTokens == null) {
            refreshTokens = new InMemoryRefreshTokenRepository();
        }
        return refreshTokens;
    }

    @Override
    public synchronized FailedAttemptRepository createFailedAttemptRepository() {
        if (failedAttempts == null) {
            failedAttempts = new InMemoryFailedAttemptRepository(clock);
        }
        return failedAttempts;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("refresh-token-storage")
                .up()
                .withData("provider", name())
                .withData("records", refreshTokens != null ? refreshTokens.size() : 0)
                .build());
    }

    @PreDestroy
    synchronized void shutdown() {
        if (failedAttempts != null) {
            failedAttempts.shutdown();
        }
    }
}
