package tessera.core.service.refresh;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tessera.core.config.SessionConfig;

/**
 * Periodically deletes refresh-token records that expired beyond the retention window.
 *
 * <p>Expired records are already rejected on lookup; the sweep only reclaims storage.
 */
@ApplicationScoped
public class RefreshTokenSweeper {

    private static final Logger LOG = Logger.getLogger(RefreshTokenSweeper.class);

    private final RefreshTokenService refreshTokenService;
    private final SessionConfig config;

    public RefreshTokenSweeper(RefreshTokenService refreshTokenService, SessionConfig config) {
        this.refreshTokenService = refreshTokenService;
        this.config = config;
    }

    @Scheduled(
            every = "${tessera.session.sweep.interval:10m}",
            delayed = "1m",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> sweep() {
        if (!config.sweep().enabled()) {
            return Uni.createFrom().voidItem();
        }

        return refreshTokenService
                .sweepExpired()
                .invoke(deleted -> {
                    if (deleted > 0) {
                        LOG.infof("Swept %d expired refresh token records", deleted);
                    }
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Refresh token sweep failed: %s", error.getMessage());
                    return 0;
                })
                .replaceWithVoid();
    }
}
