package tessera.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import tessera.core.port.out.RefreshTokenRepository;
import tessera.core.service.session.SessionStorageProviderRegistry;
import tessera.spi.FailedAttemptRepository;

/**
 * CDI producer for the repositories backed by the selected
 * {@link tessera.spi.SessionStorageProvider}.
 */
@ApplicationScoped
public class SessionStorageProducer {

    private final SessionStorageProviderRegistry registry;

    @Inject
    public SessionStorageProducer(SessionStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public RefreshTokenRepository refreshTokenRepository() {
        return registry.refreshTokenRepository();
    }

    @Produces
    @ApplicationScoped
    public FailedAttemptRepository failedAttemptRepository() {
        return registry.failedAttemptRepository();
    }
}
