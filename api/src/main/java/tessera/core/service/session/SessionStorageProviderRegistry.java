package tessera.core.service.session;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import tessera.core.config.SessionConfig;
import tessera.core.port.out.RefreshTokenRepository;
import tessera.spi.FailedAttemptRepository;
import tessera.spi.SessionStorageProvider;
import tessera.spi.StorageProviderException;

/**
 * Chooses the storage backend for refresh tokens and login lockouts.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider ({@code tessera.session.storage.provider}) if available</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 * The in-memory provider is always available, so selection only fails when no
 * provider is registered at all.
 */
@ApplicationScoped
public class SessionStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(SessionStorageProviderRegistry.class);

    private final List<SessionStorageProvider> providers;
    private final SessionConfig config;

    private volatile SessionStorageProvider selected;
    private volatile RefreshTokenRepository refreshTokenRepository;
    private volatile FailedAttemptRepository failedAttemptRepository;

    @Inject
    public SessionStorageProviderRegistry(Instance<SessionStorageProvider> providers, SessionConfig config) {
        this((Iterable<SessionStorageProvider>) providers, config);
    }

    public SessionStorageProviderRegistry(Iterable<SessionStorageProvider> providers, SessionConfig config) {
        this.providers = new ArrayList<>();
        providers.forEach(this.providers::add);
        this.config = config;
    }

    // Select on a worker thread at startup instead of on the first request's event loop
    void onStart(@Observes StartupEvent event) {
        LOG.infof("Session storage provider initialized: %s", selectedProvider().name());
    }

    public synchronized RefreshTokenRepository refreshTokenRepository() {
        if (refreshTokenRepository == null) {
            refreshTokenRepository = selectedProvider().createRefreshTokenRepository();
        }
        return refreshTokenRepository;
    }

    public synchronized FailedAttemptRepository failedAttemptRepository() {
        if (failedAttemptRepository == null) {
            failedAttemptRepository = selectedProvider().createFailedAttemptRepository();
        }
        return failedAttemptRepository;
    }

    public synchronized SessionStorageProvider selectedProvider() {
        if (selected == null) {
            selected = select();
        }
        return selected;
    }

    private SessionStorageProvider select() {
        final var configured = config.storage().provider();
        final var available = providers.stream()
                .filter(SessionStorageProvider::isAvailable)
                .sorted(Comparator.comparingInt(SessionStorageProvider::priority).reversed())
                .toList();

        LOG.debugf(
                "Available session storage providers: %s",
                available.stream().map(SessionStorageProvider::name).toList());

        for (SessionStorageProvider provider : available) {
            if (provider.name().equals(configured)) {
                LOG.infof("Using configured session storage provider: %s", configured);
                return provider;
            }
        }

        if (available.isEmpty()) {
            throw new StorageProviderException("No session storage providers available");
        }

        final var fallback = available.get(0);
        if (!"memory".equals(configured)) {
            LOG.warnf(
                    "Configured session storage provider '%s' is not available, falling back to %s",
                    configured, fallback.name());
        }
        return fallback;
    }
}
