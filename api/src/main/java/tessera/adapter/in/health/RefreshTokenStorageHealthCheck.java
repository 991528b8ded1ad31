package tessera.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import tessera.core.service.session.SessionStorageProviderRegistry;

/**
 * Readiness of the selected refresh-token storage provider.
 */
@Readiness
@ApplicationScoped
public class RefreshTokenStorageHealthCheck implements HealthCheck {

    static final String NAME = "refresh-token-storage";

    private final SessionStorageProviderRegistry registry;

    @Inject
    public RefreshTokenStorageHealthCheck(SessionStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        final var provider = registry.selectedProvider();
        return provider.healthCheck()
                .orElseGet(() -> HealthCheckResponse.named(NAME)
                        .up()
                        .withData("provider", provider.name())
                        .build());
    }
}
