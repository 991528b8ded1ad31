package tessera.core.service.credential;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import tessera.core.config.SessionConfig;
import tessera.core.model.auth.StrategyKind;

/**
 * Resolves the enabled credential strategies.
 *
 * <p>The strategy list in {@code tessera.session.strategies} is validated
 * when the application starts: an unknown name, or a strategy without a
 * verifier, aborts startup with {@link UnsupportedStrategyException}.
 */
@ApplicationScoped
public class CredentialVerifierRegistry {

    private static final Logger LOG = Logger.getLogger(CredentialVerifierRegistry.class);

    private final Map<StrategyKind, CredentialVerifier> enabled;

    @Inject
    public CredentialVerifierRegistry(Instance<CredentialVerifier> verifiers, SessionConfig config) {
        this(verifiers.stream().toList(), config);
    }

    public CredentialVerifierRegistry(Iterable<CredentialVerifier> verifiers, SessionConfig config) {
        final Map<StrategyKind, CredentialVerifier> available = new EnumMap<>(StrategyKind.class);
        for (CredentialVerifier verifier : verifiers) {
            available.put(verifier.kind(), verifier);
        }

        final Map<StrategyKind, CredentialVerifier> selected = new EnumMap<>(StrategyKind.class);
        for (String name : config.strategies()) {
            final var kind = StrategyKind.fromConfigName(name)
                    .orElseThrow(() -> new UnsupportedStrategyException("Unknown credential strategy: " + name));
            final var verifier = available.get(kind);
            if (verifier == null) {
                throw new UnsupportedStrategyException("No verifier available for strategy: " + name);
            }
            selected.put(kind, verifier);
        }
        if (selected.isEmpty()) {
            throw new UnsupportedStrategyException("No credential strategies enabled");
        }
        this.enabled = Collections.unmodifiableMap(selected);
    }

    void onStart(@Observes StartupEvent event) {
        LOG.infof("Credential strategies enabled: %s", enabledStrategies());
    }

    /**
     * Verifier for an enabled strategy.
     *
     * @param kind requested strategy
     * @return the verifier, or empty if the strategy is not enabled
     */
    public Optional<CredentialVerifier> verifierFor(StrategyKind kind) {
        return Optional.ofNullable(enabled.get(kind));
    }

    public Set<StrategyKind> enabledStrategies() {
        return enabled.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(enabled.keySet()));
    }

    /**
     * Configuration names an unknown strategy or one that has no verifier.
     * Fatal at startup.
     */
    public static class UnsupportedStrategyException extends RuntimeException {
        public UnsupportedStrategyException(String message) {
            super(message);
        }
    }
}
