package tessera.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;

import tessera.core.model.auth.Identity;
import tessera.core.port.out.ExternalIdentityRepository;

/**
 * In-memory links between external provider subjects and local identities.
 *
 * <p>Data is NOT persisted across restarts.
 */
@ApplicationScoped
@DefaultBean
public class InMemoryExternalIdentityRepository implements ExternalIdentityRepository {

    private final ConcurrentHashMap<String, Identity> links = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<Identity>> findByProviderSubject(String provider, String providerSubject) {
        return Uni.createFrom().item(() -> Optional.ofNullable(links.get(key(provider, providerSubject))));
    }

    @Override
    public Uni<Identity> linkIfAbsent(String provider, String providerSubject, Identity identity) {
        return Uni.createFrom().item(() -> {
            final var existing = links.putIfAbsent(key(provider, providerSubject), identity);
            return existing != null ? existing : identity;
        });
    }

    // Provider names cannot contain a newline, so the key is unambiguous
    private static String key(String provider, String providerSubject) {
        return provider + "\n" + providerSubject;
    }
}
