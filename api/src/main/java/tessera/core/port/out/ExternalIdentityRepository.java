package tessera.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import tessera.core.model.auth.Identity;

/**
 * Maps subjects at external identity providers to local identities.
 */
public interface ExternalIdentityRepository {

    /**
     * Find the local identity linked to a provider subject.
     *
     * @param provider        provider name
     * @param providerSubject subject at the provider
     * @return linked identity, or empty on first sight
     */
    Uni<Optional<Identity>> findByProviderSubject(String provider, String providerSubject);

    /**
     * Link a provider subject to a local identity unless a link already exists.
     *
     * @param provider        provider name
     * @param providerSubject subject at the provider
     * @param identity        identity to link
     * @return the linked identity; the existing one if another caller linked first
     */
    Uni<Identity> linkIfAbsent(String provider, String providerSubject, Identity identity);
}
