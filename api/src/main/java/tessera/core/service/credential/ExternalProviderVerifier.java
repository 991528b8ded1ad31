package tessera.core.service.credential;

import java.util.LinkedHashMap;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tessera.core.config.SessionConfig;
import tessera.core.model.auth.Credential;
import tessera.core.model.auth.CredentialResult;
import tessera.core.model.auth.Identity;
import tessera.core.model.auth.StrategyKind;
import tessera.core.port.out.ExternalIdentityRepository;
import tessera.core.service.token.TokenIssuer;

/**
 * Maps an already-validated external provider assertion to a local identity.
 *
 * <p>Checking the assertion's signature and issuer is the provider
 * integration's job. This verifier only resolves, or provisions, the local
 * identity linked to the provider subject. Asserted claims that collide with
 * registered token claims are dropped.
 */
@ApplicationScoped
public class ExternalProviderVerifier implements CredentialVerifier {

    private static final Logger LOG = Logger.getLogger(ExternalProviderVerifier.class);

    private final ExternalIdentityRepository identities;
    private final SessionConfig config;

    public ExternalProviderVerifier(ExternalIdentityRepository identities, SessionConfig config) {
        this.identities = identities;
        this.config = config;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.EXTERNAL_PROVIDER;
    }

    @Override
    public Uni<CredentialResult> verify(Credential credential) {
        if (!(credential instanceof Credential.ProviderAssertion assertion)) {
            return Uni.createFrom()
                    .item(CredentialResult.Rejected.invalidCredentials("credential is not an assertion"));
        }
        if (isBlank(assertion.provider()) || isBlank(assertion.providerSubject())) {
            return Uni.createFrom().item(CredentialResult.Rejected.invalidCredentials("provider or subject missing"));
        }

        return identities
                .findByProviderSubject(assertion.provider(), assertion.providerSubject())
                .flatMap(found -> {
                    if (found.isPresent()) {
                        return Uni.createFrom().item(verified(found.get(), assertion));
                    }
                    if (!config.externalProvider().autoProvision()) {
                        LOG.debugf(
                                "No local identity for %s subject and auto-provisioning is off", assertion.provider());
                        return Uni.createFrom()
                                .item(CredentialResult.Rejected.invalidCredentials("no linked identity"));
                    }

                    final var identity = new Identity(UUID.randomUUID().toString(), assertion.claims())
                            .without(TokenIssuer.REGISTERED_CLAIMS);
                    return identities
                            .linkIfAbsent(assertion.provider(), assertion.providerSubject(), identity)
                            .invoke(linked -> LOG.infof(
                                    "Provisioned identity %s for %s subject", linked.subjectId(), assertion.provider()))
                            .map(linked -> verified(linked, assertion));
                });
    }

    private static CredentialResult verified(Identity linked, Credential.ProviderAssertion assertion) {
        final var claims = new LinkedHashMap<>(linked.claims());
        claims.putAll(assertion.claims());
        return new CredentialResult.Verified(
                new Identity(linked.subjectId(), claims).without(TokenIssuer.REGISTERED_CLAIMS));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
