package tessera.core.service.credential;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import tessera.core.model.auth.Credential;
import tessera.core.model.auth.CredentialResult;
import tessera.core.model.auth.StrategyKind;
import tessera.core.model.auth.TokenVerificationResult;
import tessera.core.service.token.TokenVerifier;

/**
 * Accepts a valid, unexpired access token as proof of identity.
 *
 * <p>Intended for service-to-service calls that already hold an access token.
 */
@ApplicationScoped
public class BearerTokenVerifier implements CredentialVerifier {

    private final TokenVerifier tokenVerifier;

    public BearerTokenVerifier(TokenVerifier tokenVerifier) {
        this.tokenVerifier = tokenVerifier;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.BEARER_TOKEN;
    }

    @Override
    public Uni<CredentialResult> verify(Credential credential) {
        if (!(credential instanceof Credential.PresentedToken presented)) {
            return Uni.createFrom().item(CredentialResult.Rejected.invalidCredentials("credential is not a token"));
        }

        final var result = tokenVerifier.verify(presented.token());
        if (result instanceof TokenVerificationResult.Valid valid) {
            return Uni.createFrom().item(new CredentialResult.Verified(valid.identity()));
        }
        final var invalid = (TokenVerificationResult.Invalid) result;
        return Uni.createFrom()
                .item(new CredentialResult.Rejected(invalid.error().toAuthError(), invalid.detail()));
    }
}
