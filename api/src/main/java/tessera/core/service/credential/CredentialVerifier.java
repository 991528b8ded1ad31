package tessera.core.service.credential;

import io.smallrye.mutiny.Uni;

import tessera.core.model.auth.Credential;
import tessera.core.model.auth.CredentialResult;
import tessera.core.model.auth.StrategyKind;

/**
 * A credential verification strategy.
 *
 * <p>Every strategy returns the same result shape so the session layer does
 * not care which one ran. Failures are {@link CredentialResult.Rejected}
 * results, not exceptions; only infrastructure failures (storage, hashing pool)
 * fail the returned {@link Uni}.
 */
public interface CredentialVerifier {

    /**
     * The strategy this verifier implements.
     */
    StrategyKind kind();

    /**
     * Verify a credential.
     *
     * @param credential credential presented by the caller
     * @return verified identity or rejection
     */
    Uni<CredentialResult> verify(Credential credential);
}
