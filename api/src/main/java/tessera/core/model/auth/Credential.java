package tessera.core.model.auth;

import java.util.Map;

/**
 * Material presented by a caller to prove who they are.
 *
 * <p>Credentials are transient and never persisted. Each variant is accepted
 * by exactly one {@link StrategyKind}.
 */
public sealed interface Credential {

    /**
     * Identifier and secret checked against a stored password hash.
     *
     * @param identifier the subject identifier presented at login
     * @param secret     the plaintext secret
     */
    record Password(String identifier, String secret) implements Credential {

        @Override
        public String toString() {
            return "Password[identifier=" + identifier + "]";
        }
    }

    /**
     * Assertion already validated by an external identity provider.
     *
     * @param provider        provider name (e.g. "github")
     * @param providerSubject subject identifier at the provider
     * @param claims          claims the provider asserted
     */
    record ProviderAssertion(String provider, String providerSubject, Map<String, Object> claims)
            implements Credential {
        public ProviderAssertion {
            if (claims == null) {
                claims = Map.of();
            }
        }
    }

    /**
     * A previously issued access token.
     *
     * @param token compact serialized token
     */
    record PresentedToken(String token) implements Credential {

        @Override
        public String toString() {
            return "PresentedToken[redacted]";
        }
    }
}
