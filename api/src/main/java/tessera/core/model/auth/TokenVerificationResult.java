package tessera.core.model.auth;

import java.time.Instant;
import java.util.Map;

/**
 * Result of verifying an access token.
 */
public sealed interface TokenVerificationResult {

    /**
     * Token signature and time window are valid.
     *
     * @param subject   the {@code sub} claim
     * @param claims    custom claims, registered claims excluded
     * @param issuedAt  the {@code iat} claim
     * @param expiresAt the {@code exp} claim
     */
    record Valid(String subject, Map<String, Object> claims, Instant issuedAt, Instant expiresAt)
            implements TokenVerificationResult {
        public Valid {
            if (claims == null) {
                claims = Map.of();
            }
        }

        public Identity identity() {
            return new Identity(subject, claims);
        }
    }

    /**
     * Token was rejected.
     *
     * @param error  failure category
     * @param detail short description for logs; never returned to callers
     */
    record Invalid(TokenError error, String detail) implements TokenVerificationResult {}
}
