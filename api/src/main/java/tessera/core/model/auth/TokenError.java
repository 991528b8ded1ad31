package tessera.core.model.auth;

/**
 * Reasons an access token fails verification.
 */
public enum TokenError {
    /** Current time is past the expiry plus the allowed clock skew. */
    EXPIRED,
    /** Signature does not verify, or the algorithm or key id is not accepted. */
    BAD_SIGNATURE,
    /** Wrong segment count, undecodable segment, or missing required claim. */
    MALFORMED,
    /** Issuer, audience or issue time constraint not met. */
    CLAIM_MISMATCH;

    public AuthError toAuthError() {
        return switch (this) {
            case EXPIRED -> AuthError.EXPIRED_TOKEN;
            case BAD_SIGNATURE -> AuthError.BAD_SIGNATURE;
            case MALFORMED -> AuthError.MALFORMED_TOKEN;
            case CLAIM_MISMATCH -> AuthError.CLAIM_MISMATCH;
        };
    }
}
