package tessera.core.model.auth;

/**
 * Failure taxonomy for login and refresh.
 *
 * <p>These distinctions are for logs and security events. Callers over HTTP
 * only ever see a generic failure, apart from {@link #LOCKED_OUT}.
 */
public enum AuthError {
    INVALID_CREDENTIALS,
    EXPIRED_TOKEN,
    BAD_SIGNATURE,
    MALFORMED_TOKEN,
    CLAIM_MISMATCH,
    UNKNOWN_TOKEN,
    REUSE_DETECTED,
    LOCKED_OUT;

    /**
     * Metric and log friendly name, e.g. {@code reuse_detected}.
     */
    public String code() {
        return name().toLowerCase();
    }
}
