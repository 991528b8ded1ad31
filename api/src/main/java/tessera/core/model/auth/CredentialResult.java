package tessera.core.model.auth;

/**
 * Outcome of a credential verification strategy.
 */
public sealed interface CredentialResult {

    record Verified(Identity identity) implements CredentialResult {}

    /**
     * @param reason failure category
     * @param detail log-only description
     */
    record Rejected(AuthError reason, String detail) implements CredentialResult {

        public static Rejected invalidCredentials(String detail) {
            return new Rejected(AuthError.INVALID_CREDENTIALS, detail);
        }
    }
}
