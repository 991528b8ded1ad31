package tessera.adapter.in.dto;

/**
 * Body of {@code POST /auth/login}.
 *
 * @param strategy   strategy name, e.g. {@code local-password}
 * @param credential fields for the chosen strategy
 */
public record LoginRequest(String strategy, CredentialDto credential) {

    /**
     * Union of the credential fields a client may present. Only the fields of
     * the chosen strategy are read.
     */
    public record CredentialDto(String identifier, String password, String token) {

        @Override
        public String toString() {
            return "CredentialDto[identifier=" + identifier + "]";
        }
    }
}
