package tessera.adapter.in.dto;

/**
 * Body of {@code POST /auth/password}.
 */
public record ChangePasswordRequest(String currentPassword, String newPassword) {

    @Override
    public String toString() {
        return "ChangePasswordRequest[redacted]";
    }
}
