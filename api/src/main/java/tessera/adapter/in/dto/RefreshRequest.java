package tessera.adapter.in.dto;

/**
 * Body of {@code POST /auth/refresh} and {@code POST /auth/logout}.
 */
public record RefreshRequest(String refreshToken) {

    @Override
    public String toString() {
        return "RefreshRequest[redacted]";
    }
}
