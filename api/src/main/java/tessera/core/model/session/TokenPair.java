package tessera.core.model.session;

import java.time.Instant;

/**
 * Access and refresh token handed to the caller after login or refresh.
 */
public record TokenPair(
        String accessToken, Instant accessTokenExpiresAt, String refreshToken, Instant refreshTokenExpiresAt) {

    @Override
    public String toString() {
        return "TokenPair[accessTokenExpiresAt=" + accessTokenExpiresAt + ", refreshTokenExpiresAt="
                + refreshTokenExpiresAt + "]";
    }
}
