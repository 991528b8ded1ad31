package tessera.adapter.in.dto;

import java.time.Clock;
import java.time.Duration;

import tessera.core.model.session.TokenPair;

/**
 * Token pair returned by login and refresh.
 *
 * @param accessToken      signed access token
 * @param tokenType        always {@code Bearer}
 * @param expiresIn        seconds until the access token expires
 * @param refreshToken     single-use refresh token
 * @param refreshExpiresIn seconds until the refresh token expires
 */
public record TokenResponse(
        String accessToken, String tokenType, long expiresIn, String refreshToken, long refreshExpiresIn) {

    public static TokenResponse from(TokenPair pair, Clock clock) {
        final var now = clock.instant();
        return new TokenResponse(
                pair.accessToken(),
                "Bearer",
                Math.max(0, Duration.between(now, pair.accessTokenExpiresAt()).toSeconds()),
                pair.refreshToken(),
                Math.max(0, Duration.between(now, pair.refreshTokenExpiresAt()).toSeconds()));
    }

    @Override
    public String toString() {
        return "TokenResponse[expiresIn=" + expiresIn + ", refreshExpiresIn=" + refreshExpiresIn + "]";
    }
}
