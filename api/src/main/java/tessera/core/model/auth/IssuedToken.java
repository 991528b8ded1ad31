package tessera.core.model.auth;

import java.time.Instant;

/**
 * A signed access token as handed to the caller.
 *
 * @param token     compact serialization ({@code header.payload.signature})
 * @param subjectId subject the token was issued for
 * @param issuedAt  issue time (second precision)
 * @param expiresAt expiry time (second precision)
 */
public record IssuedToken(String token, String subjectId, Instant issuedAt, Instant expiresAt) {

    @Override
    public String toString() {
        return "IssuedToken[subjectId=" + subjectId + ", expiresAt=" + expiresAt + "]";
    }
}
