package tessera.core.service.refresh;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;

import tessera.core.util.SecureHash;

/**
 * Generates refresh tokens and family identifiers.
 *
 * <p>Refresh tokens are 32 bytes (256 bits) of random data encoded as
 * URL-safe Base64. Storage only ever sees {@link #tokenId(String)}, the
 * SHA-256 digest of the raw token.
 */
@ApplicationScoped
public class RefreshTokenGenerator {

    private static final int TOKEN_BYTES = 32; // 256 bits
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    /**
     * Generate a new raw refresh token.
     *
     * @return a URL-safe Base64 encoded token (43 characters)
     */
    public String generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }

    /**
     * Storage key for a raw refresh token.
     *
     * @param rawToken token as presented by the caller
     * @return hex SHA-256 digest
     */
    public String tokenId(String rawToken) {
        return SecureHash.sha256Hex(rawToken);
    }

    /**
     * Generate a new family identifier.
     */
    public String newFamilyId() {
        return UUID.randomUUID().toString();
    }
}
