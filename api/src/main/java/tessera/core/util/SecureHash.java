package tessera.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 digests of sensitive values.
 *
 * <p>Used to key refresh tokens in storage and to pseudonymise client
 * addresses in security events, so the original value is never stored or
 * logged but stays deterministically identifiable.
 */
public final class SecureHash {

    private static final int MAX_HEX_CHARS = 64;

    private SecureHash() {}

    /**
     * Return the full SHA-256 hex digest of the input string.
     *
     * @param input the string to hash
     * @return 64 character lowercase hex digest
     */
    public static String sha256Hex(String input) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is required on every Java platform", e);
        }
    }

    /**
     * Return a truncated SHA-256 hex digest of the input string.
     *
     * @param input    the string to hash
     * @param hexChars number of hex characters to return (1-64)
     * @return truncated hex digest
     * @throws IllegalArgumentException if hexChars is less than 1 or greater than 64
     */
    public static String truncatedSha256(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        return sha256Hex(input).substring(0, hexChars);
    }

    /**
     * Pseudonymous client identifier for security events.
     *
     * @param clientIp client address, may be null
     * @return 16 hex characters, or "unknown"
     */
    public static String clientIdentifier(String clientIp) {
        return clientIp == null || clientIp.isBlank() ? "unknown" : truncatedSha256(clientIp, 16);
    }
}
