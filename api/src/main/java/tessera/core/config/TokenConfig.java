package tessera.core.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for access tokens.
 *
 * <p>Configuration prefix: {@code tessera.token}
 */
@ConfigMapping(prefix = "tessera.token")
public interface TokenConfig {

    /**
     * JWS algorithm used to sign access tokens: HS256, HS384 or HS512.
     *
     * @return algorithm (default: HS256)
     */
    @WithDefault("HS256")
    String algorithm();

    /**
     * Access token lifetime.
     *
     * <p>Access tokens cannot be revoked before they expire, so keep this short.
     *
     * @return TTL (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration accessTokenTtl();

    /**
     * Tolerance applied to expiry and issue-time checks. Must be between 0 and 60 seconds.
     *
     * @return clock skew (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration clockSkew();

    /**
     * Value of the {@code iss} claim. When set, verification requires it.
     */
    Optional<String> issuer();

    /**
     * Value of the {@code aud} claim. When set, verification requires it
     * unless the caller supplies its own expected audience.
     */
    Optional<String> audience();

    /**
     * Signing keys.
     */
    SigningConfig signing();

    interface SigningConfig {

        /**
         * Key id used to sign new tokens. Must be present in {@link #keys()}.
         *
         * @return active key id (default: k1)
         */
        @WithDefault("k1")
        String activeKeyId();

        /**
         * Base64-encoded HMAC secrets by key id.
         *
         * <p>Retired keys stay listed until every token they signed has expired.
         *
         * @return secrets keyed by key id
         */
        Map<String, String> keys();
    }
}
