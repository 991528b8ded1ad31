package tessera.adapter.out.auth;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.arc.DefaultBean;
import org.jboss.logging.Logger;
import org.jose4j.keys.HmacKey;

import tessera.core.config.TokenConfig;
import tessera.core.port.out.SigningKeySupplier;

/**
 * HMAC signing keys loaded from {@code tessera.token.signing.keys.<kid>}.
 *
 * <p>Each value is a base64 (standard or URL-safe) encoded secret. The key
 * named by {@code active-key-id} signs new tokens; every configured key is
 * accepted for verification, so a retired key can stay configured until the
 * tokens it signed have expired.
 *
 * <p>Startup fails if the active key is missing or any key is shorter than the
 * algorithm's hash output.
 */
@ApplicationScoped
@DefaultBean
public class ConfigSigningKeySupplier implements SigningKeySupplier {

    private static final Logger LOG = Logger.getLogger(ConfigSigningKeySupplier.class);

    private final Map<String, SigningKey> keys;
    private final SigningKey active;

    @Inject
    public ConfigSigningKeySupplier(TokenConfig config) {
        final var minimumBytes = minimumKeyBytes(config.algorithm());
        final Map<String, SigningKey> loaded = new LinkedHashMap<>();
        config.signing().keys().forEach((keyId, encoded) -> {
            final var secret = decode(keyId, encoded);
            if (secret.length < minimumBytes) {
                throw new IllegalStateException("Signing key '" + keyId + "' must be at least " + minimumBytes
                        + " bytes for " + config.algorithm() + ", was " + secret.length);
            }
            loaded.put(keyId, new SigningKey(keyId, new HmacKey(secret)));
        });

        this.keys = Map.copyOf(loaded);
        this.active = keys.get(config.signing().activeKeyId());
        if (active == null) {
            throw new IllegalStateException(
                    "Active signing key '" + config.signing().activeKeyId() + "' is not configured");
        }
        LOG.infof("Loaded %d signing key(s), active key id: %s", keys.size(), active.keyId());
    }

    @Override
    public SigningKey signingKey() {
        return active;
    }

    @Override
    public Optional<SigningKey> verificationKey(String keyId) {
        return Optional.ofNullable(keys.get(keyId));
    }

    static int minimumKeyBytes(String algorithm) {
        return switch (algorithm) {
            case "HS256" -> 32;
            case "HS384" -> 48;
            case "HS512" -> 64;
            default -> throw new IllegalStateException("Unsupported token algorithm: " + algorithm);
        };
    }

    private static byte[] decode(String keyId, String encoded) {
        final var value = encoded.trim();
        try {
            if (value.indexOf('-') >= 0 || value.indexOf('_') >= 0) {
                return Base64.getUrlDecoder().decode(value);
            }
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Signing key '" + keyId + "' is not valid base64", e);
        }
    }
}
