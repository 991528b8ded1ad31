package tessera.core.port.out;

import java.security.Key;
import java.util.Optional;

/**
 * Supplies keys for signing and verifying access tokens.
 */
public interface SigningKeySupplier {

    /**
     * Key used to sign new tokens.
     *
     * @return the active signing key
     * @throws IllegalStateException if no active key is configured
     */
    SigningKey signingKey();

    /**
     * Key used to verify a token carrying the given key id.
     *
     * @param keyId the {@code kid} header value
     * @return the key, or empty if the id is not recognised
     */
    Optional<SigningKey> verificationKey(String keyId);

    /**
     * A key with its identifier.
     *
     * @param keyId value written to the {@code kid} header
     * @param key   the secret key
     */
    record SigningKey(String keyId, Key key) {

        @Override
        public String toString() {
            return "SigningKey[keyId=" + keyId + "]";
        }
    }
}
