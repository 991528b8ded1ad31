package tessera.core.model.session;

import java.time.Instant;

import tessera.core.model.auth.AuthError;
import tessera.core.model.auth.Identity;

/**
 * Outcome of a login or refresh.
 */
public sealed interface SessionResult {

    /**
     * Tokens were issued.
     *
     * @param tokens   the new token pair
     * @param identity the identity embedded in the access token
     */
    record Issued(TokenPair tokens, Identity identity) implements SessionResult {}

    /**
     * Login or refresh was refused.
     *
     * @param error      internal failure category
     * @param retryAfter when a locked-out caller may retry (null unless {@link AuthError#LOCKED_OUT})
     */
    record Failed(AuthError error, Instant retryAfter) implements SessionResult {

        public static Failed of(AuthError error) {
            return new Failed(error, null);
        }
    }
}
