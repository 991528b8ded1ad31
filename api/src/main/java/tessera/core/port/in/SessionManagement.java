package tessera.core.port.in;

import io.smallrye.mutiny.Uni;

import tessera.core.model.auth.Credential;
import tessera.core.model.auth.StrategyKind;
import tessera.core.model.session.SessionResult;

/**
 * Inbound port for login sessions.
 *
 * <p>A login starts a refresh-token family and returns an access token and a
 * refresh token. A refresh rotates the refresh token; presenting a token that
 * was already rotated revokes its whole family.
 */
public interface SessionManagement {

    /**
     * Verify a credential and issue a token pair.
     *
     * @param strategy   strategy to verify with
     * @param credential credential matching the strategy
     * @param clientIp   caller address used for lockout tracking (may be null)
     * @return {@link SessionResult.Issued} or {@link SessionResult.Failed}
     */
    Uni<SessionResult> login(StrategyKind strategy, Credential credential, String clientIp);

    /**
     * Login without client address tracking.
     */
    default Uni<SessionResult> login(StrategyKind strategy, Credential credential) {
        return login(strategy, credential, null);
    }

    /**
     * Exchange a refresh token for a new token pair.
     *
     * <p>Must not be retried automatically on failure: a replay of a token that
     * was rotated by the failed attempt counts as reuse.
     *
     * @param refreshToken raw refresh token
     * @param clientIp     caller address for security events (may be null)
     * @return {@link SessionResult.Issued} or {@link SessionResult.Failed}
     */
    Uni<SessionResult> refresh(String refreshToken, String clientIp);

    default Uni<SessionResult> refresh(String refreshToken) {
        return refresh(refreshToken, null);
    }

    /**
     * Revoke a single refresh token. Unknown tokens are ignored.
     *
     * @param refreshToken raw refresh token
     * @return completion signal
     */
    Uni<Void> logout(String refreshToken);

    /**
     * Revoke every refresh-token family belonging to a subject.
     *
     * @param subjectId subject identifier
     * @return number of records revoked
     */
    Uni<Integer> logoutAll(String subjectId);
}
