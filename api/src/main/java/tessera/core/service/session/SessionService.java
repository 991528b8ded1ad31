package tessera.core.service.session;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tessera.core.model.auth.AuthError;
import tessera.core.model.auth.Credential;
import tessera.core.model.auth.CredentialResult;
import tessera.core.model.auth.Identity;
import tessera.core.model.auth.IssuedToken;
import tessera.core.model.auth.StrategyKind;
import tessera.core.model.session.IssuedRefreshToken;
import tessera.core.model.session.RotationResult;
import tessera.core.model.session.SessionResult;
import tessera.core.model.session.TokenPair;
import tessera.core.port.in.SessionManagement;
import tessera.core.port.out.SecurityEventPublisher;
import tessera.core.service.auth.AuthRateLimitService;
import tessera.core.service.credential.CredentialVerifierRegistry;
import tessera.core.service.refresh.RefreshTokenService;
import tessera.core.service.token.TokenIssuer;
import tessera.core.util.SecureHash;
import tessera.spi.SecurityEvent;

/**
 * Orchestrates credential verification, access-token issuance and
 * refresh-token rotation.
 *
 * <p>Access tokens are stateless: logout revokes refresh-token families only,
 * and an access token already handed out stays valid until it expires.
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    private final CredentialVerifierRegistry verifiers;
    private final TokenIssuer tokenIssuer;
    private final RefreshTokenService refreshTokens;
    private final AuthRateLimitService rateLimiter;
    private final SecurityEventPublisher events;
    private final Clock clock;

    public SessionService(
            CredentialVerifierRegistry verifiers,
            TokenIssuer tokenIssuer,
            RefreshTokenService refreshTokens,
            AuthRateLimitService rateLimiter,
            SecurityEventPublisher events,
            Clock clock) {
        this.verifiers = verifiers;
        this.tokenIssuer = tokenIssuer;
        this.refreshTokens = refreshTokens;
        this.rateLimiter = rateLimiter;
        this.events = events;
        this.clock = clock;
    }

    @Override
    public Uni<SessionResult> login(StrategyKind strategy, Credential credential, String clientIp) {
        if (strategy == null || credential == null) {
            return Uni.createFrom().item(SessionResult.Failed.of(AuthError.INVALID_CREDENTIALS));
        }

        final var verifier = verifiers.verifierFor(strategy);
        if (verifier.isEmpty()) {
            LOG.debugf("Login rejected: strategy %s is not enabled", strategy.configName());
            publishFailure(strategy, AuthError.INVALID_CREDENTIALS, clientIp, 0);
            return Uni.createFrom().item(SessionResult.Failed.of(AuthError.INVALID_CREDENTIALS));
        }

        final var identifier = lockoutIdentifier(strategy, credential);
        final var trackIp = strategy == StrategyKind.LOCAL_PASSWORD ? clientIp : null;

        return lockoutCheck(strategy, trackIp, identifier).flatMap(limit -> {
            if (!limit.allowed()) {
                return Uni.createFrom()
                        .item((SessionResult) new SessionResult.Failed(AuthError.LOCKED_OUT, limit.lockoutExpiry()));
            }
            return verifier.get().verify(credential).flatMap(result -> {
                if (result instanceof CredentialResult.Verified verified) {
                    return onVerified(strategy, verified.identity(), trackIp, identifier);
                }
                final var rejected = (CredentialResult.Rejected) result;
                return onRejected(strategy, rejected, trackIp, identifier, clientIp);
            });
        });
    }

    private Uni<AuthRateLimitService.RateLimitResult> lockoutCheck(
            StrategyKind strategy, String clientIp, String identifier) {
        if (strategy != StrategyKind.LOCAL_PASSWORD) {
            return Uni.createFrom().item(AuthRateLimitService.RateLimitResult.allow());
        }
        return rateLimiter.checkLoginLimit(clientIp, identifier);
    }

    private Uni<SessionResult> onVerified(
            StrategyKind strategy, Identity identity, String trackIp, String identifier) {
        final Uni<Void> cleared = strategy == StrategyKind.LOCAL_PASSWORD
                ? rateLimiter.clearFailedAttempts(trackIp, identifier)
                : Uni.createFrom().voidItem();

        // access token first, so a refused identity never leaves a stored refresh token
        return cleared.flatMap(v -> Uni.createFrom().item(() -> tokenIssuer.issue(identity)))
                .flatMap(access -> refreshTokens.issue(identity).map(refresh -> {
                    final var pair = tokenPair(access, refresh);
                    LOG.infof("Login succeeded for %s via %s", identity.subjectId(), strategy.configName());
                    return (SessionResult) new SessionResult.Issued(pair, identity);
                }));
    }

    private Uni<SessionResult> onRejected(
            StrategyKind strategy,
            CredentialResult.Rejected rejected,
            String trackIp,
            String identifier,
            String clientIp) {
        LOG.debugf("Login rejected via %s: %s", strategy.configName(), rejected.reason().code());

        if (strategy != StrategyKind.LOCAL_PASSWORD) {
            publishFailure(strategy, rejected.reason(), clientIp, 0);
            return Uni.createFrom().item(SessionResult.Failed.of(rejected.reason()));
        }

        return rateLimiter
                .recordFailedAttempt(trackIp, identifier, rejected.reason().code())
                .map(lockout -> {
                    publishFailure(strategy, rejected.reason(), clientIp, lockout.attempts());
                    if (lockout.lockedOut()) {
                        events.publish(new SecurityEvent.AuthenticationLockout(
                                clock.instant(),
                                SecureHash.clientIdentifier(clientIp),
                                lockout.key(),
                                lockout.attempts(),
                                lockout.duration().toSeconds()));
                    }
                    return (SessionResult) SessionResult.Failed.of(rejected.reason());
                });
    }

    @Override
    public Uni<SessionResult> refresh(String refreshToken, String clientIp) {
        return refreshTokens.rotate(refreshToken, clientIp).map(result -> {
            if (result instanceof RotationResult.Rotated rotated) {
                final var previous = rotated.previous();
                final var identity = new Identity(previous.subjectId(), previous.claims())
                        .without(TokenIssuer.REGISTERED_CLAIMS);
                return new SessionResult.Issued(
                        tokenPair(tokenIssuer.issue(identity), rotated.successor()), identity);
            }
            if (result instanceof RotationResult.ReuseDetected) {
                return SessionResult.Failed.of(AuthError.REUSE_DETECTED);
            }
            return SessionResult.Failed.of(AuthError.UNKNOWN_TOKEN);
        });
    }

    @Override
    public Uni<Void> logout(String refreshToken) {
        return refreshTokens.revoke(refreshToken).invoke(revoked -> revoked.ifPresent(record -> {
                    LOG.infof("Logout for %s revoked a token in family %s", record.subjectId(), record.familyId());
                    events.publish(new SecurityEvent.SessionRevoked(
                            clock.instant(), SecureHash.clientIdentifier(null), record.subjectId(), "logout"));
                }))
                .replaceWithVoid();
    }

    @Override
    public Uni<Integer> logoutAll(String subjectId) {
        return revokeAll(subjectId, "logout_all");
    }

    /**
     * Revoke every family of a subject and record why.
     *
     * @param subjectId subject identifier
     * @param reason    revocation reason for the security event
     * @return number of records revoked
     */
    public Uni<Integer> revokeAll(String subjectId, String reason) {
        if (subjectId == null || subjectId.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Subject id cannot be null or blank"));
        }
        return refreshTokens.revokeAllForSubject(subjectId).invoke(count -> {
            LOG.infof("Revoked %d refresh tokens for %s (%s)", count, subjectId, reason);
            events.publish(new SecurityEvent.SessionRevoked(
                    clock.instant(), SecureHash.clientIdentifier(null), subjectId, reason));
        });
    }

    private static TokenPair tokenPair(IssuedToken access, IssuedRefreshToken refresh) {
        return new TokenPair(
                access.token(),
                access.expiresAt(),
                refresh.rawToken(),
                refresh.record().expiresAt());
    }

    private void publishFailure(StrategyKind strategy, AuthError reason, String clientIp, int failureCount) {
        events.publish(new SecurityEvent.AuthenticationFailure(
                clock.instant(),
                SecureHash.clientIdentifier(clientIp),
                reason.code(),
                strategy.configName(),
                failureCount));
    }

    private static String lockoutIdentifier(StrategyKind strategy, Credential credential) {
        if (strategy == StrategyKind.LOCAL_PASSWORD && credential instanceof Credential.Password password) {
            return password.identifier();
        }
        return null;
    }
}
