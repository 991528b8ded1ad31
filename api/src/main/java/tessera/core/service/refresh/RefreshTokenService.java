package tessera.core.service.refresh;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tessera.core.config.SessionConfig;
import tessera.core.model.auth.Identity;
import tessera.core.model.session.IssuedRefreshToken;
import tessera.core.model.session.RefreshRecord;
import tessera.core.model.session.RefreshStatus;
import tessera.core.model.session.RotationResult;
import tessera.core.port.out.RefreshTokenRepository;
import tessera.core.port.out.SecurityEventPublisher;
import tessera.core.util.SecureHash;
import tessera.spi.SecurityEvent;

/**
 * Refresh-token lifecycle: issue, rotate with reuse detection, revoke.
 *
 * <p>Rotation is a single compare-and-swap on the presented record's status
 * ({@code ACTIVE -> ROTATED}) that also inserts the successor. A failed swap is
 * never retried: it means another caller got there first, which is treated the
 * same as presenting a rotated token.
 *
 * <p>Presenting a {@code ROTATED} or {@code REVOKED} token revokes every record
 * in its family before the result is returned.
 */
@ApplicationScoped
public class RefreshTokenService {

    private static final Logger LOG = Logger.getLogger(RefreshTokenService.class);
    private static final int MAX_INSERT_ATTEMPTS = 3;

    private final RefreshTokenRepository repository;
    private final RefreshTokenGenerator generator;
    private final SessionConfig config;
    private final SecurityEventPublisher events;
    private final Clock clock;

    public RefreshTokenService(
            RefreshTokenRepository repository,
            RefreshTokenGenerator generator,
            SessionConfig config,
            SecurityEventPublisher events,
            Clock clock) {
        this.repository = repository;
        this.generator = generator;
        this.config = config;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Start a new family with a single active token.
     *
     * @param identity identity captured into the record
     * @return the raw token and its stored record
     */
    public Uni<IssuedRefreshToken> issue(Identity identity) {
        return insertWithRetry(identity, generator.newFamilyId(), 0);
    }

    private Uni<IssuedRefreshToken> insertWithRetry(Identity identity, String familyId, int attempt) {
        if (attempt >= MAX_INSERT_ATTEMPTS) {
            return Uni.createFrom()
                    .failure(new IllegalStateException(
                            "Failed to generate unique refresh token after " + MAX_INSERT_ATTEMPTS + " attempts"));
        }

        final var issued = newToken(familyId, identity.subjectId(), identity.claims(), clock.instant());
        return repository.insert(issued.record()).flatMap(inserted -> {
            if (inserted) {
                LOG.debugf("Refresh token family %s started for %s", familyId, identity.subjectId());
                return Uni.createFrom().item(issued);
            }
            LOG.warnf("Refresh token id collision (attempt %d/%d), retrying", attempt + 1, MAX_INSERT_ATTEMPTS);
            return insertWithRetry(identity, familyId, attempt + 1);
        });
    }

    /**
     * Exchange a refresh token for its successor.
     *
     * @param rawToken token presented by the caller
     * @param clientIp caller address for security events (may be null)
     * @return {@link RotationResult.Rotated}, {@link RotationResult.Unknown} or
     *         {@link RotationResult.ReuseDetected}
     */
    public Uni<RotationResult> rotate(String rawToken, String clientIp) {
        if (rawToken == null || rawToken.isBlank()) {
            return Uni.createFrom().item(new RotationResult.Unknown());
        }
        final var tokenId = generator.tokenId(rawToken);

        return repository.findById(tokenId).flatMap(found -> {
            if (found.isEmpty()) {
                LOG.debug("Refresh rejected: unknown token");
                return Uni.createFrom().item(new RotationResult.Unknown());
            }

            final var record = found.get();
            if (record.status().isTerminal()) {
                return reuseDetected(record, clientIp);
            }

            final var now = clock.instant();
            if (record.isExpiredAt(now)) {
                LOG.debugf("Refresh rejected: token in family %s expired at %s", record.familyId(), record.expiresAt());
                return Uni.createFrom().item(new RotationResult.Unknown());
            }

            final var successor = newToken(record.familyId(), record.subjectId(), record.claims(), now);
            return repository
                    .compareAndSetStatus(
                            tokenId, RefreshStatus.ACTIVE, RefreshStatus.ROTATED, Optional.of(successor.record()))
                    .flatMap(swapped -> {
                        if (swapped) {
                            LOG.debugf("Rotated refresh token in family %s", record.familyId());
                            return Uni.createFrom()
                                    .item(new RotationResult.Rotated(
                                            record.rotatedTo(successor.record().tokenId()), successor));
                        }
                        return afterLostSwap(tokenId, clientIp);
                    });
        });
    }

    public Uni<RotationResult> rotate(String rawToken) {
        return rotate(rawToken, null);
    }

    private Uni<RotationResult> afterLostSwap(String tokenId, String clientIp) {
        return repository.findById(tokenId).flatMap(current -> {
            if (current.isEmpty()) {
                return Uni.createFrom().item(new RotationResult.Unknown());
            }
            if (current.get().status().isTerminal()) {
                LOG.debugf("Concurrent rotation lost in family %s", current.get().familyId());
                return reuseDetected(current.get(), clientIp);
            }
            // Swap failed but the record still reads active: storage is not linearizable
            LOG.errorf("Compare-and-set failed on an active refresh token in family %s", current.get().familyId());
            return Uni.createFrom().item(new RotationResult.Unknown());
        });
    }

    private Uni<RotationResult> reuseDetected(RefreshRecord record, String clientIp) {
        return repository.revokeFamily(record.familyId()).map(revoked -> {
            LOG.warnf(
                    "Refresh token reuse detected for %s: family %s revoked (%d records)",
                    record.subjectId(), record.familyId(), revoked);
            events.publish(new SecurityEvent.RefreshTokenReuse(
                    clock.instant(),
                    SecureHash.clientIdentifier(clientIp),
                    record.subjectId(),
                    record.familyId(),
                    revoked));
            return new RotationResult.ReuseDetected(record.familyId(), record.subjectId());
        });
    }

    /**
     * Revoke a single active token. Unknown or already terminal tokens are left alone.
     *
     * @param rawToken token presented by the caller
     * @return the record as it was before revocation, or empty if nothing was revoked
     */
    public Uni<Optional<RefreshRecord>> revoke(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var tokenId = generator.tokenId(rawToken);

        return repository.findById(tokenId).flatMap(found -> {
            if (found.isEmpty() || found.get().status() != RefreshStatus.ACTIVE) {
                return Uni.createFrom().item(Optional.<RefreshRecord>empty());
            }
            return repository
                    .compareAndSetStatus(tokenId, RefreshStatus.ACTIVE, RefreshStatus.REVOKED, Optional.empty())
                    .map(swapped -> swapped ? found : Optional.<RefreshRecord>empty());
        });
    }

    /**
     * Revoke every record in a family.
     *
     * @return number of records revoked
     */
    public Uni<Integer> revokeFamily(String familyId) {
        return repository.revokeFamily(familyId);
    }

    /**
     * Revoke every family started by a subject.
     *
     * @return number of records revoked
     */
    public Uni<Integer> revokeAllForSubject(String subjectId) {
        return repository.findFamilyIdsBySubject(subjectId).flatMap(familyIds -> {
            if (familyIds.isEmpty()) {
                return Uni.createFrom().item(0);
            }
            final List<Uni<Integer>> revocations = new ArrayList<>();
            for (String familyId : familyIds) {
                revocations.add(repository.revokeFamily(familyId));
            }
            return Uni.join()
                    .all(revocations)
                    .andFailFast()
                    .map(counts -> counts.stream().mapToInt(Integer::intValue).sum());
        });
    }

    /**
     * Delete records that expired longer ago than the configured retention.
     *
     * @return number of records deleted
     */
    public Uni<Integer> sweepExpired() {
        final Instant cutoff = clock.instant().minus(config.sweep().retention());
        return repository.deleteExpiredBefore(cutoff);
    }

    private IssuedRefreshToken newToken(
            String familyId, String subjectId, Map<String, Object> claims, Instant now) {
        final var rawToken = generator.generate();
        final var record = RefreshRecord.active(
                generator.tokenId(rawToken),
                familyId,
                subjectId,
                claims,
                now,
                now.plus(config.refreshTokenTtl()));
        return new IssuedRefreshToken(rawToken, record);
    }
}
