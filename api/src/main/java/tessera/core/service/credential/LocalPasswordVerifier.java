package tessera.core.service.credential;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tessera.core.model.auth.Credential;
import tessera.core.model.auth.CredentialResult;
import tessera.core.model.auth.Identity;
import tessera.core.model.auth.PasswordRecord;
import tessera.core.model.auth.StrategyKind;
import tessera.core.port.out.PasswordRecordRepository;
import tessera.core.service.password.PasswordHasher;
import tessera.core.service.token.TokenIssuer;

/**
 * Verifies an identifier and password against the stored bcrypt hash.
 *
 * <p>A hash produced with an outdated cost or version is recomputed after a
 * successful verify and written back, unless the stored record changed in the
 * meantime. A failed write is logged and the login still succeeds; the
 * migration is retried on the next login.
 *
 * <p>Unknown identifiers are checked against a fixed dummy hash so that the
 * response time does not reveal whether an account exists.
 */
@ApplicationScoped
public class LocalPasswordVerifier implements CredentialVerifier {

    private static final Logger LOG = Logger.getLogger(LocalPasswordVerifier.class);

    private final PasswordRecordRepository passwordRecords;
    private final PasswordHasher hasher;

    private volatile Uni<String> dummyHash;

    public LocalPasswordVerifier(PasswordRecordRepository passwordRecords, PasswordHasher hasher) {
        this.passwordRecords = passwordRecords;
        this.hasher = hasher;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.LOCAL_PASSWORD;
    }

    @Override
    public Uni<CredentialResult> verify(Credential credential) {
        if (!(credential instanceof Credential.Password password)) {
            return rejected("credential is not a password");
        }
        if (password.identifier() == null || password.identifier().isBlank()
                || password.secret() == null || password.secret().isEmpty()) {
            return rejected("identifier or secret missing");
        }

        return passwordRecords.findBySubjectId(password.identifier()).flatMap(found -> {
            if (found.isEmpty()) {
                return equalizeTiming(password.secret()).replaceWith(rejectedResult("unknown subject"));
            }

            final var record = found.get();
            return hasher.verify(password.secret(), record.hash()).flatMap(matches -> {
                if (!matches) {
                    return rejected("password mismatch");
                }
                final CredentialResult verified = new CredentialResult.Verified(
                        new Identity(record.subjectId(), record.claims()).without(TokenIssuer.REGISTERED_CLAIMS));
                if (!hasher.needsRehash(record.hash())) {
                    return Uni.createFrom().item(verified);
                }
                return migrate(record, password.secret()).replaceWith(verified);
            });
        });
    }

    private Uni<Void> migrate(PasswordRecord record, String secret) {
        return hasher.hash(secret)
                .flatMap(newHash -> passwordRecords.replace(
                        record, record.withHash(newHash, hasher.costFactor(), hasher.algorithmVersion())))
                .invoke(replaced -> {
                    if (replaced) {
                        LOG.infof(
                                "Migrated password hash for %s from cost %d to %d",
                                record.subjectId(), record.costFactor(), hasher.costFactor());
                    } else {
                        LOG.infof("Skipped hash migration for %s: password record changed", record.subjectId());
                    }
                })
                .replaceWithVoid()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(
                            "Failed to persist migrated password hash for %s: %s",
                            record.subjectId(), error.getMessage());
                    return null;
                });
    }

    private Uni<Boolean> equalizeTiming(String secret) {
        return dummyHash()
                .flatMap(hash -> hasher.verify(secret, hash))
                .onFailure()
                .recoverWithItem(false);
    }

    private Uni<String> dummyHash() {
        var hash = dummyHash;
        if (hash == null) {
            hash = hasher.hash("tessera-timing-equalizer").memoize().indefinitely();
            dummyHash = hash;
        }
        return hash;
    }

    private static Uni<CredentialResult> rejected(String detail) {
        return Uni.createFrom().item(rejectedResult(detail));
    }

    private static CredentialResult rejectedResult(String detail) {
        LOG.debugv("Local password rejected: {0}", detail);
        return CredentialResult.Rejected.invalidCredentials(detail);
    }
}
