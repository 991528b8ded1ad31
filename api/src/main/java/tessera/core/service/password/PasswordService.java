package tessera.core.service.password;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tessera.core.model.auth.PasswordRecord;
import tessera.core.port.in.PasswordManagement;
import tessera.core.port.out.PasswordRecordRepository;
import tessera.core.service.session.SessionService;

/**
 * Sets and changes local passwords.
 *
 * <p>A successful change revokes every refresh-token family of the subject.
 * Claims already stored with the subject's record are kept.
 */
@ApplicationScoped
public class PasswordService implements PasswordManagement {

    private static final Logger LOG = Logger.getLogger(PasswordService.class);

    private final PasswordRecordRepository passwordRecords;
    private final PasswordHasher hasher;
    private final SessionService sessions;

    public PasswordService(PasswordRecordRepository passwordRecords, PasswordHasher hasher, SessionService sessions) {
        this.passwordRecords = passwordRecords;
        this.hasher = hasher;
        this.sessions = sessions;
    }

    @Override
    public Uni<Void> setPassword(String subjectId, String secret) {
        if (subjectId == null || subjectId.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Subject id cannot be null or blank"));
        }
        return hasher.hash(secret)
                .flatMap(hash -> passwordRecords.findBySubjectId(subjectId).map(existing -> existing
                        .map(record -> record.withHash(hash, hasher.costFactor(), hasher.algorithmVersion()))
                        .orElseGet(() -> new PasswordRecord(
                                subjectId, hash, hasher.costFactor(), hasher.algorithmVersion()))))
                .flatMap(passwordRecords::save)
                .invoke(() -> LOG.infof("Password set for %s", subjectId));
    }

    @Override
    public Uni<Boolean> changePassword(String subjectId, String currentSecret, String newSecret) {
        if (subjectId == null || subjectId.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Subject id cannot be null or blank"));
        }
        if (currentSecret == null || currentSecret.isEmpty()) {
            return Uni.createFrom().item(false);
        }

        return passwordRecords.findBySubjectId(subjectId).flatMap(found -> {
            if (found.isEmpty()) {
                LOG.debugf("Password change rejected: no password for %s", subjectId);
                return Uni.createFrom().item(false);
            }
            return hasher.verify(currentSecret, found.get().hash()).flatMap(matches -> {
                if (!matches) {
                    LOG.debugf("Password change rejected: current password mismatch for %s", subjectId);
                    return Uni.createFrom().item(false);
                }
                return setPassword(subjectId, newSecret)
                        .flatMap(v -> sessions.revokeAll(subjectId, "password_change"))
                        .replaceWith(true);
            });
        });
    }
}
