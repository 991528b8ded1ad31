package tessera.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import tessera.core.model.auth.PasswordRecord;

/**
 * Narrow contract onto the external user store's password hashes.
 *
 * <p>The default bean keeps records in memory. Deployments replace it with an
 * {@code @Alternative} backed by their user database.
 */
public interface PasswordRecordRepository {

    /**
     * Find the password record for a subject.
     *
     * @param subjectId subject identifier (the login identifier)
     * @return the record, or empty if the subject has no password
     */
    Uni<Optional<PasswordRecord>> findBySubjectId(String subjectId);

    /**
     * Create or replace the password record for a subject.
     *
     * <p>Must be idempotent: saving the same record twice has the same effect
     * as saving it once.
     *
     * @param record record to store
     * @return completion signal
     */
    Uni<Void> save(PasswordRecord record);

    /**
     * Replace a record only if the stored one still equals {@code expected}.
     *
     * <p>Used to write back a migrated hash without overwriting a password
     * that was changed after {@code expected} was read.
     *
     * @param expected    record as it was read
     * @param replacement record to store in its place
     * @return true if the replacement was stored, false if the stored record had changed or is gone
     */
    Uni<Boolean> replace(PasswordRecord expected, PasswordRecord replacement);
}
