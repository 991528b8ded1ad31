package tessera.core.port.in;

import io.smallrye.mutiny.Uni;

/**
 * Inbound port for setting and changing local passwords.
 */
public interface PasswordManagement {

    /**
     * Hash and store a password for a subject, replacing any existing one.
     *
     * @param subjectId subject identifier
     * @param secret    new plaintext secret
     * @return completion signal
     */
    Uni<Void> setPassword(String subjectId, String secret);

    /**
     * Replace a password after checking the current one, then revoke every
     * session of the subject.
     *
     * @param subjectId     subject identifier
     * @param currentSecret current plaintext secret
     * @param newSecret     new plaintext secret
     * @return true if changed, false if the current secret did not match
     */
    Uni<Boolean> changePassword(String subjectId, String currentSecret, String newSecret);
}
