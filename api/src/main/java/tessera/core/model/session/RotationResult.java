package tessera.core.model.session;

/**
 * Outcome of presenting a refresh token for rotation.
 */
public sealed interface RotationResult {

    /**
     * The presented token was active and has been replaced.
     *
     * @param previous  the presented record, now {@link RefreshStatus#ROTATED}
     * @param successor the newly issued active token
     */
    record Rotated(RefreshRecord previous, IssuedRefreshToken successor) implements RotationResult {}

    /**
     * No usable record exists: never issued, swept, or expired.
     */
    record Unknown() implements RotationResult {}

    /**
     * The presented token had already been rotated or revoked. The whole
     * family has been revoked.
     *
     * @param familyId  the revoked family
     * @param subjectId the affected subject
     */
    record ReuseDetected(String familyId, String subjectId) implements RotationResult {}
}
