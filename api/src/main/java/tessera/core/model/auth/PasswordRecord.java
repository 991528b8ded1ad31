package tessera.core.model.auth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored password hash for a subject.
 *
 * <p>Owned by the user store. The session core only reads it and writes back a
 * replacement hash.
 *
 * @param subjectId        subject the password belongs to
 * @param hash             encoded bcrypt hash including salt and cost
 * @param costFactor       cost exponent the hash was produced with
 * @param algorithmVersion bcrypt version identifier (e.g. "2b")
 * @param claims           claims the user store attaches to the subject, such as role or email
 */
public record PasswordRecord(
        String subjectId, String hash, int costFactor, String algorithmVersion, Map<String, Object> claims) {

    public PasswordRecord {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("Hash cannot be null or blank");
        }
        claims = claims == null || claims.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }

    public PasswordRecord(String subjectId, String hash, int costFactor, String algorithmVersion) {
        this(subjectId, hash, costFactor, algorithmVersion, Map.of());
    }

    /**
     * Creates a copy carrying a re-computed hash. Claims are kept.
     */
    public PasswordRecord withHash(String hash, int costFactor, String algorithmVersion) {
        return new PasswordRecord(subjectId, hash, costFactor, algorithmVersion, claims);
    }

    @Override
    public String toString() {
        return "PasswordRecord[subjectId=" + subjectId + ", costFactor=" + costFactor + ", algorithmVersion="
                + algorithmVersion + "]";
    }
}
