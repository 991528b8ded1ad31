package tessera.core.model.session;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Server-side record of a single-use refresh token.
 *
 * <p>The raw token is never stored; {@code tokenId} is its SHA-256 digest.
 * A family is the lineage of records descending from one login. At most one
 * record per family is {@link RefreshStatus#ACTIVE} at any time.
 *
 * @param tokenId           hex SHA-256 of the raw token
 * @param familyId          lineage identifier shared by all rotations of one login
 * @param subjectId         subject the token was issued to
 * @param claims            identity claims captured at login
 * @param issuedAt          creation time
 * @param expiresAt         expiry time
 * @param status            lifecycle state
 * @param replacedByTokenId successor token id once rotated (null otherwise)
 */
public record RefreshRecord(
        String tokenId,
        String familyId,
        String subjectId,
        Map<String, Object> claims,
        Instant issuedAt,
        Instant expiresAt,
        RefreshStatus status,
        String replacedByTokenId) {

    public RefreshRecord {
        if (tokenId == null || tokenId.isBlank()) {
            throw new IllegalArgumentException("Token id cannot be null or blank");
        }
        if (familyId == null || familyId.isBlank()) {
            throw new IllegalArgumentException("Family id cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        claims = claims == null || claims.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }

    /**
     * Creates a new active record.
     */
    public static RefreshRecord active(
            String tokenId,
            String familyId,
            String subjectId,
            Map<String, Object> claims,
            Instant issuedAt,
            Instant expiresAt) {
        return new RefreshRecord(
                tokenId, familyId, subjectId, claims, issuedAt, expiresAt, RefreshStatus.ACTIVE, null);
    }

    /**
     * Creates a copy with a different status.
     */
    public RefreshRecord withStatus(RefreshStatus status) {
        return new RefreshRecord(
                tokenId, familyId, subjectId, claims, issuedAt, expiresAt, status, replacedByTokenId);
    }

    /**
     * Creates a copy marked rotated and linked to its successor.
     */
    public RefreshRecord rotatedTo(String successorTokenId) {
        return new RefreshRecord(
                tokenId, familyId, subjectId, claims, issuedAt, expiresAt, RefreshStatus.ROTATED, successorTokenId);
    }

    /**
     * Checks whether the record has expired at the given instant.
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
