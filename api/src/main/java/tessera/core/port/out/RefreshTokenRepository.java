package tessera.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import tessera.core.model.session.RefreshRecord;
import tessera.core.model.session.RefreshStatus;

/**
 * Outbound port for refresh-token record persistence.
 *
 * <p>The repository stores records keyed by token id (the digest of the raw
 * token) and indexes them by family and by subject. It performs no expiry
 * checks on reads; that is the service layer's job.
 *
 * <p>Storage failures surface as {@link tessera.spi.StorageUnavailableException}.
 */
public interface RefreshTokenRepository {

    /**
     * Insert a new record if no record with the same token id exists.
     *
     * @param record record to insert
     * @return true if inserted, false on token id collision
     */
    Uni<Boolean> insert(RefreshRecord record);

    /**
     * Find a record by token id.
     *
     * @param tokenId token digest
     * @return the record, or empty if absent
     */
    Uni<Optional<RefreshRecord>> findById(String tokenId);

    /**
     * Atomically transition a record's status if it currently equals {@code expected}.
     *
     * <p>When {@code successor} is present, the same atomic step links the
     * record to the successor ({@code replacedByTokenId}) and inserts the
     * successor into the family. Either everything happens or nothing does.
     *
     * <p>Implementations must be linearizable per token id: of two concurrent
     * calls with the same expected status, at most one returns true.
     *
     * @param tokenId   record to transition
     * @param expected  status the record must currently have
     * @param next      status to set
     * @param successor new active record to insert alongside, if any
     * @return true if the transition was applied
     */
    Uni<Boolean> compareAndSetStatus(
            String tokenId, RefreshStatus expected, RefreshStatus next, Optional<RefreshRecord> successor);

    /**
     * List every record in a family, in no particular order.
     *
     * @param familyId family identifier
     * @return records, empty if the family is unknown
     */
    Uni<List<RefreshRecord>> findFamily(String familyId);

    /**
     * Family ids started by a subject.
     *
     * @param subjectId subject identifier
     * @return family ids, possibly including fully revoked families
     */
    Uni<Set<String>> findFamilyIdsBySubject(String subjectId);

    /**
     * Atomically mark every non-revoked record in a family as revoked.
     *
     * @param familyId family identifier
     * @return number of records that changed status
     */
    Uni<Integer> revokeFamily(String familyId);

    /**
     * Delete records that expired before the given instant, whatever their status.
     *
     * @param cutoff expiry cutoff
     * @return number of records deleted
     */
    Uni<Integer> deleteExpiredBefore(Instant cutoff);
}
