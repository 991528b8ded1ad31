package tessera.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tessera.core.model.session.RefreshRecord;
import tessera.core.model.session.RefreshStatus;
import tessera.core.port.out.RefreshTokenRepository;

/**
 * In-memory refresh-token store.
 *
 * <p>All mutations take a single lock, which makes compare-and-set and family
 * revocation trivially atomic. Records are lost on restart and not shared
 * across instances.
 */
public class InMemoryRefreshTokenRepository implements RefreshTokenRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryRefreshTokenRepository.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, RefreshRecord> records = new HashMap<>();
    private final Map<String, Set<String>> families = new HashMap<>();
    private final Map<String, Set<String>> subjects = new HashMap<>();

    @Override
    public Uni<Boolean> insert(RefreshRecord record) {
        return Uni.createFrom().item(() -> locked(() -> {
            if (records.containsKey(record.tokenId())) {
                return false;
            }
            put(record);
            return true;
        }));
    }

    @Override
    public Uni<Optional<RefreshRecord>> findById(String tokenId) {
        return Uni.createFrom().item(() -> locked(() -> Optional.ofNullable(records.get(tokenId))));
    }

    @Override
    public Uni<Boolean> compareAndSetStatus(
            String tokenId, RefreshStatus expected, RefreshStatus next, Optional<RefreshRecord> successor) {
        return Uni.createFrom().item(() -> locked(() -> {
            final var current = records.get(tokenId);
            if (current == null || current.status() != expected) {
                return false;
            }
            if (successor.isPresent()) {
                final var replacement = successor.get();
                if (records.containsKey(replacement.tokenId())) {
                    return false;
                }
                put(new RefreshRecord(
                        current.tokenId(),
                        current.familyId(),
                        current.subjectId(),
                        current.claims(),
                        current.issuedAt(),
                        current.expiresAt(),
                        next,
                        replacement.tokenId()));
                put(replacement);
            } else {
                put(current.withStatus(next));
            }
            return true;
        }));
    }

    @Override
    public Uni<List<RefreshRecord>> findFamily(String familyId) {
        return Uni.createFrom().item(() -> locked(() -> {
            final List<RefreshRecord> found = new ArrayList<>();
            for (String tokenId : families.getOrDefault(familyId, Set.of())) {
                final var record = records.get(tokenId);
                if (record != null) {
                    found.add(record);
                }
            }
            return found;
        }));
    }

    @Override
    public Uni<Set<String>> findFamilyIdsBySubject(String subjectId) {
        return Uni.createFrom()
                .item(() -> locked(() -> Set.copyOf(subjects.getOrDefault(subjectId, Set.of()))));
    }

    @Override
    public Uni<Integer> revokeFamily(String familyId) {
        return Uni.createFrom().item(() -> locked(() -> {
            int revoked = 0;
            for (String tokenId : families.getOrDefault(familyId, Set.of())) {
                final var record = records.get(tokenId);
                if (record != null && record.status() != RefreshStatus.REVOKED) {
                    records.put(tokenId, record.withStatus(RefreshStatus.REVOKED));
                    revoked++;
                }
            }
            return revoked;
        }));
    }

    @Override
    public Uni<Integer> deleteExpiredBefore(Instant cutoff) {
        return Uni.createFrom().item(() -> locked(() -> {
            final var expired = records.values().stream()
                    .filter(record -> record.expiresAt().isBefore(cutoff))
                    .toList();
            for (RefreshRecord record : expired) {
                remove(record);
            }
            if (!expired.isEmpty()) {
                LOG.debugf("Deleted %d expired refresh tokens", expired.size());
            }
            return expired.size();
        }));
    }

    /**
     * Number of stored records (for health checks and tests).
     */
    public int size() {
        return locked(records::size);
    }

    /**
     * Clear all records (for testing).
     */
    public void clear() {
        locked(() -> {
            records.clear();
            families.clear();
            subjects.clear();
            return null;
        });
    }

    private void put(RefreshRecord record) {
        records.put(record.tokenId(), record);
        families.computeIfAbsent(record.familyId(), k -> new LinkedHashSet<>()).add(record.tokenId());
        if (record.subjectId() != null) {
            subjects.computeIfAbsent(record.subjectId(), k -> new LinkedHashSet<>()).add(record.familyId());
        }
    }

    private void remove(RefreshRecord record) {
        records.remove(record.tokenId());
        final var family = families.get(record.familyId());
        if (family != null) {
            family.remove(record.tokenId());
            if (family.isEmpty()) {
                families.remove(record.familyId());
                final var subjectFamilies = subjects.get(record.subjectId());
                if (subjectFamilies != null) {
                    subjectFamilies.remove(record.familyId());
                    if (subjectFamilies.isEmpty()) {
                        subjects.remove(record.subjectId());
                    }
                }
            }
        }
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
