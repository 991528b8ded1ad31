package tessera.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tessera.core.model.auth.PasswordRecord;
import tessera.core.port.out.PasswordRecordRepository;

/**
 * In-memory password record store.
 *
 * <p>Data is NOT persisted across restarts. Deployments that own a user
 * database replace this bean with an {@code @Alternative} implementation.
 */
@ApplicationScoped
@DefaultBean
public class InMemoryPasswordRecordRepository implements PasswordRecordRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryPasswordRecordRepository.class);

    private final ConcurrentHashMap<String, PasswordRecord> records = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<PasswordRecord>> findBySubjectId(String subjectId) {
        if (subjectId == null) {
            return Uni.createFrom().item(Optional.empty());
        }
        return Uni.createFrom().item(() -> Optional.ofNullable(records.get(subjectId)));
    }

    @Override
    public Uni<Void> save(PasswordRecord record) {
        return Uni.createFrom().item(() -> {
            records.put(record.subjectId(), record);
            LOG.debugf("Stored password record for %s (cost %d)", record.subjectId(), record.costFactor());
            return null;
        });
    }

    @Override
    public Uni<Boolean> replace(PasswordRecord expected, PasswordRecord replacement) {
        if (!expected.subjectId().equals(replacement.subjectId())) {
            return Uni.createFrom().failure(new IllegalArgumentException("Replacement must keep the subject"));
        }
        return Uni.createFrom().item(() -> records.replace(expected.subjectId(), expected, replacement));
    }

    int size() {
        return records.size();
    }
}
