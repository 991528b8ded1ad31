package tessera.adapter.out.storage.redis;

import java.time.Duration;
import java.util.function.Supplier;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tessera.spi.StorageUnavailableException;

/**
 * Applies a timeout and failure mapping to Redis operations.
 *
 * <ul>
 *   <li>{@link #withTimeout} - fail fast with {@link StorageUnavailableException}.
 *       Used for refresh-token state, where guessing is never safe.</li>
 *   <li>{@link #withTimeoutFallback} - fail open with a fallback value.
 *       Used for lockout counters, where an outage should not block logins.</li>
 * </ul>
 *
 * <p>Timeouts and other failures are counted separately as
 * {@code tessera.redis.timeouts} and {@code tessera.redis.failures}.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final MeterRegistry registry;
    private final String repositoryName;

    /**
     * @param timeout        timeout for each operation
     * @param registry       meter registry (may be null)
     * @param repositoryName repository name used as a metric tag
     */
    public RedisTimeoutHelper(Duration timeout, MeterRegistry registry, String repositoryName) {
        this.timeout = timeout;
        this.registry = registry;
        this.repositoryName = repositoryName;
    }

    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
                    count("tessera.redis.timeouts", operationName);
                    return new StorageUnavailableException(
                            operationName, "Redis operation timed out: " + operationName);
                })
                .onFailure(error -> !(error instanceof StorageUnavailableException))
                .transform(error -> {
                    LOG.warnv(
                            "Redis operation failure: {0} in {1}: {2}",
                            operationName, repositoryName, error.getMessage());
                    count("tessera.redis.failures", operationName);
                    return new StorageUnavailableException(
                            operationName, "Redis operation failed: " + operationName, error);
                });
    }

    public <T> Uni<T> withTimeoutFallback(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (fallback): {0} in {1} after {2}",
                            operationName, repositoryName, timeout);
                    count("tessera.redis.timeouts", operationName);
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Redis operation failure (fallback): {0} in {1}: {2}",
                            operationName, repositoryName, error.getMessage());
                    count("tessera.redis.failures", operationName);
                    return fallback.get();
                });
    }

    private void count(String metric, String operationName) {
        if (registry != null) {
            Counter.builder(metric)
                    .tag("repository", repositoryName)
                    .tag("operation", operationName)
                    .register(registry)
                    .increment();
        }
    }
}
