package tessera.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import tessera.core.config.SessionConfig;
import tessera.core.port.out.RefreshTokenRepository;
import tessera.spi.FailedAttemptRepository;
import tessera.spi.SessionStorageProvider;

/**
 * Redis session storage provider. Preferred whenever Redis answers at startup.
 */
@ApplicationScoped
public class RedisSessionStorageProvider implements SessionStorageProvider {

    private static final Logger LOG = Logger.getLogger(RedisSessionStorageProvider.class);
    private static final int PRIORITY = 100;
    private static final Duration AVAILABILITY_TIMEOUT = Duration.ofSeconds(5);

    private final ReactiveRedisDataSource redisDataSource;
    private final SessionConfig config;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicBoolean available = new AtomicBoolean(false);
    private final CountDownLatch checkLatch = new CountDownLatch(1);

    private RedisRefreshTokenRepository refreshTokens;
    private RedisFailedAttemptRepository failedAttempts;

    @Inject
    public RedisSessionStorageProvider(
            ReactiveRedisDataSource redisDataSource,
            SessionConfig config,
            ObjectMapper objectMapper,
            Instance<MeterRegistry> meterRegistry,
            Clock clock) {
        this.redisDataSource = redisDataSource;
        this.config = config;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry.isResolvable() ? meterRegistry.get() : null;
        this.clock = clock;
    }

    @PostConstruct
    void checkAvailability() {
        redisDataSource
                .execute("PING")
                .ifNoItem()
                .after(AVAILABILITY_TIMEOUT)
                .fail()
                .subscribe()
                .with(
                        result -> {
                            available.set(true);
                            checkLatch.countDown();
                            LOG.info("Redis session storage is available");
                        },
                        error -> {
                            available.set(false);
                            checkLatch.countDown();
                            LOG.warnf("Redis session storage is not available: %s", error.getMessage());
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        try {
            if (!checkLatch.await(AVAILABILITY_TIMEOUT.toSeconds() + 1, TimeUnit.SECONDS)) {
                LOG.warn("Redis availability check timed out");
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return available.get();
    }

    @Override
    public synchronized RefreshTokenRepository createRefreshTokenRepository() {
        if (refreshTokens == null) {
            final var redis = config.storage().redis();
            refreshTokens = new RedisRefreshTokenRepository(
                    redisDataSource,
                    new RedisTimeoutHelper(redis.timeout(), meterRegistry, "refresh-tokens"),
                    objectMapper,
                    clock,
                    redis.keyPrefix(),
                    config.sweep().retention());
            LOG.infof("Created Redis refresh token repository with prefix: %s", redis.keyPrefix());
        }
        return refreshTokens;
    }

    @Override
    public synchronized FailedAttemptRepository createFailedAttemptRepository() {
        if (failedAttempts == null) {
            failedAttempts = new RedisFailedAttemptRepository(
                    redisDataSource,
                    new RedisTimeoutHelper(config.storage().redis().timeout(), meterRegistry, "failed-attempts"),
                    clock);
        }
        return failedAttempts;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var builder = HealthCheckResponse.named("refresh-token-storage")
                .withData("provider", name())
                .withData("keyPrefix", config.storage().redis().keyPrefix());
        if (available.get()) {
            return Optional.of(builder.up().build());
        }
        return Optional.of(builder.down()
                .withData("error", "Redis not available or check not completed")
                .build());
    }
}
