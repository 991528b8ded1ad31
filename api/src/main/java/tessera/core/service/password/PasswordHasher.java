package tessera.core.service.password;

import java.util.Locale;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

import at.favre.lib.crypto.bcrypt.BCrypt;
import at.favre.lib.crypto.bcrypt.LongPasswordStrategies;
import at.favre.lib.crypto.bcrypt.LongPasswordStrategy;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tessera.core.config.PasswordConfig;

/**
 * bcrypt password hashing on a dedicated bounded worker pool.
 *
 * <p>Hashing is CPU-bound and never runs on the caller's thread.
 * When the pool queue is full, operations fail with
 * {@link java.util.concurrent.RejectedExecutionException} instead of queueing
 * without bound.
 *
 * <p>The comparison performed by {@link #verify} is constant-time with respect
 * to the secret. Secrets longer than bcrypt's 72-byte input are pre-hashed with
 * SHA-512 so that every byte contributes to the result; shorter secrets are
 * hashed as-is and stay compatible with existing hashes.
 */
@ApplicationScoped
public class PasswordHasher {

    private static final Logger LOG = Logger.getLogger(PasswordHasher.class);

    static final int MIN_COST = 4;
    static final int MAX_COST = 31;

    private static final Pattern BCRYPT_HASH = Pattern.compile("^\\$(2[abxy])\\$(\\d{2})\\$[./A-Za-z0-9]{53}$");

    private final int costFactor;
    private final String algorithmVersion;
    private final BCrypt.Version version;
    private final LongPasswordStrategy longPasswordStrategy;
    private final ExecutorService executor;

    public PasswordHasher(PasswordConfig config) {
        this.costFactor = requireValidCost(config.costFactor());
        this.algorithmVersion = config.algorithmVersion().toLowerCase(Locale.ROOT);
        this.version = toVersion(algorithmVersion);
        this.longPasswordStrategy = LongPasswordStrategies.hashSha512(version);

        final var pool = config.workerPool();
        final var threadIndex = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                pool.threads(),
                pool.threads(),
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(pool.queueCapacity()),
                r -> {
                    var thread = new Thread(r, "password-hasher-" + threadIndex.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());

        LOG.infof(
                "Password hasher initialized: bcrypt $%s$ cost=%d threads=%d queue=%d",
                algorithmVersion, costFactor, pool.threads(), pool.queueCapacity());
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Hash a secret with the configured cost factor and version.
     *
     * @param secret plaintext secret
     * @return encoded hash
     */
    public Uni<String> hash(String secret) {
        return hash(secret, costFactor);
    }

    /**
     * Hash a secret with an explicit cost factor.
     *
     * @param secret     plaintext secret
     * @param costFactor cost exponent between 4 and 31
     * @return encoded hash
     * @throws EmptySecretException if the secret is null or empty
     */
    public Uni<String> hash(String secret, int costFactor) {
        if (secret == null || secret.isEmpty()) {
            return Uni.createFrom().failure(new EmptySecretException());
        }
        final int cost;
        try {
            cost = requireValidCost(costFactor);
        } catch (IllegalArgumentException e) {
            return Uni.createFrom().failure(e);
        }

        return Uni.createFrom()
                .item(() -> BCrypt.with(version, longPasswordStrategy).hashToString(cost, secret.toCharArray()))
                .runSubscriptionOn(executor);
    }

    /**
     * Check a secret against a stored hash.
     *
     * @param secret plaintext secret
     * @param hash   stored bcrypt hash
     * @return true if the secret matches
     * @throws EmptySecretException   if the secret is null or empty
     * @throws MalformedHashException if the stored hash cannot be parsed
     */
    public Uni<Boolean> verify(String secret, String hash) {
        if (secret == null || secret.isEmpty()) {
            return Uni.createFrom().failure(new EmptySecretException());
        }
        if (!isWellFormed(hash)) {
            return Uni.createFrom().failure(new MalformedHashException());
        }

        return Uni.createFrom()
                .item(() -> {
                    final var result = BCrypt.verifyer(version, longPasswordStrategy).verify(secret.toCharArray(), hash);
                    if (!result.validFormat) {
                        throw new MalformedHashException();
                    }
                    return result.verified;
                })
                .runSubscriptionOn(executor);
    }

    /**
     * Whether a stored hash was produced with a different cost or version
     * than the current configuration.
     *
     * @param hash stored bcrypt hash
     * @return true if the hash should be recomputed after the next successful verify
     * @throws MalformedHashException if the hash cannot be parsed
     */
    public boolean needsRehash(String hash) {
        return costOf(hash) != costFactor || !versionOf(hash).equals(algorithmVersion);
    }

    /**
     * Cost exponent embedded in a hash.
     *
     * @throws MalformedHashException if the hash cannot be parsed
     */
    public int costOf(String hash) {
        final var matcher = parse(hash);
        return Integer.parseInt(matcher.group(2));
    }

    /**
     * Version identifier embedded in a hash, e.g. {@code 2b}.
     *
     * @throws MalformedHashException if the hash cannot be parsed
     */
    public String versionOf(String hash) {
        return parse(hash).group(1);
    }

    public int costFactor() {
        return costFactor;
    }

    public String algorithmVersion() {
        return algorithmVersion;
    }

    private Matcher parse(String hash) {
        final var matcher = hash == null ? null : BCRYPT_HASH.matcher(hash);
        if (matcher == null || !matcher.matches()) {
            throw new MalformedHashException();
        }
        return matcher;
    }

    private static boolean isWellFormed(String hash) {
        return hash != null && BCRYPT_HASH.matcher(hash).matches();
    }

    private static int requireValidCost(int cost) {
        if (cost < MIN_COST || cost > MAX_COST) {
            throw new IllegalArgumentException(
                    "bcrypt cost factor must be between " + MIN_COST + " and " + MAX_COST + ", was " + cost);
        }
        return cost;
    }

    private static BCrypt.Version toVersion(String version) {
        return switch (version) {
            case "2a" -> BCrypt.Version.VERSION_2A;
            case "2b" -> BCrypt.Version.VERSION_2B;
            case "2y" -> BCrypt.Version.VERSION_2Y;
            default -> throw new IllegalArgumentException("Unsupported bcrypt version: " + version);
        };
    }

    /**
     * Thrown when hashing or verifying an empty secret.
     */
    public static class EmptySecretException extends IllegalArgumentException {

        public EmptySecretException() {
            super("Secret must not be empty");
        }
    }

    /**
     * Thrown when a stored hash is not a parseable bcrypt string.
     *
     * <p>Indicates corrupt data in the user store. Fatal to the call and never retried.
     */
    public static class MalformedHashException extends RuntimeException {

        public MalformedHashException() {
            super("Stored password hash is not a valid bcrypt hash");
        }
    }
}
