package tessera.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import tessera.core.model.session.RefreshRecord;
import tessera.core.model.session.RefreshStatus;
import tessera.core.port.out.RefreshTokenRepository;

/**
 * Redis refresh-token store.
 *
 * <p>Key format (prefix from {@code tessera.session.storage.redis.key-prefix}):
 * <ul>
 *   <li>{@code {prefix}token:{tokenId}} - hash with the record fields</li>
 *   <li>{@code {prefix}family:{familyId}} - set of token ids</li>
 *   <li>{@code {prefix}subject:{subjectId}} - set of family ids</li>
 * </ul>
 *
 * <p>Insert, compare-and-set and family revocation run as Lua scripts so each
 * is a single atomic step on the server. Keys expire on their own once the
 * record is past expiry plus the retention period, so
 * {@link #deleteExpiredBefore} has nothing left to do.
 *
 * <p>The scripts touch several keys; on Redis Cluster all keys of one prefix
 * must hash to the same slot (use a hash tag in the prefix, e.g.
 * {@code {tessera}:refresh:}).
 */
public class RedisRefreshTokenRepository implements RefreshTokenRepository {

    private static final Logger LOG = Logger.getLogger(RedisRefreshTokenRepository.class);

    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {};

    private static final String FIELD_TOKEN_ID = "tokenId";
    private static final String FIELD_FAMILY_ID = "familyId";
    private static final String FIELD_SUBJECT_ID = "subjectId";
    private static final String FIELD_CLAIMS = "claims";
    private static final String FIELD_ISSUED_AT = "issuedAt";
    private static final String FIELD_EXPIRES_AT = "expiresAt";
    private static final String FIELD_STATUS = "status";
    private static final String FIELD_REPLACED_BY = "replacedBy";

    /**
     * Shared Lua helpers.
     *
     * <p>{@code write_record} expects the record fields in ARGV starting at
     * {@code base}: tokenId, familyId, subjectId, claims, issuedAt, expiresAt,
     * status, ttlMs.
     */
    private static final String LUA_HELPERS =
            """
            local function extend(key, ttl)
                local current = redis.call('PTTL', key)
                if current < tonumber(ttl) then
                    redis.call('PEXPIRE', key, ttl)
                end
            end

            local function write_record(token_key, family_key, subject_key, base)
                local ttl = ARGV[base + 7]
                redis.call('HSET', token_key,
                    'tokenId', ARGV[base], 'familyId', ARGV[base + 1], 'subjectId', ARGV[base + 2],
                    'claims', ARGV[base + 3], 'issuedAt', ARGV[base + 4], 'expiresAt', ARGV[base + 5],
                    'status', ARGV[base + 6])
                redis.call('PEXPIRE', token_key, ttl)
                redis.call('SADD', family_key, ARGV[base])
                extend(family_key, ttl)
                redis.call('SADD', subject_key, ARGV[base + 1])
                extend(subject_key, ttl)
            end
            """;

    /**
     * KEYS: token, family, subject. ARGV: record fields. Returns 1 if inserted.
     */
    private static final String INSERT_SCRIPT = LUA_HELPERS
            + """
            if redis.call('EXISTS', KEYS[1]) == 1 then
                return 0
            end
            write_record(KEYS[1], KEYS[2], KEYS[3], 1)
            return 1
            """;

    /**
     * KEYS: token[, successor token, family, subject].
     * ARGV: expected status, next status, has successor (1/0)[, successor fields].
     * Returns 1 if the transition was applied.
     */
    private static final String COMPARE_AND_SET_SCRIPT = LUA_HELPERS
            + """
            if redis.call('HGET', KEYS[1], 'status') ~= ARGV[1] then
                return 0
            end
            if ARGV[3] == '1' then
                if redis.call('EXISTS', KEYS[2]) == 1 then
                    return 0
                end
                write_record(KEYS[2], KEYS[3], KEYS[4], 4)
                redis.call('HSET', KEYS[1], 'replacedBy', ARGV[4])
            end
            redis.call('HSET', KEYS[1], 'status', ARGV[2])
            return 1
            """;

    /**
     * KEYS: family. ARGV: token key prefix. Returns the number of records revoked.
     */
    private static final String REVOKE_FAMILY_SCRIPT =
            """
            local revoked = 0
            for _, token_id in ipairs(redis.call('SMEMBERS', KEYS[1])) do
                local token_key = ARGV[1] .. token_id
                local status = redis.call('HGET', token_key, 'status')
                if status and status ~= 'REVOKED' then
                    redis.call('HSET', token_key, 'status', 'REVOKED')
                    revoked = revoked + 1
                end
            end
            return revoked
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveSetCommands<String, String> setCommands;
    private final RedisTimeoutHelper timeoutHelper;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String keyPrefix;
    private final Duration retention;

    public RedisRefreshTokenRepository(
            ReactiveRedisDataSource redisDataSource,
            RedisTimeoutHelper timeoutHelper,
            ObjectMapper objectMapper,
            Clock clock,
            String keyPrefix,
            Duration retention) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.setCommands = redisDataSource.set(String.class, String.class);
        this.timeoutHelper = timeoutHelper;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
        this.retention = retention;
    }

    @Override
    public Uni<Boolean> insert(RefreshRecord record) {
        final List<String> args = new ArrayList<>();
        args.add("EVAL");
        args.add(INSERT_SCRIPT);
        args.add("3");
        args.add(tokenKey(record.tokenId()));
        args.add(familyKey(record.familyId()));
        args.add(subjectKey(record.subjectId()));
        args.addAll(recordArgs(record));

        return timeoutHelper.withTimeout(eval(args).map(response -> response.toInteger() == 1), "insert");
    }

    @Override
    public Uni<Optional<RefreshRecord>> findById(String tokenId) {
        final var operation = hashCommands.hgetall(tokenKey(tokenId)).map(this::toRecord);
        return timeoutHelper.withTimeout(operation, "findById");
    }

    @Override
    public Uni<Boolean> compareAndSetStatus(
            String tokenId, RefreshStatus expected, RefreshStatus next, Optional<RefreshRecord> successor) {
        final List<String> args = new ArrayList<>();
        args.add("EVAL");
        args.add(COMPARE_AND_SET_SCRIPT);
        if (successor.isPresent()) {
            final var replacement = successor.get();
            args.add("4");
            args.add(tokenKey(tokenId));
            args.add(tokenKey(replacement.tokenId()));
            args.add(familyKey(replacement.familyId()));
            args.add(subjectKey(replacement.subjectId()));
            args.add(expected.name());
            args.add(next.name());
            args.add("1");
            args.addAll(recordArgs(replacement));
        } else {
            args.add("1");
            args.add(tokenKey(tokenId));
            args.add(expected.name());
            args.add(next.name());
            args.add("0");
        }

        return timeoutHelper.withTimeout(
                eval(args).map(response -> response.toInteger() == 1), "compareAndSetStatus");
    }

    @Override
    public Uni<List<RefreshRecord>> findFamily(String familyId) {
        final var operation = setCommands.smembers(familyKey(familyId)).flatMap(tokenIds -> {
            if (tokenIds.isEmpty()) {
                return Uni.createFrom().item(List.<RefreshRecord>of());
            }
            final List<Uni<Optional<RefreshRecord>>> lookups = new ArrayList<>();
            for (String tokenId : tokenIds) {
                lookups.add(hashCommands.hgetall(tokenKey(tokenId)).map(this::toRecord));
            }
            return Uni.join().all(lookups).andFailFast().map(found -> found.stream()
                    .flatMap(Optional::stream)
                    .toList());
        });
        return timeoutHelper.withTimeout(operation, "findFamily");
    }

    @Override
    public Uni<Set<String>> findFamilyIdsBySubject(String subjectId) {
        return timeoutHelper.withTimeout(setCommands.smembers(subjectKey(subjectId)), "findFamilyIdsBySubject");
    }

    @Override
    public Uni<Integer> revokeFamily(String familyId) {
        final var operation = redisDataSource
                .execute("EVAL", REVOKE_FAMILY_SCRIPT, "1", familyKey(familyId), keyPrefix + "token:")
                .map(Response::toInteger);
        return timeoutHelper.withTimeout(operation, "revokeFamily");
    }

    @Override
    public Uni<Integer> deleteExpiredBefore(Instant cutoff) {
        // Keys carry a TTL of expiresAt + retention
        return Uni.createFrom().item(0);
    }

    private Uni<Response> eval(List<String> args) {
        return redisDataSource.execute(args.get(0), args.subList(1, args.size()).toArray(new String[0]));
    }

    private List<String> recordArgs(RefreshRecord record) {
        final var ttlMs = Math.max(
                1L,
                Duration.between(clock.instant(), record.expiresAt().plus(retention)).toMillis());
        return List.of(
                record.tokenId(),
                record.familyId(),
                nullToEmpty(record.subjectId()),
                writeClaims(record.claims()),
                String.valueOf(record.issuedAt().toEpochMilli()),
                String.valueOf(record.expiresAt().toEpochMilli()),
                record.status().name(),
                String.valueOf(ttlMs));
    }

    private Optional<RefreshRecord> toRecord(Map<String, String> fields) {
        if (fields == null || fields.isEmpty() || fields.get(FIELD_TOKEN_ID) == null) {
            return Optional.empty();
        }
        try {
            final var replacedBy = fields.get(FIELD_REPLACED_BY);
            final var subjectId = fields.get(FIELD_SUBJECT_ID);
            return Optional.of(new RefreshRecord(
                    fields.get(FIELD_TOKEN_ID),
                    fields.get(FIELD_FAMILY_ID),
                    subjectId == null || subjectId.isEmpty() ? null : subjectId,
                    readClaims(fields.get(FIELD_CLAIMS)),
                    Instant.ofEpochMilli(Long.parseLong(fields.get(FIELD_ISSUED_AT))),
                    Instant.ofEpochMilli(Long.parseLong(fields.get(FIELD_EXPIRES_AT))),
                    RefreshStatus.valueOf(fields.get(FIELD_STATUS)),
                    replacedBy == null || replacedBy.isEmpty() ? null : replacedBy));
        } catch (RuntimeException e) {
            LOG.errorv(e, "Corrupt refresh token record {0}", fields.get(FIELD_TOKEN_ID));
            throw new IllegalStateException("Corrupt refresh token record", e);
        }
    }

    private String writeClaims(Map<String, Object> claims) {
        try {
            return objectMapper.writeValueAsString(claims);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Claims are not serializable", e);
        }
    }

    private Map<String, Object> readClaims(String json) {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return new LinkedHashMap<>(objectMapper.readValue(json, CLAIMS_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored claims are not valid JSON", e);
        }
    }

    private String tokenKey(String tokenId) {
        return keyPrefix + "token:" + tokenId;
    }

    private String familyKey(String familyId) {
        return keyPrefix + "family:" + familyId;
    }

    private String subjectKey(String subjectId) {
        return keyPrefix + "subject:" + nullToEmpty(subjectId);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
