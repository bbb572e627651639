package warden.adapter.out.storage.redis;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.session.SessionKey;
import warden.core.model.session.SessionKeyStatus;
import warden.core.model.session.UpdateOutcome;
import warden.core.port.out.SessionKeyRepository;

/**
 * Redis implementation of SessionKeyRepository.
 *
 * <p>Key format:
 * <ul>
 *   <li>Session key: {@code {prefix}session:{id}} (hash with json, version, status, walletId)</li>
 *   <li>Wallet sessions: {@code {prefix}wallet:{walletId}:sessions} (set of IDs)</li>
 *   <li>Wallet active slot: {@code {prefix}wallet:{walletId}:active} (ID of the enforceable session key)</li>
 *   <li>Status index: {@code {prefix}status:{STATUS}} (set of IDs)</li>
 * </ul>
 *
 * <p>Inserts and conditional updates run as Lua scripts so the version check,
 * the wallet slot and the indexes change together. Index keys are derived inside
 * the scripts, which restricts this repository to standalone Redis.
 */
public class RedisSessionKeyRepository implements SessionKeyRepository {

    private static final Logger LOG = Logger.getLogger(RedisSessionKeyRepository.class);

    private static final String FIELD_JSON = "json";

    /**
     * Lua script for inserting a session key if its ID is free.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the session key hash</li>
     *   <li>ARGV[1] - JSON document</li>
     *   <li>ARGV[2] - version</li>
     *   <li>ARGV[3] - status</li>
     *   <li>ARGV[4] - wallet ID</li>
     *   <li>ARGV[5] - status index key</li>
     *   <li>ARGV[6] - wallet sessions key</li>
     *   <li>ARGV[7] - session key ID</li>
     * </ol>
     *
     * <p>Returns 1 if stored, 0 if the ID is taken.
     */
    private static final String INSERT_SCRIPT =
            """
            if redis.call('EXISTS', KEYS[1]) == 1 then
                return 0
            end
            redis.call('HSET', KEYS[1], 'json', ARGV[1], 'version', ARGV[2], 'status', ARGV[3], 'walletId', ARGV[4])
            redis.call('SADD', ARGV[5], ARGV[7])
            redis.call('SADD', ARGV[6], ARGV[7])
            return 1
            """;

    /**
     * Lua script for a version-checked update.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the session key hash</li>
     *   <li>ARGV[1] - expected version</li>
     *   <li>ARGV[2] - new version</li>
     *   <li>ARGV[3] - new JSON document</li>
     *   <li>ARGV[4] - new status</li>
     *   <li>ARGV[5] - wallet active slot key</li>
     *   <li>ARGV[6] - session key ID</li>
     *   <li>ARGV[7] - 1 if the new status holds the wallet slot, 0 otherwise</li>
     *   <li>ARGV[8] - status index key prefix</li>
     * </ol>
     *
     * <p>Returns APPLIED, STALE or WALLET_CONFLICT.
     */
    private static final String COMPARE_AND_SET_SCRIPT =
            """
            local current = redis.call('HGET', KEYS[1], 'version')
            if not current or tonumber(current) ~= tonumber(ARGV[1]) then
                return 'STALE'
            end
            local old_status = redis.call('HGET', KEYS[1], 'status')
            local holder = redis.call('GET', ARGV[5])
            if ARGV[7] == '1' then
                if holder and holder ~= ARGV[6] then
                    return 'WALLET_CONFLICT'
                end
                redis.call('SET', ARGV[5], ARGV[6])
            elseif holder == ARGV[6] then
                redis.call('DEL', ARGV[5])
            end
            if old_status ~= ARGV[4] then
                redis.call('SREM', ARGV[8] .. old_status, ARGV[6])
                redis.call('SADD', ARGV[8] .. ARGV[4], ARGV[6])
            end
            redis.call('HSET', KEYS[1], 'json', ARGV[3], 'version', ARGV[2], 'status', ARGV[4])
            return 'APPLIED'
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveSetCommands<String, String> setCommands;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final String keyPrefix;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisSessionKeyRepository(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.setCommands = redisDataSource.set(String.class, String.class);
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyPrefix = keyPrefix;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Boolean> insertIfAbsent(SessionKey sessionKey) {
        if (sessionKey.status().holdsWalletSlot()) {
            return Uni.createFrom().failure(new IllegalArgumentException("New session keys must not be enforceable"));
        }
        var id = sessionKey.sessionKeyId();
        var operation = redisDataSource
                .execute(
                        "EVAL",
                        INSERT_SCRIPT,
                        "1", // numkeys
                        sessionKeyKey(id), // KEYS[1]
                        RedisJson.write(sessionKey), // ARGV[1]
                        String.valueOf(sessionKey.version()), // ARGV[2]
                        sessionKey.status().name(), // ARGV[3]
                        sessionKey.walletId(), // ARGV[4]
                        statusKey(sessionKey.status()), // ARGV[5]
                        walletSessionsKey(sessionKey.walletId()), // ARGV[6]
                        id // ARGV[7]
                        )
                .map(response -> response.toInteger() == 1)
                .invoke(stored -> {
                    if (stored) {
                        LOG.debugf("Session key stored: %s for wallet %s", id, sessionKey.walletId());
                    } else {
                        LOG.debugf("Session key ID collision detected: %s", id);
                    }
                });
        return timeoutHelper.withTimeout(operation, "insertIfAbsent");
    }

    @Override
    public Uni<Optional<SessionKey>> findById(String sessionKeyId) {
        var operation = hashCommands
                .hget(sessionKeyKey(sessionKeyId), FIELD_JSON)
                .map(json -> json == null ? Optional.<SessionKey>empty() : Optional.of(read(json)));
        return timeoutHelper.withTimeout(operation, "findById");
    }

    @Override
    public Uni<UpdateOutcome> compareAndSet(SessionKey updated, long expectedVersion) {
        var id = updated.sessionKeyId();
        var operation = redisDataSource
                .execute(
                        "EVAL",
                        COMPARE_AND_SET_SCRIPT,
                        "1", // numkeys
                        sessionKeyKey(id), // KEYS[1]
                        String.valueOf(expectedVersion), // ARGV[1]
                        String.valueOf(updated.version()), // ARGV[2]
                        RedisJson.write(updated), // ARGV[3]
                        updated.status().name(), // ARGV[4]
                        walletActiveKey(updated.walletId()), // ARGV[5]
                        id, // ARGV[6]
                        updated.status().holdsWalletSlot() ? "1" : "0", // ARGV[7]
                        keyPrefix + "status:" // ARGV[8]
                        )
                .map(response -> UpdateOutcome.valueOf(response.toString()));
        return timeoutHelper.withTimeout(operation, "compareAndSet");
    }

    @Override
    public Uni<List<SessionKey>> findByWallet(String walletId) {
        var operation = setCommands
                .smembers(walletSessionsKey(walletId))
                .flatMap(this::loadAll)
                .map(sessions -> sessions.stream()
                        .sorted(Comparator.comparing(SessionKey::createdAt).reversed())
                        .toList());
        return timeoutHelper.withTimeout(operation, "findByWallet");
    }

    @Override
    public Uni<Optional<SessionKey>> findEnforceableByWallet(String walletId) {
        var operation = valueCommands.get(walletActiveKey(walletId)).flatMap(sessionKeyId -> {
            if (sessionKeyId == null) {
                return Uni.createFrom().item(Optional.<SessionKey>empty());
            }
            return findById(sessionKeyId);
        });
        return timeoutHelper.withTimeout(operation, "findEnforceableByWallet");
    }

    @Override
    public Uni<List<SessionKey>> findByStatus(Collection<SessionKeyStatus> statuses) {
        var operation = Multi.createFrom()
                .iterable(statuses)
                .onItem()
                .transformToUniAndConcatenate(status -> setCommands.smembers(statusKey(status)))
                .collect()
                .in(LinkedHashSet<String>::new, Set::addAll)
                .flatMap(this::loadAll)
                .map(sessions -> sessions.stream()
                        .filter(session -> statuses.contains(session.status()))
                        .toList());
        return timeoutHelper.withTimeout(operation, "findByStatus");
    }

    private Uni<List<SessionKey>> loadAll(Set<String> sessionKeyIds) {
        if (sessionKeyIds.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        return Multi.createFrom()
                .iterable(sessionKeyIds)
                .onItem()
                .transformToUniAndConcatenate(id -> hashCommands.hget(sessionKeyKey(id), FIELD_JSON))
                .select()
                .where(json -> json != null)
                .map(RedisSessionKeyRepository::read)
                .collect()
                .asList();
    }

    private static SessionKey read(String json) {
        return RedisJson.read(json, SessionKey.class);
    }

    private String sessionKeyKey(String sessionKeyId) {
        return keyPrefix + "session:" + sessionKeyId;
    }

    private String walletSessionsKey(String walletId) {
        return keyPrefix + "wallet:" + walletId + ":sessions";
    }

    private String walletActiveKey(String walletId) {
        return keyPrefix + "wallet:" + walletId + ":active";
    }

    private String statusKey(SessionKeyStatus status) {
        return keyPrefix + "status:" + status.name();
    }
}
