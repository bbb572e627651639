package warden.adapter.out.storage.redis;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import warden.core.model.session.ChallengeStatus;
import warden.core.model.session.DelegationChallenge;
import warden.core.port.out.DelegationChallengeRepository;

/**
 * Redis implementation of DelegationChallengeRepository.
 *
 * <p>Key format:
 * <ul>
 *   <li>Challenge: {@code {prefix}challenge:{id}} (hash with json, status)</li>
 *   <li>Awaiting index: {@code {prefix}challenges:awaiting} (set of IDs)</li>
 * </ul>
 */
public class RedisDelegationChallengeRepository implements DelegationChallengeRepository {

    private static final String FIELD_JSON = "json";
    private static final String FIELD_STATUS = "status";

    /**
     * Lua script resolving a challenge only while it awaits confirmation.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the challenge hash</li>
     *   <li>ARGV[1] - resolved JSON document</li>
     *   <li>ARGV[2] - resolved status</li>
     *   <li>ARGV[3] - awaiting index key</li>
     *   <li>ARGV[4] - challenge ID</li>
     * </ol>
     *
     * <p>Returns 1 if this call resolved the challenge, 0 otherwise.
     */
    private static final String RESOLVE_SCRIPT =
            """
            if redis.call('HGET', KEYS[1], 'status') ~= 'AWAITING_CONFIRMATION' then
                return 0
            end
            redis.call('HSET', KEYS[1], 'json', ARGV[1], 'status', ARGV[2])
            redis.call('SREM', ARGV[3], ARGV[4])
            return 1
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveSetCommands<String, String> setCommands;
    private final String keyPrefix;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisDelegationChallengeRepository(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.setCommands = redisDataSource.set(String.class, String.class);
        this.keyPrefix = keyPrefix;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Void> save(DelegationChallenge challenge) {
        var id = challenge.challengeId();
        var fields = Map.of(FIELD_JSON, RedisJson.write(challenge), FIELD_STATUS, challenge.status().name());
        Uni<?> index = challenge.status() == ChallengeStatus.AWAITING_CONFIRMATION
                ? setCommands.sadd(awaitingKey(), id)
                : setCommands.srem(awaitingKey(), id);
        var operation = hashCommands.hset(challengeKey(id), fields).call(() -> index);
        return timeoutHelper.withTimeout(operation.replaceWithVoid(), "save");
    }

    @Override
    public Uni<Optional<DelegationChallenge>> findById(String challengeId) {
        var operation = hashCommands
                .hget(challengeKey(challengeId), FIELD_JSON)
                .map(json -> json == null ? Optional.<DelegationChallenge>empty() : Optional.of(read(json)));
        return timeoutHelper.withTimeout(operation, "findById");
    }

    @Override
    public Uni<Boolean> resolveIfAwaiting(DelegationChallenge resolved) {
        var id = resolved.challengeId();
        var operation = redisDataSource
                .execute(
                        "EVAL",
                        RESOLVE_SCRIPT,
                        "1", // numkeys
                        challengeKey(id), // KEYS[1]
                        RedisJson.write(resolved), // ARGV[1]
                        resolved.status().name(), // ARGV[2]
                        awaitingKey(), // ARGV[3]
                        id // ARGV[4]
                        )
                .map(response -> response.toInteger() == 1);
        return timeoutHelper.withTimeout(operation, "resolveIfAwaiting");
    }

    @Override
    public Uni<List<DelegationChallenge>> findAwaiting() {
        var operation = setCommands.smembers(awaitingKey()).flatMap(ids -> Multi.createFrom()
                .iterable(ids)
                .onItem()
                .transformToUniAndConcatenate(id -> hashCommands.hget(challengeKey(id), FIELD_JSON))
                .select()
                .where(json -> json != null)
                .map(RedisDelegationChallengeRepository::read)
                .select()
                .where(challenge -> challenge.status() == ChallengeStatus.AWAITING_CONFIRMATION)
                .collect()
                .asList());
        return timeoutHelper.withTimeout(operation, "findAwaiting");
    }

    private static DelegationChallenge read(String json) {
        return RedisJson.read(json, DelegationChallenge.class);
    }

    private String challengeKey(String challengeId) {
        return keyPrefix + "challenge:" + challengeId;
    }

    private String awaitingKey() {
        return keyPrefix + "challenges:awaiting";
    }
}
