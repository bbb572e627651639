package warden.adapter.out.storage.redis;

import java.util.Comparator;
import java.util.List;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.list.ReactiveListCommands;
import io.smallrye.mutiny.Uni;

import warden.core.model.session.ExecutionRecord;
import warden.core.port.out.ExecutionRecordRepository;

/**
 * Redis implementation of ExecutionRecordRepository.
 *
 * <p>Key format:
 * <ul>
 *   <li>Session ledger: {@code {prefix}ledger:{sessionKeyId}} (list, oldest first)</li>
 *   <li>Wallet ledger: {@code {prefix}wallet:{walletId}:ledger} (list, newest first, trimmed to the retention)</li>
 *   <li>User ledger: {@code {prefix}user:{userId}:ledger} (list, newest first, trimmed to the retention)</li>
 * </ul>
 */
public class RedisExecutionRecordRepository implements ExecutionRecordRepository {

    private final ReactiveListCommands<String, String> listCommands;
    private final String keyPrefix;
    private final int walletRetention;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisExecutionRecordRepository(
            ReactiveRedisDataSource redisDataSource,
            String keyPrefix,
            int walletRetention,
            RedisTimeoutHelper timeoutHelper) {
        this.listCommands = redisDataSource.list(String.class, String.class);
        this.keyPrefix = keyPrefix;
        this.walletRetention = walletRetention;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Void> append(ExecutionRecord record) {
        var json = RedisJson.write(record);
        var operation = listCommands.rpush(sessionLedgerKey(record.sessionKeyId()), json);
        if (record.walletId() != null) {
            operation = pushRecent(operation, walletLedgerKey(record.walletId()), json);
        }
        if (record.userId() != null) {
            operation = pushRecent(operation, userLedgerKey(record.userId()), json);
        }
        return timeoutHelper.withTimeout(operation.replaceWithVoid(), "append");
    }

    private Uni<Long> pushRecent(Uni<Long> operation, String key, String json) {
        return operation
                .call(() -> listCommands.lpush(key, json))
                .call(() -> listCommands.ltrim(key, 0, walletRetention - 1));
    }

    @Override
    public Uni<List<ExecutionRecord>> findBySessionKey(String sessionKeyId) {
        var operation = listCommands
                .lrange(sessionLedgerKey(sessionKeyId), 0, -1)
                .map(entries -> entries.stream()
                        .map(json -> RedisJson.read(json, ExecutionRecord.class))
                        .sorted(Comparator.comparing(ExecutionRecord::timestamp))
                        .toList());
        return timeoutHelper.withTimeout(operation, "findBySessionKey");
    }

    @Override
    public Uni<List<ExecutionRecord>> findRecentByWallet(String walletId, int limit) {
        return recent(walletLedgerKey(walletId), limit, "findRecentByWallet");
    }

    @Override
    public Uni<List<ExecutionRecord>> findRecentByUser(String userId, int limit) {
        return recent(userLedgerKey(userId), limit, "findRecentByUser");
    }

    private Uni<List<ExecutionRecord>> recent(String key, int limit, String operationName) {
        if (limit <= 0) {
            return Uni.createFrom().item(List.of());
        }
        var operation = listCommands
                .lrange(key, 0, limit - 1)
                .map(entries -> entries.stream()
                        .map(json -> RedisJson.read(json, ExecutionRecord.class))
                        .toList());
        return timeoutHelper.withTimeout(operation, operationName);
    }

    private String sessionLedgerKey(String sessionKeyId) {
        return keyPrefix + "ledger:" + sessionKeyId;
    }

    private String walletLedgerKey(String walletId) {
        return keyPrefix + "wallet:" + walletId + ":ledger";
    }

    private String userLedgerKey(String userId) {
        return keyPrefix + "user:" + userId + ":ledger";
    }
}
