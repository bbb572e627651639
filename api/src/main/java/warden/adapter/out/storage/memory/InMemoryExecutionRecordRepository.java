package warden.adapter.out.storage.memory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.ExecutionRecord;
import warden.core.port.out.ExecutionRecordRepository;

/**
 * In-memory implementation of ExecutionRecordRepository.
 *
 * <p>Per-session ledgers grow without bound; each wallet and user index keeps
 * only the most recent {@code walletRetention} entries.
 */
public class InMemoryExecutionRecordRepository implements ExecutionRecordRepository {

    private final ConcurrentMap<String, List<ExecutionRecord>> bySessionKey = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Deque<ExecutionRecord>> byWallet = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Deque<ExecutionRecord>> byUser = new ConcurrentHashMap<>();
    private final int walletRetention;

    public InMemoryExecutionRecordRepository(int walletRetention) {
        this.walletRetention = walletRetention;
    }

    @Override
    public Uni<Void> append(ExecutionRecord record) {
        return Uni.createFrom().item(() -> {
            var sessionLedger = bySessionKey.computeIfAbsent(record.sessionKeyId(), key -> new ArrayList<>());
            synchronized (sessionLedger) {
                sessionLedger.add(record);
            }
            pushRecent(byWallet, record.walletId(), record);
            pushRecent(byUser, record.userId(), record);
            return null;
        });
    }

    private void pushRecent(ConcurrentMap<String, Deque<ExecutionRecord>> index, String key, ExecutionRecord record) {
        if (key == null) {
            return;
        }
        var recent = index.computeIfAbsent(key, ignored -> new ArrayDeque<>());
        synchronized (recent) {
            recent.addFirst(record);
            while (recent.size() > walletRetention) {
                recent.removeLast();
            }
        }
    }

    @Override
    public Uni<List<ExecutionRecord>> findBySessionKey(String sessionKeyId) {
        return Uni.createFrom().item(() -> {
            var sessionLedger = bySessionKey.get(sessionKeyId);
            if (sessionLedger == null) {
                return List.<ExecutionRecord>of();
            }
            List<ExecutionRecord> snapshot;
            synchronized (sessionLedger) {
                snapshot = new ArrayList<>(sessionLedger);
            }
            snapshot.sort(Comparator.comparing(ExecutionRecord::timestamp));
            return List.copyOf(snapshot);
        });
    }

    @Override
    public Uni<List<ExecutionRecord>> findRecentByWallet(String walletId, int limit) {
        return Uni.createFrom().item(() -> recent(byWallet, walletId, limit));
    }

    @Override
    public Uni<List<ExecutionRecord>> findRecentByUser(String userId, int limit) {
        return Uni.createFrom().item(() -> recent(byUser, userId, limit));
    }

    private static List<ExecutionRecord> recent(
            ConcurrentMap<String, Deque<ExecutionRecord>> index, String key, int limit) {
        var entries = index.get(key);
        if (entries == null || limit <= 0) {
            return List.of();
        }
        synchronized (entries) {
            return entries.stream().limit(limit).toList();
        }
    }
}
