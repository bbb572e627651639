package warden.adapter.out.storage.memory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.ChallengeStatus;
import warden.core.model.session.DelegationChallenge;
import warden.core.port.out.DelegationChallengeRepository;

/**
 * In-memory implementation of DelegationChallengeRepository.
 */
public class InMemoryDelegationChallengeRepository implements DelegationChallengeRepository {

    private final ConcurrentMap<String, DelegationChallenge> challenges = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(DelegationChallenge challenge) {
        return Uni.createFrom().item(() -> {
            challenges.put(challenge.challengeId(), challenge);
            return null;
        });
    }

    @Override
    public Uni<Optional<DelegationChallenge>> findById(String challengeId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(challenges.get(challengeId)));
    }

    @Override
    public Uni<Boolean> resolveIfAwaiting(DelegationChallenge resolved) {
        return Uni.createFrom().item(() -> {
            var applied = new AtomicBoolean(false);
            challenges.computeIfPresent(resolved.challengeId(), (id, current) -> {
                if (current.status() != ChallengeStatus.AWAITING_CONFIRMATION) {
                    return current;
                }
                applied.set(true);
                return resolved;
            });
            return applied.get();
        });
    }

    @Override
    public Uni<List<DelegationChallenge>> findAwaiting() {
        return Uni.createFrom().item(() -> challenges.values().stream()
                .filter(challenge -> challenge.status() == ChallengeStatus.AWAITING_CONFIRMATION)
                .toList());
    }
}
