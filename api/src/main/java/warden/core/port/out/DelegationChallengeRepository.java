package warden.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.DelegationChallenge;

/**
 * Outbound port for delegation challenge storage.
 */
public interface DelegationChallengeRepository {

    Uni<Void> save(DelegationChallenge challenge);

    Uni<Optional<DelegationChallenge>> findById(String challengeId);

    /**
     * Store a resolved challenge only if the stored one is still awaiting confirmation.
     *
     * @param resolved the resolved challenge
     * @return true if this call resolved the challenge
     */
    Uni<Boolean> resolveIfAwaiting(DelegationChallenge resolved);

    /**
     * List challenges still awaiting confirmation.
     */
    Uni<List<DelegationChallenge>> findAwaiting();
}
