package warden.core.port.in;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.ChallengeOutcome;
import warden.core.model.session.ChallengeResolution;

/**
 * Inbound port for custody provider confirmations.
 */
public interface ChallengeCompletion {

    /**
     * Resolve a delegation challenge. Repeated calls for the same challenge are no-ops.
     */
    Uni<ChallengeResolution> completeChallenge(String challengeId, ChallengeOutcome outcome);
}
