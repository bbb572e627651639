package warden.adapter.in.dto;

import java.time.Instant;

import warden.core.model.session.DelegationChallenge;
import warden.core.model.session.SessionKeyError;

/**
 * State of a delegation challenge after a confirmation callback.
 *
 * @param challengeId     challenge identifier
 * @param sessionKeyId    session key the challenge belongs to
 * @param kind            CREATE or RENEW
 * @param status          resolved status
 * @param resolvedAt      resolution time
 * @param delegateAddress delegate confirmed by the custody provider
 * @param duplicate       true when the challenge had already been resolved
 * @param error           effect of the resolution on the session key, when it did not apply
 * @param sessionKey      session key after the resolution (null for duplicates)
 */
public record ChallengeResponse(
        String challengeId,
        String sessionKeyId,
        String kind,
        String status,
        Instant resolvedAt,
        String delegateAddress,
        boolean duplicate,
        String error,
        SessionKeyResponse sessionKey) {

    public static ChallengeResponse fromModel(
            DelegationChallenge challenge, boolean duplicate, SessionKeyError error, SessionKeyResponse sessionKey) {
        return new ChallengeResponse(
                challenge.challengeId(),
                challenge.sessionKeyId(),
                challenge.kind().name(),
                challenge.status().name(),
                challenge.resolvedAt(),
                challenge.delegateAddress(),
                duplicate,
                error == null ? null : error.name(),
                sessionKey);
    }
}
