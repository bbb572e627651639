package warden.adapter.in.dto;

/**
 * Response for a creation or renewal awaiting confirmation by the custody provider.
 *
 * @param sessionKeyId session key being created or renewed
 * @param challengeId  challenge the custody provider will confirm
 * @param sessionKey   current state of the session key (null for renewals)
 */
public record ChallengeStartedResponse(String sessionKeyId, String challengeId, SessionKeyResponse sessionKey) {}
