package warden.adapter.in.dto;

/**
 * Custody provider callback for a delegation challenge.
 *
 * @param success         whether the user confirmed the delegation (required)
 * @param delegateAddress on-chain signer bound by the custody provider
 */
public record ChallengeConfirmationRequest(Boolean success, String delegateAddress) {}
