package warden.core.model.session;

/**
 * Confirmation reported by the custody provider for a delegation challenge.
 *
 * @param success         whether the user approved the delegation
 * @param delegateAddress delegate bound by the custody provider (optional)
 */
public record ChallengeOutcome(boolean success, String delegateAddress) {

    public static ChallengeOutcome confirmed(String delegateAddress) {
        return new ChallengeOutcome(true, delegateAddress);
    }

    public static ChallengeOutcome failed() {
        return new ChallengeOutcome(false, null);
    }
}
