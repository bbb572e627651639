package warden.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.AuthorizationDecision;
import warden.core.model.session.ExecutionStep;
import warden.core.model.session.ReversalResult;

/**
 * Inbound port for agents acting under a session key.
 */
public interface DelegatedExecution {

    /**
     * Decide whether an agent action may be signed and reserve its amount.
     *
     * @param sessionKeyId session key the agent acts under
     * @param action       requested action tag
     * @param amount       amount in the smallest currency unit
     * @return the decision; never a failed Uni
     */
    Uni<AuthorizationDecision> authorize(String sessionKeyId, String action, long amount);

    /**
     * Decide whether every step of a multi-step operation may be signed and reserve
     * their combined amount in one write. Either all steps are admitted or none is.
     *
     * @param sessionKeyId session key the agent acts under
     * @param steps        steps in execution order
     * @return the decision for the whole operation; never a failed Uni
     */
    Uni<AuthorizationDecision> authorizeAll(String sessionKeyId, List<ExecutionStep> steps);

    /**
     * Release a previously reserved amount after a downstream failure.
     */
    Uni<ReversalResult> reverse(String sessionKeyId, long amount);
}
