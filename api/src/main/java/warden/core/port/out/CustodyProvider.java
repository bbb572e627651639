package warden.core.port.out;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.DelegationRequest;

/**
 * Outbound port to the custody provider that holds the wallet's keys.
 *
 * <p>The provider asks the user to confirm the delegation and later reports the
 * outcome through the challenge confirmation endpoint. Implementations return as
 * soon as the request was accepted; they never wait for the user.
 */
public interface CustodyProvider {

    /**
     * Provider name used for configuration selection.
     */
    String name();

    /**
     * Emit a delegation challenge.
     *
     * @param request the delegation to confirm
     * @return a Uni completing when the provider accepted the request, or failing if it refused
     */
    Uni<Void> requestDelegation(DelegationRequest request);
}
