package warden.adapter.out.custody;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.session.DelegationRequest;
import warden.core.port.out.CustodyProvider;

/**
 * Development custody provider that logs delegation requests and accepts them.
 *
 * <p>Confirmations must be posted to the challenge confirmation endpoint by hand
 * or by a test harness.
 */
public class LoggingCustodyProvider implements CustodyProvider {

    private static final Logger LOG = Logger.getLogger(LoggingCustodyProvider.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public Uni<Void> requestDelegation(DelegationRequest request) {
        return Uni.createFrom().voidItem().invoke(() -> LOG.infof(
                "Delegation requested: challenge=%s, kind=%s, sessionKey=%s, wallet=%s, agent=%s, actions=%s, limit=%d, duration=%s",
                request.challengeId(),
                request.kind(),
                request.sessionKeyId(),
                request.walletId(),
                request.agentType(),
                request.allowedActions(),
                request.spendingLimit(),
                request.duration()));
    }
}
