package warden.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.in.dto.ChallengeConfirmationRequest;
import warden.adapter.in.dto.ChallengeResponse;
import warden.adapter.in.dto.SessionKeyResponse;
import warden.adapter.in.problem.WardenProblem;
import warden.core.model.session.ChallengeOutcome;
import warden.core.model.session.ChallengeResolution;
import warden.core.port.in.ChallengeCompletion;

/**
 * Callback endpoint for the custody provider.
 *
 * <p>Repeated callbacks for the same challenge return the stored resolution
 * with {@code duplicate=true} and change nothing.
 */
@Path("/custody/challenges")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class CustodyChallengeResource {

    private static final Logger LOG = Logger.getLogger(CustodyChallengeResource.class);

    private final ChallengeCompletion completion;

    public CustodyChallengeResource(ChallengeCompletion completion) {
        this.completion = completion;
    }

    @POST
    @Path("/{challengeId}/confirmation")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<ChallengeResponse> confirm(
            @PathParam("challengeId") String challengeId, ChallengeConfirmationRequest request) {
        if (request == null || request.success() == null) {
            throw WardenProblem.badRequest("success is required");
        }
        var outcome = request.success()
                ? ChallengeOutcome.confirmed(request.delegateAddress())
                : ChallengeOutcome.failed();
        LOG.debugf("Custody callback for challenge %s: success=%s", challengeId, request.success());

        return completion.completeChallenge(challengeId, outcome).map(resolution -> {
            if (resolution instanceof ChallengeResolution.Resolved resolved) {
                var session = resolved.session() == null ? null : SessionKeyResponse.fromModel(resolved.session());
                return ChallengeResponse.fromModel(resolved.challenge(), false, resolved.error(), session);
            }
            if (resolution instanceof ChallengeResolution.AlreadyResolved already) {
                return ChallengeResponse.fromModel(already.challenge(), true, null, null);
            }
            var refused = (ChallengeResolution.Refused) resolution;
            throw WardenProblem.sessionKeyError(refused.error(), refused.message());
        });
    }
}
