package warden.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.in.dto.AuthorizationRequest;
import warden.adapter.in.dto.AuthorizationResponse;
import warden.adapter.in.dto.BatchAuthorizationRequest;
import warden.adapter.in.dto.ChallengeStartedResponse;
import warden.adapter.in.dto.CreateSessionKeyRequest;
import warden.adapter.in.dto.ExecutionRecordResponse;
import warden.adapter.in.dto.ReversalRequest;
import warden.adapter.in.dto.ReversalResponse;
import warden.adapter.in.dto.RevokeSessionKeyRequest;
import warden.adapter.in.dto.SessionKeyResponse;
import warden.adapter.in.dto.SpendingResponse;
import warden.adapter.in.problem.WardenProblem;
import warden.core.model.session.AuthorizationDecision;
import warden.core.model.session.CreationResult;
import warden.core.model.session.RenewalResult;
import warden.core.model.session.ReversalResult;
import warden.core.model.session.RevocationResult;
import warden.core.port.in.DelegatedExecution;
import warden.core.port.in.SessionKeyManagement;

/**
 * REST resource for session keys.
 *
 * <p>User endpoints:
 * <ul>
 *   <li>{@code POST /session-keys} - Start creating a session key</li>
 *   <li>{@code GET /session-keys?walletId=} - List a wallet's session keys</li>
 *   <li>{@code GET /session-keys/{id}} - Read a session key</li>
 *   <li>{@code DELETE /session-keys/{id}} - Revoke a session key</li>
 *   <li>{@code POST /session-keys/{id}/renewals} - Start a manual renewal</li>
 *   <li>{@code GET /session-keys/{id}/executions} - Execution ledger</li>
 *   <li>{@code GET /session-keys/{id}/spending} - Ledger reconciliation</li>
 * </ul>
 *
 * <p>Agent endpoints:
 * <ul>
 *   <li>{@code POST /session-keys/{id}/authorizations} - Authorize an action</li>
 *   <li>{@code POST /session-keys/{id}/authorizations/batch} - Authorize a multi-step operation</li>
 *   <li>{@code POST /session-keys/{id}/reversals} - Release a reserved amount</li>
 * </ul>
 *
 * <p>Authorization decisions are always returned as a body; the HTTP status
 * follows the rejection reason so that agents can branch on it.
 */
@Path("/session-keys")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class SessionKeyResource {

    private static final Logger LOG = Logger.getLogger(SessionKeyResource.class);

    private final SessionKeyManagement management;
    private final DelegatedExecution execution;

    public SessionKeyResource(SessionKeyManagement management, DelegatedExecution execution) {
        this.management = management;
        this.execution = execution;
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> create(CreateSessionKeyRequest request) {
        if (request == null) {
            throw WardenProblem.badRequest("Request body is required");
        }
        requireText(request.walletId(), "walletId");
        requireText(request.userId(), "userId");
        requireText(request.agentType(), "agentType");

        return management
                .create(request.walletId(), request.userId(), request.agentType(), request.toOverrides())
                .map(result -> {
                    if (result instanceof CreationResult.Refused refused) {
                        LOG.debugf(
                                "Session key creation for wallet %s refused: %s",
                                request.walletId(), refused.error());
                        throw WardenProblem.sessionKeyError(refused.error(), refused.message());
                    }
                    var started = (CreationResult.Started) result;
                    return Response.accepted(new ChallengeStartedResponse(
                                    started.sessionKeyId(),
                                    started.challengeId(),
                                    SessionKeyResponse.fromModel(started.session())))
                            .build();
                });
    }

    @GET
    public Uni<List<SessionKeyResponse>> list(@QueryParam("walletId") String walletId) {
        requireText(walletId, "walletId");
        return management
                .listByWallet(walletId)
                .map(sessions ->
                        sessions.stream().map(SessionKeyResponse::fromModel).toList());
    }

    @GET
    @Path("/{id}")
    public Uni<SessionKeyResponse> get(@PathParam("id") String sessionKeyId) {
        return management.get(sessionKeyId).map(found -> found.map(SessionKeyResponse::fromModel)
                .orElseThrow(() -> WardenProblem.resourceNotFound("Session key", sessionKeyId)));
    }

    @DELETE
    @Path("/{id}")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<SessionKeyResponse> revoke(@PathParam("id") String sessionKeyId, RevokeSessionKeyRequest request) {
        var reason = request != null ? request.reason() : null;
        LOG.infof("Revoking session key: id=%s, reason=%s", sessionKeyId, reason);

        return management.revoke(sessionKeyId, reason).map(result -> {
            if (result instanceof RevocationResult.Terminated terminated) {
                return SessionKeyResponse.fromModel(terminated.session());
            }
            if (result instanceof RevocationResult.AlreadyTerminal terminal) {
                return SessionKeyResponse.fromModel(terminal.session());
            }
            var refused = (RevocationResult.Refused) result;
            throw WardenProblem.sessionKeyError(refused.error(), "Session key could not be revoked");
        });
    }

    @POST
    @Path("/{id}/renewals")
    public Uni<Response> renew(@PathParam("id") String sessionKeyId) {
        return management.renew(sessionKeyId).map(result -> {
            if (result instanceof RenewalResult.Refused refused) {
                throw WardenProblem.sessionKeyError(refused.error(), refused.message());
            }
            var started = (RenewalResult.Started) result;
            return Response.accepted(new ChallengeStartedResponse(started.sessionKeyId(), started.challengeId(), null))
                    .build();
        });
    }

    @GET
    @Path("/{id}/executions")
    public Uni<List<ExecutionRecordResponse>> executions(@PathParam("id") String sessionKeyId) {
        return management
                .executions(sessionKeyId)
                .map(records ->
                        records.stream().map(ExecutionRecordResponse::fromModel).toList());
    }

    @GET
    @Path("/{id}/spending")
    public Uni<SpendingResponse> spending(@PathParam("id") String sessionKeyId) {
        return management.spending(sessionKeyId).map(found -> found.map(SpendingResponse::fromModel)
                .orElseThrow(() -> WardenProblem.resourceNotFound("Session key", sessionKeyId)));
    }

    @POST
    @Path("/{id}/authorizations")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> authorize(@PathParam("id") String sessionKeyId, AuthorizationRequest request) {
        if (request == null || request.amount() == null) {
            throw WardenProblem.badRequest("amount is required");
        }
        requireText(request.action(), "action");

        return execution
                .authorize(sessionKeyId, request.action(), request.amount())
                .map(decision -> toResponse(sessionKeyId, decision));
    }

    @POST
    @Path("/{id}/authorizations/batch")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> authorizeAll(@PathParam("id") String sessionKeyId, BatchAuthorizationRequest request) {
        if (request == null || request.steps() == null || request.steps().isEmpty()) {
            throw WardenProblem.badRequest("steps are required");
        }
        for (int i = 0; i < request.steps().size(); i++) {
            var step = request.steps().get(i);
            if (step == null || step.amount() == null) {
                throw WardenProblem.badRequest("steps[" + i + "].amount is required");
            }
            requireText(step.action(), "steps[" + i + "].action");
        }

        return execution
                .authorizeAll(sessionKeyId, request.toSteps())
                .map(decision -> toResponse(sessionKeyId, decision));
    }

    @POST
    @Path("/{id}/reversals")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<ReversalResponse> reverse(@PathParam("id") String sessionKeyId, ReversalRequest request) {
        if (request == null || request.amount() == null) {
            throw WardenProblem.badRequest("amount is required");
        }

        return execution.reverse(sessionKeyId, request.amount()).map(result -> {
            if (result instanceof ReversalResult.Refused refused) {
                throw WardenProblem.sessionKeyError(refused.reason(), "Reversal refused");
            }
            var reversed = (ReversalResult.Reversed) result;
            return new ReversalResponse(sessionKeyId, reversed.spendingUsed(), reversed.clamped());
        });
    }

    private static Response toResponse(String sessionKeyId, AuthorizationDecision decision) {
        var body = AuthorizationResponse.fromModel(sessionKeyId, decision);
        if (decision instanceof AuthorizationDecision.Rejected rejected) {
            return Response.status(WardenProblem.statusFor(rejected.reason()))
                    .entity(body)
                    .build();
        }
        return Response.ok(body).build();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw WardenProblem.validationError(field + " is required");
        }
    }
}
