package warden.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import warden.adapter.in.dto.ExecutionRecordResponse;
import warden.core.port.in.SessionKeyManagement;

/**
 * Audit trail of everything agents did on behalf of a user.
 */
@Path("/users")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class UserResource {

    private final SessionKeyManagement management;

    public UserResource(SessionKeyManagement management) {
        this.management = management;
    }

    @GET
    @Path("/{userId}/executions")
    public Uni<List<ExecutionRecordResponse>> executions(
            @PathParam("userId") String userId, @QueryParam("limit") @DefaultValue("0") int limit) {
        return management
                .userExecutions(userId, limit)
                .map(records ->
                        records.stream().map(ExecutionRecordResponse::fromModel).toList());
    }
}
