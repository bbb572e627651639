package warden.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import warden.adapter.in.dto.AgentResponse;
import warden.adapter.in.problem.WardenProblem;
import warden.core.service.session.PermissionCatalog;

/**
 * Read-only view of the permission catalog.
 */
@Path("/agents")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AgentResource {

    private final PermissionCatalog catalog;

    public AgentResource(PermissionCatalog catalog) {
        this.catalog = catalog;
    }

    @GET
    public List<AgentResponse> list() {
        return catalog.all().stream().map(AgentResponse::fromModel).toList();
    }

    @GET
    @Path("/{agentType}")
    public AgentResponse get(@PathParam("agentType") String agentType) {
        if (!catalog.isKnown(agentType)) {
            throw WardenProblem.resourceNotFound("Agent type", agentType);
        }
        return AgentResponse.fromModel(catalog.defaultsFor(agentType));
    }
}
