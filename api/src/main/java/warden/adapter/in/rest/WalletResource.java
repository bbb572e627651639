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
 * Wallet-wide audit trail across all of a wallet's session keys.
 */
@Path("/wallets")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class WalletResource {

    private final SessionKeyManagement management;

    public WalletResource(SessionKeyManagement management) {
        this.management = management;
    }

    /**
     * List a wallet's most recent ledger entries, newest first.
     *
     * @param walletId wallet identifier
     * @param limit page size; 0 uses the configured default
     */
    @GET
    @Path("/{walletId}/executions")
    public Uni<List<ExecutionRecordResponse>> executions(
            @PathParam("walletId") String walletId, @QueryParam("limit") @DefaultValue("0") int limit) {
        return management
                .walletExecutions(walletId, limit)
                .map(records ->
                        records.stream().map(ExecutionRecordResponse::fromModel).toList());
    }
}
