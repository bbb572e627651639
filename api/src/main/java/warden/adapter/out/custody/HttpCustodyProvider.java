package warden.adapter.out.custody;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import warden.core.model.session.DelegationRequest;
import warden.core.port.out.CustodyProvider;

/**
 * Custody provider that posts delegation requests to an HTTP endpoint.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * POST {endpoint}
 * Content-Type: application/json
 *
 * {
 *   "challengeId": "...",
 *   "kind": "CREATE",
 *   "sessionKeyId": "...",
 *   "walletId": "...",
 *   "userId": "...",
 *   "agentType": "payments",
 *   "allowedActions": ["transfer"],
 *   "spendingLimit": 10000000000,
 *   "durationSeconds": 604800
 * }
 * }</pre>
 *
 * <p>Any 2xx status means the request was accepted. Other statuses, timeouts and
 * connection errors fail the returned Uni with {@link CustodyRequestException}.
 */
public class HttpCustodyProvider implements CustodyProvider {

    private static final Logger LOG = Logger.getLogger(HttpCustodyProvider.class);

    private final WebClient webClient;
    private final String endpoint;
    private final Duration timeout;

    public HttpCustodyProvider(WebClient webClient, String endpoint, Duration timeout) {
        this.webClient = webClient;
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    public Uni<Void> requestDelegation(DelegationRequest request) {
        final var body = toJson(request);

        LOG.debugf("Posting delegation request: url=%s, challenge=%s", endpoint, request.challengeId());

        return webClient
                .postAbs(endpoint)
                .timeout(timeout.toMillis())
                .putHeader("Content-Type", "application/json")
                .putHeader("Accept", "application/json")
                .sendJsonObject(body)
                .map(response -> {
                    if (response.statusCode() < 200 || response.statusCode() >= 300) {
                        LOG.warnf(
                                "Custody provider refused delegation: url=%s, challenge=%s, status=%d",
                                endpoint, request.challengeId(), response.statusCode());
                        throw new CustodyRequestException(
                                "Custody provider returned status " + response.statusCode());
                    }
                    return response;
                })
                .onFailure(error -> !(error instanceof CustodyRequestException))
                .transform(error -> new CustodyRequestException(
                        "Custody provider request failed: " + error.getMessage(), error))
                .replaceWithVoid();
    }

    static JsonObject toJson(DelegationRequest request) {
        return new JsonObject()
                .put("challengeId", request.challengeId())
                .put("kind", request.kind().name())
                .put("sessionKeyId", request.sessionKeyId())
                .put("walletId", request.walletId())
                .put("userId", request.userId())
                .put("agentType", request.agentType())
                .put("allowedActions", new JsonArray(request.allowedActions().stream().sorted().toList()))
                .put("spendingLimit", request.spendingLimit())
                .put("durationSeconds", request.duration().toSeconds());
    }

    /**
     * Exception thrown when the custody provider does not accept a delegation request.
     */
    public static class CustodyRequestException extends RuntimeException {

        public CustodyRequestException(String message) {
            super(message);
        }

        public CustodyRequestException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
