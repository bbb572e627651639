package warden.adapter.in.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

import java.util.List;
import java.util.UUID;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import io.restassured.path.json.JsonPath;
import io.restassured.response.ValidatableResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Integration tests for the session key, custody callback and catalog endpoints.
 *
 * <p>Runs with in-memory storage and the logging custody provider; challenges are
 * confirmed through the custody callback endpoint.
 */
@QuarkusTest
@DisplayName("Session Key Resource Tests")
class SessionKeyResourceTest {

    private String walletId;

    @BeforeEach
    void setUp() {
        walletId = "wallet-" + UUID.randomUUID();
    }

    private JsonPath create(String body) {
        return given().contentType(ContentType.JSON)
                .body(body)
                .when()
                .post("/session-keys")
                .then()
                .statusCode(202)
                .extract()
                .jsonPath();
    }

    private JsonPath createDefault() {
        return create(
                """
                {"walletId": "%s", "userId": "user-1", "agentType": "test-agent"}
                """
                        .formatted(walletId));
    }

    private void confirm(String challengeId) {
        given().contentType(ContentType.JSON)
                .body("{\"success\": true, \"delegateAddress\": \"0xdelegate\"}")
                .when()
                .post("/custody/challenges/" + challengeId + "/confirmation")
                .then()
                .statusCode(200);
    }

    private String activeSessionKey() {
        var created = createDefault();
        confirm(created.getString("challengeId"));
        return created.getString("sessionKeyId");
    }

    private ValidatableResponse authorize(String sessionKeyId, String action, Object amount) {
        return given().contentType(ContentType.JSON)
                .body("{\"action\": \"%s\", \"amount\": %s}".formatted(action, amount))
                .when()
                .post("/session-keys/" + sessionKeyId + "/authorizations")
                .then();
    }

    @Nested
    @DisplayName("Creation")
    class CreationTests {

        @Test
        @DisplayName("should start a pending session key with the catalog defaults")
        void shouldCreatePendingSessionKey() {
            var created = createDefault();

            given().when()
                    .get("/session-keys/" + created.getString("sessionKeyId"))
                    .then()
                    .statusCode(200)
                    .body("status", equalTo("PENDING"))
                    .body("walletId", equalTo(walletId))
                    .body("allowedActions", hasSize(2))
                    .body("spendingLimit", equalTo(10000))
                    .body("maxAmountPerTransaction", equalTo(5000))
                    .body("duration", equalTo("PT24H"))
                    .body("delegateAddress", nullValue());
        }

        @Test
        @DisplayName("should narrow the defaults with overrides")
        void shouldApplyOverrides() {
            given().contentType(ContentType.JSON)
                    .body(
                            """
                            {
                                "walletId": "%s",
                                "userId": "user-1",
                                "agentType": "test-agent",
                                "spendingLimit": 2500,
                                "allowedActions": ["transfer"],
                                "duration": "PT2H"
                            }
                            """
                                    .formatted(walletId))
                    .when()
                    .post("/session-keys")
                    .then()
                    .statusCode(202)
                    .body("challengeId", notNullValue())
                    .body("sessionKey.spendingLimit", equalTo(2500))
                    .body("sessionKey.allowedActions", equalTo(List.of("transfer")))
                    .body("sessionKey.duration", equalTo("PT2H"));
        }

        @Test
        @DisplayName("should reject overrides that widen the defaults")
        void shouldRejectWidening() {
            given().contentType(ContentType.JSON)
                    .body(
                            """
                            {"walletId": "%s", "userId": "user-1", "agentType": "test-agent", "spendingLimit": 20000}
                            """
                                    .formatted(walletId))
                    .when()
                    .post("/session-keys")
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("INVALID_OVERRIDE"))
                    .body("retryable", equalTo(false));
        }

        @Test
        @DisplayName("should require a wallet")
        void shouldRequireWallet() {
            given().contentType(ContentType.JSON)
                    .body("{\"userId\": \"user-1\", \"agentType\": \"test-agent\"}")
                    .when()
                    .post("/session-keys")
                    .then()
                    .statusCode(400);
        }
    }

    @Nested
    @DisplayName("Custody callback")
    class CustodyCallbackTests {

        @Test
        @DisplayName("should activate the session key once")
        void shouldActivateOnce() {
            var created = createDefault();
            var path = "/custody/challenges/" + created.getString("challengeId") + "/confirmation";

            given().contentType(ContentType.JSON)
                    .body("{\"success\": true, \"delegateAddress\": \"0xabc\"}")
                    .when()
                    .post(path)
                    .then()
                    .statusCode(200)
                    .body("status", equalTo("CONFIRMED"))
                    .body("duplicate", equalTo(false))
                    .body("sessionKey.status", equalTo("ACTIVE"))
                    .body("sessionKey.delegateAddress", equalTo("0xabc"));

            given().contentType(ContentType.JSON)
                    .body("{\"success\": false}")
                    .when()
                    .post(path)
                    .then()
                    .statusCode(200)
                    .body("status", equalTo("CONFIRMED"))
                    .body("duplicate", equalTo(true));
        }

        @Test
        @DisplayName("should revoke the session key when the delegation fails")
        void shouldRevokeOnFailure() {
            var created = createDefault();

            given().contentType(ContentType.JSON)
                    .body("{\"success\": false}")
                    .when()
                    .post("/custody/challenges/" + created.getString("challengeId") + "/confirmation")
                    .then()
                    .statusCode(200)
                    .body("status", equalTo("FAILED"))
                    .body("error", equalTo("CHALLENGE_FAILED"))
                    .body("sessionKey.status", equalTo("REVOKED"));
        }

        @Test
        @DisplayName("should return 404 for unknown challenges")
        void shouldRejectUnknownChallenge() {
            given().contentType(ContentType.JSON)
                    .body("{\"success\": true}")
                    .when()
                    .post("/custody/challenges/no-such-challenge/confirmation")
                    .then()
                    .statusCode(404)
                    .body("error", equalTo("NOT_FOUND"));
        }

        @Test
        @DisplayName("should require the outcome")
        void shouldRequireOutcome() {
            given().contentType(ContentType.JSON)
                    .body("{}")
                    .when()
                    .post("/custody/challenges/any/confirmation")
                    .then()
                    .statusCode(400);
        }
    }

    @Nested
    @DisplayName("Authorization")
    class AuthorizationTests {

        @Test
        @DisplayName("should admit within the limits and report the headroom")
        void shouldAdmit() {
            var sessionKeyId = activeSessionKey();

            authorize(sessionKeyId, "transfer", 4000)
                    .statusCode(200)
                    .body("admitted", equalTo(true))
                    .body("spendingUsed", equalTo(4000))
                    .body("headroom", equalTo(6000));
        }

        @Test
        @DisplayName("should map rejections to statuses")
        void shouldMapRejections() {
            var sessionKeyId = activeSessionKey();
            authorize(sessionKeyId, "transfer", 5000).statusCode(200);
            authorize(sessionKeyId, "transfer", 4000).statusCode(200);

            authorize(sessionKeyId, "bridge", 1)
                    .statusCode(403)
                    .body("admitted", equalTo(false))
                    .body("reason", equalTo("ACTION_NOT_PERMITTED"));
            authorize(sessionKeyId, "swap", 5001)
                    .statusCode(403)
                    .body("reason", equalTo("PER_TRANSACTION_LIMIT_EXCEEDED"));
            authorize(sessionKeyId, "swap", 2000)
                    .statusCode(403)
                    .body("reason", equalTo("SPENDING_LIMIT_EXCEEDED"))
                    .body("headroom", equalTo(1000));
            authorize(sessionKeyId, "swap", -1).statusCode(400).body("reason", equalTo("INVALID_AMOUNT"));
            authorize("no-such-key", "transfer", 1).statusCode(404).body("reason", equalTo("NOT_FOUND"));
        }

        @Test
        @DisplayName("should reject actions on a pending session key")
        void shouldRejectPending() {
            var created = createDefault();

            authorize(created.getString("sessionKeyId"), "transfer", 1)
                    .statusCode(403)
                    .body("reason", equalTo("NOT_YET_ACTIVE"));
        }

        @Test
        @DisplayName("should require an amount")
        void shouldRequireAmount() {
            given().contentType(ContentType.JSON)
                    .body("{\"action\": \"transfer\"}")
                    .when()
                    .post("/session-keys/any/authorizations")
                    .then()
                    .statusCode(400);
        }

        @Test
        @DisplayName("should release reserved amounts and clamp at zero")
        void shouldReverse() {
            var sessionKeyId = activeSessionKey();
            authorize(sessionKeyId, "transfer", 3000).statusCode(200);

            given().contentType(ContentType.JSON)
                    .body("{\"amount\": 5000}")
                    .when()
                    .post("/session-keys/" + sessionKeyId + "/reversals")
                    .then()
                    .statusCode(200)
                    .body("spendingUsed", equalTo(0))
                    .body("clamped", equalTo(true));

            given().when()
                    .get("/session-keys/" + sessionKeyId + "/spending")
                    .then()
                    .statusCode(200)
                    .body("consistent", equalTo(true))
                    .body("admitted", equalTo(1))
                    .body("reversed", equalTo(1));
        }
    }

    @Nested
    @DisplayName("Multi-step authorization")
    class BatchAuthorizationTests {

        private ValidatableResponse authorizeAll(String sessionKeyId, String steps) {
            return given().contentType(ContentType.JSON)
                    .body("{\"steps\": " + steps + "}")
                    .when()
                    .post("/session-keys/" + sessionKeyId + "/authorizations/batch")
                    .then();
        }

        @Test
        @DisplayName("should reserve the combined amount of all steps")
        void shouldAdmitAllSteps() {
            var sessionKeyId = activeSessionKey();

            authorizeAll(
                            sessionKeyId,
                            """
                            [{"action": "swap", "amount": 3000}, {"action": "transfer", "amount": 2000}]
                            """)
                    .statusCode(200)
                    .body("admitted", equalTo(true))
                    .body("spendingUsed", equalTo(5000))
                    .body("headroom", equalTo(5000));

            given().when()
                    .get("/session-keys/" + sessionKeyId + "/executions")
                    .then()
                    .statusCode(200)
                    .body("$", hasSize(2))
                    .body("outcome", equalTo(List.of("ADMITTED", "ADMITTED")));
        }

        @Test
        @DisplayName("should reject the whole operation when the total exceeds the budget")
        void shouldRejectTotalOverBudget() {
            var sessionKeyId = activeSessionKey();
            authorize(sessionKeyId, "transfer", 5000).statusCode(200);

            authorizeAll(
                            sessionKeyId,
                            """
                            [{"action": "swap", "amount": 3000}, {"action": "transfer", "amount": 3000}]
                            """)
                    .statusCode(403)
                    .body("admitted", equalTo(false))
                    .body("reason", equalTo("SPENDING_LIMIT_EXCEEDED"))
                    .body("headroom", equalTo(5000))
                    .body("step", nullValue());

            given().when()
                    .get("/session-keys/" + sessionKeyId)
                    .then()
                    .statusCode(200)
                    .body("spendingUsed", equalTo(5000));
        }

        @Test
        @DisplayName("should name the step that failed its own checks")
        void shouldReportFailingStep() {
            var sessionKeyId = activeSessionKey();

            authorizeAll(
                            sessionKeyId,
                            """
                            [{"action": "transfer", "amount": 100}, {"action": "bridge", "amount": 100}]
                            """)
                    .statusCode(403)
                    .body("reason", equalTo("ACTION_NOT_PERMITTED"))
                    .body("step", equalTo(1));
        }

        @Test
        @DisplayName("should require at least one complete step")
        void shouldRequireSteps() {
            authorizeAll("any", "[]").statusCode(400);
            authorizeAll("any", "[{\"action\": \"transfer\"}]").statusCode(400);
        }
    }

    @Nested
    @DisplayName("Revocation")
    class RevocationTests {

        @Test
        @DisplayName("should revoke and stop authorizing")
        void shouldRevoke() {
            var sessionKeyId = activeSessionKey();

            given().contentType(ContentType.JSON)
                    .body("{\"reason\": \"lost device\"}")
                    .when()
                    .delete("/session-keys/" + sessionKeyId)
                    .then()
                    .statusCode(200)
                    .body("status", equalTo("REVOKED"))
                    .body("statusReason", equalTo("lost device"));

            given().contentType(ContentType.JSON)
                    .body("{}")
                    .when()
                    .delete("/session-keys/" + sessionKeyId)
                    .then()
                    .statusCode(200)
                    .body("statusReason", equalTo("lost device"));

            authorize(sessionKeyId, "transfer", 1).statusCode(403).body("reason", equalTo("INACTIVE"));
        }

        @Test
        @DisplayName("should return 404 for unknown session keys")
        void shouldRejectUnknown() {
            given().contentType(ContentType.JSON)
                    .body("{}")
                    .when()
                    .delete("/session-keys/no-such-key")
                    .then()
                    .statusCode(404);
            given().when().get("/session-keys/no-such-key").then().statusCode(404);
        }

        @Test
        @DisplayName("should supersede the wallet's previous session key")
        void shouldSupersede() {
            var first = activeSessionKey();
            var second = activeSessionKey();

            given().queryParam("walletId", walletId)
                    .when()
                    .get("/session-keys")
                    .then()
                    .statusCode(200)
                    .body("$", hasSize(2))
                    .body("find { it.sessionKeyId == '%s' }.status".formatted(first), equalTo("REVOKED"))
                    .body("find { it.sessionKeyId == '%s' }.statusReason".formatted(first), equalTo("superseded"))
                    .body("find { it.sessionKeyId == '%s' }.status".formatted(second), equalTo("ACTIVE"));
        }
    }

    @Nested
    @DisplayName("Renewal")
    class RenewalTests {

        @Test
        @DisplayName("should start a renewal and refuse a second one")
        void shouldStartRenewal() {
            var sessionKeyId = activeSessionKey();

            given().when()
                    .post("/session-keys/" + sessionKeyId + "/renewals")
                    .then()
                    .statusCode(202)
                    .body("sessionKeyId", equalTo(sessionKeyId))
                    .body("challengeId", notNullValue());

            given().when()
                    .post("/session-keys/" + sessionKeyId + "/renewals")
                    .then()
                    .statusCode(409)
                    .body("error", equalTo("RENEWAL_IN_PROGRESS"));

            given().when()
                    .get("/session-keys/" + sessionKeyId)
                    .then()
                    .statusCode(200)
                    .body("status", equalTo("RENEWING"));
        }
    }

    @Nested
    @DisplayName("Ledger")
    class LedgerTests {

        @Test
        @DisplayName("should list session and wallet ledgers")
        void shouldListLedgers() {
            var sessionKeyId = activeSessionKey();
            authorize(sessionKeyId, "transfer", 100).statusCode(200);
            authorize(sessionKeyId, "bridge", 100).statusCode(403);

            given().when()
                    .get("/session-keys/" + sessionKeyId + "/executions")
                    .then()
                    .statusCode(200)
                    .body("$", hasSize(2))
                    .body("[0].outcome", equalTo("ADMITTED"))
                    .body("[1].reason", equalTo("ACTION_NOT_PERMITTED"));

            given().queryParam("limit", 1)
                    .when()
                    .get("/wallets/" + walletId + "/executions")
                    .then()
                    .statusCode(200)
                    .body("$", hasSize(1))
                    .body("[0].outcome", equalTo("REJECTED"));
        }
    }

    @Nested
    @DisplayName("User ledger")
    class UserLedgerTests {

        @Test
        @DisplayName("should list a user's entries across wallets")
        void shouldListUserLedger() {
            var userId = "user-" + UUID.randomUUID();
            var first = create(
                    """
                    {"walletId": "%s", "userId": "%s", "agentType": "test-agent"}
                    """
                            .formatted(walletId, userId));
            confirm(first.getString("challengeId"));
            var second = create(
                    """
                    {"walletId": "%s-other", "userId": "%s", "agentType": "test-agent"}
                    """
                            .formatted(walletId, userId));
            confirm(second.getString("challengeId"));
            authorize(first.getString("sessionKeyId"), "transfer", 100).statusCode(200);
            authorize(second.getString("sessionKeyId"), "swap", 200).statusCode(200);

            given().when()
                    .get("/users/" + userId + "/executions")
                    .then()
                    .statusCode(200)
                    .body("$", hasSize(2))
                    .body("[0].amount", equalTo(200))
                    .body("[1].amount", equalTo(100));

            given().queryParam("limit", 1)
                    .when()
                    .get("/users/" + userId + "/executions")
                    .then()
                    .statusCode(200)
                    .body("$", hasSize(1))
                    .body("[0].walletId", equalTo(walletId + "-other"));
        }
    }

    @Nested
    @DisplayName("Catalog")
    class CatalogTests {

        @Test
        @DisplayName("should list configured and built-in agents")
        void shouldListAgents() {
            given().when()
                    .get("/agents")
                    .then()
                    .statusCode(200)
                    .body("agentType", hasItem("test-agent"))
                    .body("agentType", hasItem("payments"));
        }

        @Test
        @DisplayName("should read a single agent and 404 on unknown ones")
        void shouldReadAgent() {
            given().when()
                    .get("/agents/test-agent")
                    .then()
                    .statusCode(200)
                    .body("displayName", equalTo("Test Agent"))
                    .body("spendingLimit", equalTo(10000));

            given().when().get("/agents/no-such-agent").then().statusCode(404);
        }
    }

    @Nested
    @DisplayName("Health")
    class HealthTests {

        @Test
        @DisplayName("should report the storage provider as ready")
        void shouldBeReady() {
            given().when()
                    .get("/q/health/ready")
                    .then()
                    .statusCode(200)
                    .body("checks.name", hasItem("session-key-storage-memory"));
        }
    }
}
