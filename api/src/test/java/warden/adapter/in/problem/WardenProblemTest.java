package warden.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;

import jakarta.ws.rs.core.Response.Status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import warden.core.model.session.SessionKeyError;

@DisplayName("WardenProblem")
class WardenProblemTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "NOT_FOUND, NOT_FOUND",
        "NOT_YET_ACTIVE, FORBIDDEN",
        "INACTIVE, FORBIDDEN",
        "EXPIRED, FORBIDDEN",
        "ACTION_NOT_PERMITTED, FORBIDDEN",
        "SPENDING_LIMIT_EXCEEDED, FORBIDDEN",
        "RENEWAL_QUOTA_EXHAUSTED, FORBIDDEN",
        "RENEWAL_IN_PROGRESS, CONFLICT",
        "INVALID_OVERRIDE, BAD_REQUEST",
        "INVALID_AMOUNT, BAD_REQUEST",
        "CONTENTION, SERVICE_UNAVAILABLE",
        "CHALLENGE_FAILED, SERVICE_UNAVAILABLE",
        "STORE_UNAVAILABLE, SERVICE_UNAVAILABLE"
    })
    @DisplayName("should map session key errors to HTTP statuses")
    void shouldMapStatus(SessionKeyError error, Status status) {
        assertEquals(status, WardenProblem.statusFor(error));
    }

    @Test
    @DisplayName("should carry the error name and retryability")
    void shouldCarryExtensions() {
        var problem = WardenProblem.sessionKeyError(SessionKeyError.SPENDING_LIMIT_EXCEEDED, "over budget");

        assertEquals(403, problem.getStatusCode());
        assertEquals("Spending Limit Exceeded", problem.getTitle());
        assertEquals("over budget", problem.getDetail());
        assertEquals("SPENDING_LIMIT_EXCEEDED", problem.getParameters().get("error"));
        assertEquals(false, problem.getParameters().get("retryable"));
    }
}
