package warden.adapter.in.problem;

import java.util.Locale;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import warden.core.model.session.SessionKeyError;

/**
 * RFC 7807 Problem Details factory for session key errors.
 *
 * <p>Provides static factory methods that create {@link HttpProblem} instances
 * from quarkus-resteasy-problem for consistent error responses across all
 * endpoints.
 */
public final class WardenProblem {

    private WardenProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Not Found Errors ==========

    public static HttpProblem resourceNotFound(String resourceType, String resourceId) {
        return HttpProblem.builder()
                .withTitle("%s Not Found".formatted(resourceType))
                .withStatus(Status.NOT_FOUND)
                .withDetail("%s not found: %s".formatted(resourceType, resourceId))
                .build();
    }

    // ========== Bad Request Errors ==========

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    // ========== Session Key Errors ==========

    /**
     * Create a problem for a refused session key operation.
     *
     * <p>The {@code error} extension carries the {@link SessionKeyError} name and
     * {@code retryable} tells the client whether repeating the same request may succeed.
     *
     * @param error the refusal reason
     * @param detail the error detail message
     * @return session key problem
     */
    public static HttpProblem sessionKeyError(SessionKeyError error, String detail) {
        return HttpProblem.builder()
                .withTitle(titleFor(error))
                .withStatus(statusFor(error))
                .withDetail(detail)
                .with("error", error.name())
                .with("retryable", error.retryable())
                .build();
    }

    /**
     * HTTP status for a session key error.
     *
     * <ul>
     *   <li>404 - NOT_FOUND</li>
     *   <li>503 - retryable errors (contention, challenge failure, store unavailable)</li>
     *   <li>400 - invalid overrides and amounts</li>
     *   <li>409 - renewal already in progress</li>
     *   <li>403 - every other refusal</li>
     * </ul>
     */
    public static Status statusFor(SessionKeyError error) {
        if (error == SessionKeyError.NOT_FOUND) {
            return Status.NOT_FOUND;
        }
        if (error.retryable()) {
            return Status.SERVICE_UNAVAILABLE;
        }
        return switch (error) {
            case INVALID_OVERRIDE, INVALID_AMOUNT -> Status.BAD_REQUEST;
            case RENEWAL_IN_PROGRESS -> Status.CONFLICT;
            default -> Status.FORBIDDEN;
        };
    }

    private static String titleFor(SessionKeyError error) {
        var words = error.name().toLowerCase(Locale.ROOT).split("_");
        var title = new StringBuilder();
        for (var word : words) {
            if (!title.isEmpty()) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return title.toString();
    }
}
