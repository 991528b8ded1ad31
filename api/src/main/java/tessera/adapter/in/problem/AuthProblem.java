package tessera.adapter.in.problem;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * RFC 7807 problem raised by the auth endpoints.
 *
 * <p>Login and refresh failures deliberately carry the same generic detail
 * whatever the internal reason.
 */
public class AuthProblem extends RuntimeException {

    public static final String PROBLEM_JSON = "application/problem+json";

    private final Status status;
    private final String title;
    private final Duration retryAfter;

    private AuthProblem(Status status, String title, String detail, Duration retryAfter) {
        super(detail, null, false, false);
        this.status = status;
        this.title = title;
        this.retryAfter = retryAfter;
    }

    public static AuthProblem invalidCredentials() {
        return new AuthProblem(Status.UNAUTHORIZED, "Unauthorized", "Invalid credentials", null);
    }

    public static AuthProblem invalidSession() {
        return new AuthProblem(Status.UNAUTHORIZED, "Unauthorized", "Invalid session", null);
    }

    public static AuthProblem tooManyAttempts(Duration retryAfter) {
        return new AuthProblem(
                Status.TOO_MANY_REQUESTS, "Too Many Requests", "Too many failed login attempts", retryAfter);
    }

    public static AuthProblem badRequest(String detail) {
        return new AuthProblem(Status.BAD_REQUEST, "Bad Request", detail, null);
    }

    public static AuthProblem serviceUnavailable(String detail) {
        return new AuthProblem(Status.SERVICE_UNAVAILABLE, "Service Unavailable", detail, null);
    }

    public static AuthProblem internalError() {
        return new AuthProblem(Status.INTERNAL_SERVER_ERROR, "Internal Server Error", "Internal error", null);
    }

    public Status getStatus() {
        return status;
    }

    public String getTitle() {
        return title;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    /**
     * Problem members: {@code title}, {@code status} and {@code detail}.
     */
    public Map<String, Object> body() {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("title", title);
        body.put("status", status.getStatusCode());
        body.put("detail", getMessage());
        return body;
    }

    /**
     * Build the {@code application/problem+json} response.
     *
     * <p>The body is written as a JSON string so that no message body writer
     * for the problem media type is needed.
     *
     * @throws IllegalStateException if the body cannot be serialized
     */
    public Response toResponse(ObjectMapper objectMapper) {
        final String json;
        try {
            json = objectMapper.writeValueAsString(body());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize problem body", e);
        }

        final var builder = Response.status(status).type(PROBLEM_JSON).entity(json);
        if (retryAfter != null) {
            builder.header("Retry-After", Math.max(1, retryAfter.toSeconds()));
        }
        return builder.build();
    }
}
