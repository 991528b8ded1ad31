package tessera.adapter.in.http;

import java.time.Clock;
import java.time.Duration;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;

import tessera.adapter.in.dto.ChangePasswordRequest;
import tessera.adapter.in.dto.LoginRequest;
import tessera.adapter.in.dto.RefreshRequest;
import tessera.adapter.in.dto.TokenResponse;
import tessera.adapter.in.problem.AuthProblem;
import tessera.core.model.auth.AuthError;
import tessera.core.model.auth.Credential;
import tessera.core.model.auth.StrategyKind;
import tessera.core.model.auth.TokenVerificationResult;
import tessera.core.model.session.SessionResult;
import tessera.core.port.in.PasswordManagement;
import tessera.core.port.in.SessionManagement;
import tessera.core.service.token.TokenVerifier;

/**
 * Login, refresh and logout endpoints.
 */
@Path("/auth")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class SessionResource {

    private static final Logger LOG = Logger.getLogger(SessionResource.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final SessionManagement sessions;
    private final PasswordManagement passwords;
    private final TokenVerifier tokenVerifier;
    private final Clock clock;

    @Inject
    public SessionResource(
            SessionManagement sessions, PasswordManagement passwords, TokenVerifier tokenVerifier, Clock clock) {
        this.sessions = sessions;
        this.passwords = passwords;
        this.tokenVerifier = tokenVerifier;
        this.clock = clock;
    }

    @POST
    @Path("/login")
    public Uni<Response> login(LoginRequest body, @Context HttpServerRequest request) {
        if (body == null || body.credential() == null) {
            throw AuthProblem.badRequest("strategy and credential are required");
        }
        final var strategy = StrategyKind.fromConfigName(body.strategy())
                .orElseThrow(() -> AuthProblem.badRequest("Unknown strategy: " + body.strategy()));

        if (strategy == StrategyKind.EXTERNAL_PROVIDER) {
            // assertions are only trusted from a provider integration, never from the client
            LOG.debug("Login refused: provider assertions are not accepted over HTTP");
            throw AuthProblem.invalidCredentials();
        }

        return sessions.login(strategy, toCredential(strategy, body.credential()), clientIp(request))
                .map(result -> toResponse(result, true));
    }

    @POST
    @Path("/refresh")
    public Uni<Response> refresh(RefreshRequest body, @Context HttpServerRequest request) {
        if (body == null || body.refreshToken() == null || body.refreshToken().isBlank()) {
            throw AuthProblem.invalidSession();
        }
        return sessions.refresh(body.refreshToken(), clientIp(request)).map(result -> toResponse(result, false));
    }

    @POST
    @Path("/logout")
    public Uni<Response> logout(RefreshRequest body) {
        if (body == null || body.refreshToken() == null || body.refreshToken().isBlank()) {
            return Uni.createFrom().item(Response.noContent().build());
        }
        return sessions.logout(body.refreshToken()).map(v -> Response.noContent().build());
    }

    @POST
    @Path("/logout-all")
    public Uni<Response> logoutAll(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        final var subjectId = authenticatedSubject(authorization);
        return sessions.logoutAll(subjectId).map(count -> Response.noContent().build());
    }

    @POST
    @Path("/password")
    public Uni<Response> changePassword(
            ChangePasswordRequest body, @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        final var subjectId = authenticatedSubject(authorization);
        if (body == null || body.newPassword() == null || body.newPassword().isEmpty()) {
            throw AuthProblem.badRequest("newPassword is required");
        }
        return passwords.changePassword(subjectId, body.currentPassword(), body.newPassword()).map(changed -> {
            if (!changed) {
                throw AuthProblem.invalidCredentials();
            }
            return Response.noContent().build();
        });
    }

    private Response toResponse(SessionResult result, boolean login) {
        if (result instanceof SessionResult.Issued issued) {
            return Response.ok(TokenResponse.from(issued.tokens(), clock)).build();
        }
        final var failed = (SessionResult.Failed) result;
        LOG.debugv("{0} failed: {1}", login ? "Login" : "Refresh", failed.error().code());
        if (failed.error() == AuthError.LOCKED_OUT) {
            final var retryAfter = failed.retryAfter() != null
                    ? Duration.between(clock.instant(), failed.retryAfter())
                    : Duration.ofSeconds(1);
            throw AuthProblem.tooManyAttempts(retryAfter);
        }
        throw login ? AuthProblem.invalidCredentials() : AuthProblem.invalidSession();
    }

    private String authenticatedSubject(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw AuthProblem.invalidCredentials();
        }
        final var result = tokenVerifier.verify(authorization.substring(BEARER_PREFIX.length()).trim());
        if (result instanceof TokenVerificationResult.Valid valid) {
            return valid.subject();
        }
        throw AuthProblem.invalidCredentials();
    }

    private static Credential toCredential(StrategyKind strategy, LoginRequest.CredentialDto dto) {
        return switch (strategy) {
            case LOCAL_PASSWORD -> new Credential.Password(dto.identifier(), dto.password());
            case BEARER_TOKEN -> new Credential.PresentedToken(dto.token());
            case EXTERNAL_PROVIDER -> throw AuthProblem.invalidCredentials();
        };
    }

    private static String clientIp(HttpServerRequest request) {
        if (request == null || request.remoteAddress() == null) {
            return null;
        }
        return request.remoteAddress().host();
    }
}
