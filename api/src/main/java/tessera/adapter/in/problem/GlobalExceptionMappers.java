package tessera.adapter.in.problem;

import java.util.concurrent.RejectedExecutionException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import tessera.core.service.password.PasswordHasher.MalformedHashException;
import tessera.spi.StorageUnavailableException;

/**
 * Maps exceptions escaping the auth endpoints to problem responses.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);

    private final ObjectMapper objectMapper;

    public GlobalExceptionMappers(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @ServerExceptionMapper
    public Response mapAuthProblem(AuthProblem problem) {
        return problem.toResponse(objectMapper);
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return AuthProblem.badRequest(e.getMessage()).toResponse(objectMapper);
    }

    @ServerExceptionMapper
    public Response mapStorageUnavailable(StorageUnavailableException e) {
        LOG.warnv("Storage unavailable during {0}: {1}", e.getOperation(), e.getMessage());
        return AuthProblem.serviceUnavailable("Session storage unavailable").toResponse(objectMapper);
    }

    @ServerExceptionMapper
    public Response mapRejectedExecution(RejectedExecutionException e) {
        LOG.warn("Password hashing pool saturated, rejecting request");
        return AuthProblem.serviceUnavailable("Server busy").toResponse(objectMapper);
    }

    @ServerExceptionMapper
    public Response mapMalformedHash(MalformedHashException e) {
        LOG.error("Stored password hash is corrupt", e);
        return AuthProblem.internalError().toResponse(objectMapper);
    }
}
