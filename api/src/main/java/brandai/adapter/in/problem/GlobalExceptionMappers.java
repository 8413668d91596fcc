package brandai.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import brandai.core.exception.BrandAiException;

/**
 * Global exception mappers converting exceptions to RFC 7807 Problem Details.
 *
 * <p>Server-side kinds (5xx) are logged at ERROR, client-side kinds at DEBUG.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapBrandAiException(BrandAiException e) {
        if (e.kind().httpStatus() >= 500) {
            LOG.errorf(e, "%s: %s", e.kind(), e.getMessage());
        } else {
            LOG.debugf("%s: %s", e.kind(), e.getMessage());
        }
        return toResponse(ApiProblem.from(e));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(ApiProblem.validationError(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalStateException(IllegalStateException e) {
        LOG.errorf(e, "Unexpected state: %s", e.getMessage());
        return toResponse(ApiProblem.internalError("Unexpected server state"));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
