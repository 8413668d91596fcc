package brandai.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import brandai.core.exception.BrandAiException;
import brandai.core.exception.UpstreamErrorException;

/**
 * RFC 7807 Problem Details factory for BrandAI errors.
 *
 * <p>Every problem raised from a {@link BrandAiException} carries the error kind
 * in an {@code errorKind} extension member.
 */
public final class ApiProblem {

    static final String ERROR_KIND = "errorKind";

    private ApiProblem() {
        // Utility class - prevent instantiation
    }

    public static HttpProblem from(BrandAiException e) {
        final var builder = HttpProblem.builder()
                .withTitle(title(e))
                .withStatus(Status.fromStatusCode(e.kind().httpStatus()))
                .withDetail(e.getMessage())
                .with(ERROR_KIND, e.kind().name());
        if (e instanceof UpstreamErrorException upstream) {
            builder.with("upstreamStatus", upstream.upstreamStatus());
        }
        return builder.build();
    }

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .with(ERROR_KIND, "VALIDATION_ERROR")
                .build();
    }

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }

    private static String title(BrandAiException e) {
        return switch (e.kind()) {
            case CONFIGURATION_ERROR -> "Configuration Error";
            case ENCRYPTION_ERROR -> "Encryption Error";
            case UPSTREAM_AUTH_ERROR -> "GitHub Authentication Failed";
            case UPSTREAM_UNAVAILABLE -> "GitHub Unavailable";
            case UPSTREAM_ERROR -> "GitHub API Error";
            case RATE_LIMITED -> "GitHub Rate Limit Exceeded";
            case INVALID_CREDENTIAL -> "Invalid GitHub Credential";
            case EXPIRED_TOKEN -> "Session Expired";
            case INVALID_TOKEN -> "Invalid Session Token";
            case INVALID_STATE -> "Invalid OAuth State";
            case DEVICE_CODE_EXPIRED -> "Device Code Expired";
            case DEVICE_FLOW_TIMEOUT -> "Device Flow Timed Out";
            case DUPLICATE_ACCOUNT -> "Duplicate Account";
        };
    }
}
