package brandai.adapter.in.rest;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import brandai.core.exception.InvalidTokenException;

/**
 * Parsing helpers shared by the REST resources.
 */
final class RequestParams {

    private static final String BEARER_PREFIX = "Bearer ";

    private RequestParams() {
        // Utility class
    }

    /**
     * Extract the token from an {@code Authorization: Bearer ...} header.
     *
     * @throws InvalidTokenException if the header is missing or not a bearer header
     */
    static String bearerToken(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new InvalidTokenException("Missing bearer token");
        }
        final String token = authorization.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new InvalidTokenException("Missing bearer token");
        }
        return token;
    }

    /**
     * Parse an ISO-8601 date-time query parameter. Values without an offset are read as UTC;
     * a plain date means the start of that day.
     *
     * @throws IllegalArgumentException if the value cannot be parsed
     */
    static Optional<Instant> instant(String value, String name) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException ignored) {
            // fall through to offset-less forms
        }
        try {
            return Optional.of(LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            // fall through to date-only form
        }
        try {
            return Optional.of(LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + name + ": expected an ISO-8601 date-time", e);
        }
    }
}
