package brandai.core.model.auth;

import java.time.Instant;

/**
 * Verified claims of a BrandAI session token.
 *
 * @param subject   local user id
 * @param issuedAt  when the token was issued
 * @param expiresAt when the token stops being accepted
 */
public record SessionClaims(String subject, Instant issuedAt, Instant expiresAt) {

    public SessionClaims {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (issuedAt != null && expiresAt != null && !expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("Expiry must be after issued-at");
        }
    }
}
