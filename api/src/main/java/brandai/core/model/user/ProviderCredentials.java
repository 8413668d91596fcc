package brandai.core.model.user;

import java.time.Instant;

/**
 * Encrypted GitHub credential material ready to be stored on a user account.
 *
 * <p>Both token fields hold ciphertext, never the raw provider token.
 *
 * @param encryptedAccessToken  encrypted access token
 * @param expiresAt             access token expiry, null when GitHub reports none
 * @param encryptedRefreshToken encrypted refresh token, null when GitHub issued none
 */
public record ProviderCredentials(String encryptedAccessToken, Instant expiresAt, String encryptedRefreshToken) {

    public ProviderCredentials {
        if (encryptedAccessToken == null || encryptedAccessToken.isBlank()) {
            throw new IllegalArgumentException("Encrypted access token cannot be null or blank");
        }
    }
}
