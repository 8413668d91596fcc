package brandai.core.service.auth;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import brandai.core.config.EncryptionConfig;
import brandai.core.exception.EncryptionException;

/**
 * Encryption of GitHub tokens at rest.
 *
 * <p>Uses AES-256-GCM with a random IV per operation. The key is derived once,
 * at construction, from the configured master secret with PBKDF2-HMAC-SHA256.
 *
 * <h2>Format</h2>
 * <pre>
 * base64url( version(1) || iv(12) || ciphertext+tag )
 * </pre>
 *
 * <p>When no master secret is configured the service still starts, but every
 * encrypt and decrypt fails with {@link EncryptionException}.
 */
@ApplicationScoped
public class TokenCipher {

    private static final Logger LOG = Logger.getLogger(TokenCipher.class);

    static final byte FORMAT_VERSION = 1;
    public static final int MIN_ITERATIONS = 100_000;

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final byte[] SALT = "brandai_github_token_salt".getBytes(StandardCharsets.UTF_8);
    private static final int KEY_LENGTH_BITS = 256;
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;

    private final SecretKey secretKey;
    private final SecureRandom secureRandom;

    @Inject
    public TokenCipher(EncryptionConfig config) {
        this(config.secret(), config.iterations());
    }

    /**
     * Constructor for manual instantiation.
     *
     * @param masterSecret optional master secret
     * @param iterations   PBKDF2 iterations, at least 100000
     */
    public TokenCipher(Optional<String> masterSecret, int iterations) {
        if (iterations < MIN_ITERATIONS) {
            throw new IllegalArgumentException(
                    "PBKDF2 iterations must be at least " + MIN_ITERATIONS + ". Got: " + iterations);
        }
        this.secureRandom = new SecureRandom();

        if (masterSecret.isPresent() && !masterSecret.get().isBlank()) {
            this.secretKey = deriveKey(masterSecret.get(), iterations);
            LOG.info("Token encryption enabled");
        } else {
            this.secretKey = null;
            LOG.warn("Token encryption is NOT configured. Set brandai.encryption.secret (ENCRYPTION_KEY).");
        }
    }

    /**
     * Encrypt a token for storage.
     *
     * @param plaintext the raw token
     * @return URL-safe Base64 ciphertext
     * @throws EncryptionException if no key is configured or encryption fails
     */
    public String encrypt(String plaintext) {
        final SecretKey key = requireKey();
        if (plaintext == null) {
            throw new EncryptionException("Cannot encrypt a null token");
        }

        try {
            final byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            final byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            final ByteBuffer buffer = ByteBuffer.allocate(1 + IV_LENGTH + ciphertext.length);
            buffer.put(FORMAT_VERSION);
            buffer.put(iv);
            buffer.put(ciphertext);

            return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to encrypt token", e);
        }
    }

    /**
     * Decrypt a stored token.
     *
     * @param encrypted URL-safe Base64 ciphertext produced by {@link #encrypt(String)}
     * @return the raw token
     * @throws EncryptionException if no key is configured or the data is corrupt or tampered
     */
    public String decrypt(String encrypted) {
        final SecretKey key = requireKey();
        if (encrypted == null || encrypted.isBlank()) {
            throw new EncryptionException("Cannot decrypt an empty token");
        }

        final byte[] data;
        try {
            data = Base64.getUrlDecoder().decode(encrypted);
        } catch (IllegalArgumentException e) {
            throw new EncryptionException("Encrypted token is not valid Base64", e);
        }
        if (data.length < 1 + IV_LENGTH + TAG_LENGTH_BITS / 8) {
            throw new EncryptionException("Encrypted token is truncated");
        }

        final ByteBuffer buffer = ByteBuffer.wrap(data);
        final byte version = buffer.get();
        if (version != FORMAT_VERSION) {
            throw new EncryptionException("Unsupported encrypted token version: " + version);
        }

        final byte[] iv = new byte[IV_LENGTH];
        buffer.get(iv);
        final byte[] ciphertext = new byte[buffer.remaining()];
        buffer.get(ciphertext);

        try {
            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to decrypt token", e);
        }
    }

    /**
     * Check if a master secret is configured.
     *
     * @return true if encryption is usable
     */
    public boolean isConfigured() {
        return secretKey != null;
    }

    private SecretKey requireKey() {
        if (secretKey == null) {
            throw new EncryptionException("Encryption key is not configured");
        }
        return secretKey;
    }

    private static SecretKey deriveKey(String masterSecret, int iterations) {
        final PBEKeySpec spec = new PBEKeySpec(masterSecret.toCharArray(), SALT, iterations, KEY_LENGTH_BITS);
        try {
            final byte[] keyBytes =
                    SecretKeyFactory.getInstance(KDF_ALGORITHM).generateSecret(spec).getEncoded();
            return new SecretKeySpec(keyBytes, "AES");
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to derive encryption key", e);
        } finally {
            spec.clearPassword();
        }
    }
}
