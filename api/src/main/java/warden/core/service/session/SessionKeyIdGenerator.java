package warden.core.service.session;

import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generate cryptographically secure identifiers for session keys, challenges and ledger entries.
 *
 * <p>Identifiers are 32 bytes (256 bits) of random data encoded as
 * URL-safe Base64, so they cannot be guessed from one another.
 */
@ApplicationScoped
public class SessionKeyIdGenerator {

    private static final int ID_BYTES = 32; // 256 bits
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    /**
     * Generate a new identifier.
     *
     * @return A URL-safe Base64 encoded identifier (43 characters)
     */
    public String generate() {
        byte[] bytes = new byte[ID_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }
}
