package dev.repodocs.infrastructure.dashboard;

import dev.repodocs.config.DashboardProperties;
import dev.repodocs.exception.OwnerAuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Verifies the owner identity the dashboard asserts on each request.
 *
 * <p>The dashboard signs the owner id with the shared secret:
 * {@code X-Owner-Signature: sha256=<hex HMAC-SHA256(secret, ownerId)>}. Comparison is constant-time.
 */
@Component
public class OwnerSignatureVerifier {
    private static final Logger log = LoggerFactory.getLogger(OwnerSignatureVerifier.class);
    private static final String PREFIX = "sha256=";

    private final DashboardProperties properties;

    public OwnerSignatureVerifier(DashboardProperties properties) { this.properties = properties; }

    public boolean isValid(String ownerId, String signature) {
        if (ownerId == null || ownerId.isBlank()) return false;
        if (signature == null || !signature.startsWith(PREFIX)) return false;
        String secret = properties.ownerSigningSecret();
        if (secret == null || secret.isBlank()) {
            log.warn("Owner assertion received but no signing secret is configured");
            return false;
        }
        try {
            String expected = PREFIX + sign(secret, ownerId);
            return MessageDigest.isEqual(
                    expected.getBytes(StandardCharsets.UTF_8),
                    signature.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            log.error("HMAC failed", e);
            return false;
        }
    }

    /**
     * Resolves the caller's owner identity. No owner header means an anonymous caller;
     * a header that does not verify is rejected.
     *
     * @throws OwnerAuthenticationException when an owner is asserted but the signature is wrong
     */
    public Optional<String> resolveOwner(String ownerId, String signature) {
        if (ownerId == null || ownerId.isBlank()) return Optional.empty();
        if (!isValid(ownerId, signature)) {
            throw new OwnerAuthenticationException("Invalid owner signature");
        }
        return Optional.of(ownerId);
    }

    static String sign(String secret, String ownerId) throws GeneralSecurityException {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return HexFormat.of().formatHex(mac.doFinal(ownerId.getBytes(StandardCharsets.UTF_8)));
    }
}
