package in.kinship.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.kinship.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * HS256 bearer tokens carrying the user id ({@code sub}) and display name ({@code name}).
 *
 * Session issuance lives elsewhere; this service mints tokens for that layer and validates them
 * for the live-event and messaging endpoints.
 */
public final class JwtService {
    private static final Logger log = LoggerFactory.getLogger(JwtService.class);
    private static final ObjectMapper MAPPER = Json.newMapper();
    private static final String HEADER = base64Encode("{\"alg\":\"HS256\",\"typ\":\"JWT\"}");

    private final String secret;
    private final long expirationMs;

    public JwtService(String secret, long expirationMs) {
        this.secret = secret;
        this.expirationMs = expirationMs;
    }

    /**
     * Generate a token for a user.
     */
    public String generateToken(String userId, String displayName) {
        long now = System.currentTimeMillis();
        ObjectNode claims = MAPPER.createObjectNode();
        claims.put("sub", userId);
        claims.put("name", displayName);
        claims.put("iat", now / 1000);
        claims.put("exp", (now + expirationMs) / 1000);

        String payload = base64Encode(claims.toString());
        return HEADER + "." + payload + "." + sign(HEADER + "." + payload);
    }

    /**
     * Verify signature and expiry. Returns null for any invalid token.
     */
    public TokenClaims verify(String token) {
        if (token == null || token.isEmpty()) {
            return null;
        }
        if (token.startsWith("Bearer ")) {
            token = token.substring(7);
        }

        try {
            String[] parts = token.split("\\.");
            if (parts.length != 3) {
                log.debug("Invalid token format");
                return null;
            }

            String expectedSig = sign(parts[0] + "." + parts[1]);
            if (!MessageDigest.isEqual(expectedSig.getBytes(StandardCharsets.US_ASCII),
                                       parts[2].getBytes(StandardCharsets.US_ASCII))) {
                log.debug("Invalid token signature");
                return null;
            }

            JsonNode payload = MAPPER.readTree(base64Decode(parts[1]));
            String sub = payload.path("sub").asText(null);
            if (sub == null || sub.isEmpty() || !payload.hasNonNull("exp")) {
                log.debug("Missing required claims");
                return null;
            }

            TokenClaims claims = new TokenClaims(
                sub,
                payload.path("name").asText(sub),
                payload.path("iat").asLong(0) * 1000,
                payload.path("exp").asLong() * 1000
            );
            if (claims.isExpired()) {
                log.debug("Token expired");
                return null;
            }
            return claims;

        } catch (Exception e) {
            log.debug("Token validation error: {}", e.getMessage());
            return null;
        }
    }

    private String sign(String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to sign JWT", e);
        }
    }

    private static String base64Encode(String data) {
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(data.getBytes(StandardCharsets.UTF_8));
    }

    private static String base64Decode(String data) {
        return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
    }

    /**
     * Token claims record.
     */
    public record TokenClaims(
        String userId,
        String displayName,
        long issuedAt,
        long expiresAt
    ) {
        public boolean isExpired() {
            return System.currentTimeMillis() > expiresAt;
        }
    }
}
