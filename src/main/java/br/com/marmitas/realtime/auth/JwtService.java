package br.com.marmitas.realtime.auth;

import br.com.marmitas.realtime.application.port.output.TokenVerifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * HS256 access-token service used to verify WebSocket authentication messages.
 *
 * Tokens carry the principal in {@code userId} (falling back to {@code sub}),
 * plus {@code email}, {@code role}, {@code iat}, {@code exp} and a random {@code jti}.
 * Verification never throws: any defect yields an empty result.
 */
public final class JwtService implements TokenVerifier {
    private static final Logger log = LoggerFactory.getLogger(JwtService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {};
    private static final String HEADER = base64Encode("{\"alg\":\"HS256\",\"typ\":\"JWT\"}");

    private final byte[] secret;
    private final long expirationMs;
    private final Clock clock;

    public JwtService(String secret, long expirationMs) {
        this(secret, expirationMs, Clock.systemUTC());
    }

    JwtService(String secret, long expirationMs, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("JWT secret must not be empty");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.expirationMs = expirationMs;
        this.clock = clock;
    }

    /**
     * Generate an access token for a user.
     */
    public String generateToken(String userId, String email, String role) {
        long now = clock.millis();
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("userId", userId);
        claims.put("sub", userId);
        claims.put("email", email);
        claims.put("role", role);
        claims.put("jti", UUID.randomUUID().toString().replace("-", "").substring(0, 16));
        claims.put("iat", now / 1000);
        claims.put("exp", (now + expirationMs) / 1000);
        return generateToken(claims);
    }

    /**
     * Sign an arbitrary claim set. Callers are responsible for {@code exp}.
     */
    public String generateToken(Map<String, Object> claims) {
        try {
            String payload = base64Encode(MAPPER.writeValueAsString(claims));
            return HEADER + "." + payload + "." + sign(HEADER + "." + payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Claims are not serializable", e);
        }
    }

    @Override
    public Optional<VerifiedToken> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }

        // Remove "Bearer " prefix if present
        if (token.startsWith("Bearer ")) {
            token = token.substring(7);
        }

        try {
            String[] parts = token.split("\\.");
            if (parts.length != 3) {
                log.debug("Invalid token format");
                return Optional.empty();
            }

            String expectedSig = sign(parts[0] + "." + parts[1]);
            if (!MessageDigest.isEqual(expectedSig.getBytes(StandardCharsets.US_ASCII),
                    parts[2].getBytes(StandardCharsets.US_ASCII))) {
                log.debug("Invalid token signature");
                return Optional.empty();
            }

            Map<String, Object> claims = MAPPER.readValue(base64Decode(parts[1]), CLAIMS_TYPE);

            Object exp = claims.get("exp");
            if (!(exp instanceof Number)) {
                log.debug("Token has no numeric exp claim");
                return Optional.empty();
            }
            if (clock.millis() > ((Number) exp).longValue() * 1000) {
                log.debug("Token expired");
                return Optional.empty();
            }

            Object principal = claims.containsKey("userId") ? claims.get("userId") : claims.get("sub");
            String userId = principal == null ? null : principal.toString();
            return Optional.of(new VerifiedToken(userId, withoutNulls(claims)));

        } catch (Exception e) {
            log.debug("Token validation error: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String sign(String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to sign JWT", e);
        }
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> claims) {
        Map<String, Object> copy = new LinkedHashMap<>();
        claims.forEach((k, v) -> {
            if (v != null) copy.put(k, v);
        });
        return copy;
    }

    private static String base64Encode(String data) {
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(data.getBytes(StandardCharsets.UTF_8));
    }

    private static String base64Decode(String data) {
        return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
    }
}
