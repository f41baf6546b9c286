package br.com.marmitas.realtime.application.port.output;

import java.util.Map;
import java.util.Optional;

/**
 * Port for the bearer-token verification service.
 *
 * Invalid, expired or malformed tokens yield an empty result rather than an exception.
 */
public interface TokenVerifier {

    Optional<VerifiedToken> verify(String token);

    /**
     * Claims of a token whose signature and expiry were checked.
     * {@code userId} may be null when the token carries no principal.
     */
    record VerifiedToken(String userId, Map<String, Object> claims) {
        public VerifiedToken {
            claims = claims == null ? Map.of() : Map.copyOf(claims);
        }

        public boolean hasPrincipal() {
            return userId != null && !userId.isBlank();
        }
    }
}
