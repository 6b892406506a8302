package in.kinship.transport.http;

import in.kinship.auth.JwtService;
import io.undertow.server.HttpServerExchange;

import java.util.Deque;

/**
 * Resolves the caller from {@code Authorization: Bearer <jwt>} or, for clients that cannot set
 * headers (EventSource), from the {@code token} query parameter.
 */
public final class Authenticator {

    private final JwtService jwtService;

    public Authenticator(JwtService jwtService) {
        this.jwtService = jwtService;
    }

    /**
     * @return the caller, or null if the request carries no valid token
     */
    public AuthContext authenticate(HttpServerExchange exchange) {
        String authHeader = exchange.getRequestHeaders().getFirst("Authorization");
        String token;
        if (authHeader == null) {
            Deque<String> tokenParam = exchange.getQueryParameters().get("token");
            if (tokenParam == null || tokenParam.isEmpty()) {
                return null;
            }
            token = tokenParam.peekFirst();
        } else if (authHeader.startsWith("Bearer ")) {
            token = authHeader.substring(7);
        } else {
            return null;
        }

        JwtService.TokenClaims claims = jwtService.verify(token);
        if (claims == null) {
            return null;
        }
        return new AuthContext(claims.userId(), claims.displayName());
    }
}
