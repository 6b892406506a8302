package in.kinship.transport.http;

/**
 * Identity of an authenticated caller.
 */
public record AuthContext(String userId, String displayName) {
}
