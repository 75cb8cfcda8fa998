package io.queuedservices.listener.auth;

/**
 * Issues access tokens for messaging-fabric resources.
 */
public interface TokenProvider {

    /**
     * Identity presented alongside the token, for transports that separate user name and secret.
     */
    String identity();

    /**
     * Returns a token valid for {@code audience}. Implementations may return a cached token while it
     * remains valid.
     */
    SecurityToken getToken(String audience);
}
