package io.queuedservices.listener.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Access token issued for a single audience.
 *
 * @param token     token string presented to the messaging fabric
 * @param audience  resource the token grants access to
 * @param expiresAt instant after which the fabric rejects the token
 */
public record SecurityToken(String token, String audience, Instant expiresAt) {

    public SecurityToken {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(audience, "audience");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "SecurityToken[audience=" + audience + ", expiresAt=" + expiresAt + "]";
    }
}
