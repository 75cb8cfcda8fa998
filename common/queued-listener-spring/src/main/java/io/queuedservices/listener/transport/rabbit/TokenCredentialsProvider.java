package io.queuedservices.listener.transport.rabbit;

import com.rabbitmq.client.impl.CredentialsProvider;
import io.queuedservices.listener.auth.SecurityToken;
import io.queuedservices.listener.auth.TokenProvider;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Presents the token provider's identity as user name and a token for {@code audience} as password.
 * The RabbitMQ client asks for the password on every (re)connect, so an expiring token is replaced
 * transparently.
 */
final class TokenCredentialsProvider implements CredentialsProvider {

    private final TokenProvider tokenProvider;
    private final String audience;
    private final Clock clock;

    TokenCredentialsProvider(TokenProvider tokenProvider, String audience) {
        this(tokenProvider, audience, Clock.systemUTC());
    }

    TokenCredentialsProvider(TokenProvider tokenProvider, String audience, Clock clock) {
        this.tokenProvider = Objects.requireNonNull(tokenProvider, "tokenProvider");
        this.audience = Objects.requireNonNull(audience, "audience");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String getUsername() {
        return tokenProvider.identity();
    }

    @Override
    public String getPassword() {
        return tokenProvider.getToken(audience).token();
    }

    @Override
    public Duration getTimeBeforeExpiration() {
        SecurityToken token = tokenProvider.getToken(audience);
        Duration remaining = Duration.between(clock.instant(), token.expiresAt());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
