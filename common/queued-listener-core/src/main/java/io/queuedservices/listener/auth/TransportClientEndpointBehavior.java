package io.queuedservices.listener.auth;

import io.queuedservices.listener.endpoint.EndpointBehavior;
import io.queuedservices.listener.endpoint.ServiceEndpoint;
import java.util.Objects;

/**
 * Authentication behavior: carries the {@link TokenProvider} the transport uses to authorize against
 * the messaging fabric.
 */
public final class TransportClientEndpointBehavior implements EndpointBehavior {

    private final TokenProvider tokenProvider;

    public TransportClientEndpointBehavior(TokenProvider tokenProvider) {
        this.tokenProvider = Objects.requireNonNull(tokenProvider, "tokenProvider");
    }

    public TokenProvider tokenProvider() {
        return tokenProvider;
    }

    @Override
    public void validate(ServiceEndpoint endpoint) {
        long count = endpoint.behaviors().asList().stream()
            .filter(TransportClientEndpointBehavior.class::isInstance)
            .count();
        if (count > 1) {
            throw new IllegalStateException("Endpoint " + endpoint.address()
                + " has more than one transport client behavior");
        }
    }

    @Override
    public String toString() {
        return "TransportClientEndpointBehavior[" + tokenProvider + "]";
    }
}
