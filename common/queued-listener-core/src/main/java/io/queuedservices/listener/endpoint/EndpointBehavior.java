package io.queuedservices.listener.endpoint;

import io.queuedservices.listener.dispatch.EndpointDispatcher;

/**
 * Cross-cutting component attached to a {@link ServiceEndpoint}, such as retry, logging or message
 * inspection. Behaviors are validated and applied in the order of the endpoint's behavior collection
 * when the listener opens.
 */
public interface EndpointBehavior {

    /**
     * Checks that the endpoint satisfies the behavior's requirements.
     *
     * @throws IllegalStateException when the endpoint cannot be used with this behavior
     */
    default void validate(ServiceEndpoint endpoint) {
        // no-op
    }

    /**
     * Contributes inspectors or interceptors to the endpoint's dispatch pipeline.
     */
    default void applyDispatchBehavior(ServiceEndpoint endpoint, EndpointDispatcher dispatcher) {
        // no-op
    }
}
