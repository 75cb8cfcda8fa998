package io.queuedservices.listener.transport.rabbit;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.queuedservices.listener.transport.ListenerBinding;
import io.queuedservices.listener.transport.TransportListener;
import io.queuedservices.listener.transport.TransportListenerFactory;
import java.util.Objects;

/**
 * Creates {@link RabbitQueuedTransportListener}s. No connection is made until a listener opens.
 */
public final class RabbitTransportListenerFactory implements TransportListenerFactory {

    private final ObjectMapper objectMapper;

    public RabbitTransportListenerFactory(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public <C> TransportListener create(ListenerBinding<C> binding) {
        return new RabbitQueuedTransportListener<>(binding, objectMapper);
    }
}
