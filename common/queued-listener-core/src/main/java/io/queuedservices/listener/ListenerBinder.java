package io.queuedservices.listener;

import io.queuedservices.listener.address.ConnectionDescriptor;
import io.queuedservices.listener.address.QueueAddress;
import io.queuedservices.listener.auth.SharedAccessSignatureTokenProvider;
import io.queuedservices.listener.auth.TransportClientEndpointBehavior;
import io.queuedservices.listener.endpoint.EndpointBehavior;
import io.queuedservices.listener.endpoint.EndpointBehaviors;
import io.queuedservices.listener.host.ActivationContext;
import io.queuedservices.listener.transport.BindingPolicy;
import io.queuedservices.listener.transport.ListenerBinding;
import io.queuedservices.listener.transport.TransportListener;
import io.queuedservices.listener.transport.TransportListenerFactory;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the transport listener for a service object and attaches its behaviors: the authentication
 * behavior first, then the caller's behaviors in their original order.
 */
public final class ListenerBinder {

    private static final Logger log = LoggerFactory.getLogger(ListenerBinder.class);

    private final TransportListenerFactory transportFactory;

    public ListenerBinder(TransportListenerFactory transportFactory) {
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
    }

    /**
     * @throws QueuedListenerException {@code MISSING_CREDENTIAL} when the descriptor has no key name or key
     */
    public <C> TransportListener bind(Class<C> contract,
                                      C serviceObject,
                                      ActivationContext context,
                                      ConnectionDescriptor descriptor,
                                      QueueAddress address,
                                      BindingPolicy binding,
                                      List<? extends EndpointBehavior> behaviors) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(behaviors, "behaviors");
        TransportClientEndpointBehavior authentication = authenticationBehavior(descriptor);

        TransportListener listener = transportFactory.create(
            new ListenerBinding<>(contract, serviceObject, context, address, binding, endpointHost(descriptor),
                descriptor.runtimePort()));
        EndpointBehaviors endpointBehaviors = listener.endpoint().behaviors();
        endpointBehaviors.add(authentication);
        endpointBehaviors.addAll(behaviors);
        log.debug("Bound {} to {} with {} behavior(s)", contract.getSimpleName(), address, endpointBehaviors.size());
        return listener;
    }

    private static String endpointHost(ConnectionDescriptor descriptor) {
        return descriptor.endpoints().isEmpty() ? null : descriptor.endpoints().get(0).getHost();
    }

    static TransportClientEndpointBehavior authenticationBehavior(ConnectionDescriptor descriptor) {
        String keyName = descriptor.sharedAccessKeyName();
        if (keyName == null || keyName.isBlank()) {
            throw new QueuedListenerException(ErrorCode.MISSING_CREDENTIAL,
                "Connection string does not specify SharedAccessKeyName");
        }
        String key = descriptor.sharedAccessKey();
        if (key == null || key.isEmpty()) {
            throw new QueuedListenerException(ErrorCode.MISSING_CREDENTIAL,
                "Connection string does not specify SharedAccessKey");
        }
        return new TransportClientEndpointBehavior(new SharedAccessSignatureTokenProvider(keyName, key));
    }
}
