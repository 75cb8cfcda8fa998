package io.queuedservices.listener.transport;

import io.queuedservices.listener.address.QueueAddress;
import io.queuedservices.listener.host.ActivationContext;
import java.util.Objects;

/**
 * Everything a {@link TransportListenerFactory} needs to construct a listener.
 *
 * @param contract      service contract interface
 * @param serviceObject implementation of the contract
 * @param context       activation context of the service instance
 * @param address       external address of the listener
 * @param binding       transport configuration
 * @param endpointHost  host of the connection string's endpoint, or {@code null}
 * @param runtimePort   port announced by the connection string, or {@code null}
 * @param <C>           service contract type
 */
public record ListenerBinding<C>(
    Class<C> contract,
    C serviceObject,
    ActivationContext context,
    QueueAddress address,
    BindingPolicy binding,
    String endpointHost,
    Integer runtimePort
) {

    public ListenerBinding {
        Objects.requireNonNull(contract, "contract");
        Objects.requireNonNull(serviceObject, "serviceObject");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(binding, "binding");
    }

    /**
     * Host to connect to: the connection string's endpoint host when present, otherwise the address host.
     */
    public String host() {
        return endpointHost != null && !endpointHost.isBlank() ? endpointHost : address.host();
    }

    /**
     * Port to connect to: the connection string's runtime port when present, otherwise the binding's.
     */
    public int port() {
        return runtimePort != null ? runtimePort : binding.getPort();
    }
}
