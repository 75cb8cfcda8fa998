package io.queuedservices.listener.endpoint;

import io.queuedservices.listener.address.QueueAddress;
import io.queuedservices.listener.dispatch.EndpointDispatcher;
import io.queuedservices.listener.transport.BindingPolicy;
import java.util.Objects;

/**
 * Runtime description of a listening endpoint: which contract is served, where, over which binding
 * and with which behaviors.
 */
public final class ServiceEndpoint {

    private final Class<?> contract;
    private final QueueAddress address;
    private final BindingPolicy binding;
    private final EndpointBehaviors behaviors = new EndpointBehaviors();

    public ServiceEndpoint(Class<?> contract, QueueAddress address, BindingPolicy binding) {
        this.contract = Objects.requireNonNull(contract, "contract");
        this.address = Objects.requireNonNull(address, "address");
        this.binding = Objects.requireNonNull(binding, "binding");
    }

    public Class<?> contract() {
        return contract;
    }

    public QueueAddress address() {
        return address;
    }

    public BindingPolicy binding() {
        return binding;
    }

    public EndpointBehaviors behaviors() {
        return behaviors;
    }

    /**
     * Validates every behavior, then lets each contribute to a fresh dispatcher, in collection order.
     */
    public EndpointDispatcher buildDispatcher() {
        for (EndpointBehavior behavior : behaviors) {
            behavior.validate(this);
        }
        EndpointDispatcher dispatcher = new EndpointDispatcher();
        for (EndpointBehavior behavior : behaviors) {
            behavior.applyDispatchBehavior(this, dispatcher);
        }
        return dispatcher;
    }

    @Override
    public String toString() {
        return "ServiceEndpoint[contract=" + contract.getSimpleName() + ", address=" + address
            + ", behaviors=" + behaviors.size() + "]";
    }
}
