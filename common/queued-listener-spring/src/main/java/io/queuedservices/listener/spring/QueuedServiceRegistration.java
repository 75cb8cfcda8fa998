package io.queuedservices.listener.spring;

import io.queuedservices.listener.endpoint.EndpointBehavior;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Declares a service object to expose over the queued transport. Each registration bean becomes one
 * listener managed by {@link QueuedListenerLifecycle}.
 *
 * @param contract          service contract interface
 * @param serviceObject     implementation of the contract
 * @param queueNameProvider optional queue name override, {@code null} for the contract's simple name
 * @param behaviors         caller behaviors, applied after authentication in this order
 * @param <C>               service contract type
 */
public record QueuedServiceRegistration<C>(
    Class<C> contract,
    C serviceObject,
    Supplier<String> queueNameProvider,
    List<EndpointBehavior> behaviors
) {

    public QueuedServiceRegistration {
        Objects.requireNonNull(contract, "contract");
        Objects.requireNonNull(serviceObject, "serviceObject");
        behaviors = behaviors == null ? List.of() : List.copyOf(behaviors);
    }

    public static <C> QueuedServiceRegistration<C> of(Class<C> contract, C serviceObject) {
        return new QueuedServiceRegistration<>(contract, serviceObject, null, List.of());
    }

    public QueuedServiceRegistration<C> withQueueName(String queueName) {
        return new QueuedServiceRegistration<>(contract, serviceObject, () -> queueName, behaviors);
    }

    public QueuedServiceRegistration<C> withBehaviors(List<EndpointBehavior> replacement) {
        return new QueuedServiceRegistration<>(contract, serviceObject, queueNameProvider, replacement);
    }
}
