package io.queuedservices.listener.transport;

/**
 * SPI implemented by queue transports. The returned listener's endpoint starts with an empty behavior
 * collection.
 */
@FunctionalInterface
public interface TransportListenerFactory {

    <C> TransportListener create(ListenerBinding<C> binding);
}
