package io.queuedservices.listener.transport;

import io.queuedservices.listener.endpoint.ServiceEndpoint;

/**
 * Communication listener handed back to the host. The host opens it after activation and closes or
 * aborts it when the service instance goes away.
 */
public interface TransportListener {

    /**
     * Endpoint served by this listener. Its behavior collection may be extended until {@link #open()}.
     */
    ServiceEndpoint endpoint();

    /**
     * Starts receiving from the queue.
     *
     * @return the address the listener is reachable at
     */
    String open() throws Exception;

    /**
     * Stops receiving gracefully, letting in-flight operations finish.
     */
    void close() throws Exception;

    /**
     * Stops receiving immediately.
     */
    void abort();
}
