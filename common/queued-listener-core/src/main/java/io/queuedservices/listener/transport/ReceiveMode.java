package io.queuedservices.listener.transport;

/**
 * Delivery reliability of a queued listener.
 */
public enum ReceiveMode {
    /**
     * Messages are settled only after the operation completes; failures return them to the queue.
     */
    PEEK_LOCK,
    /**
     * Messages are removed from the queue on delivery.
     */
    RECEIVE_AND_DELETE
}
