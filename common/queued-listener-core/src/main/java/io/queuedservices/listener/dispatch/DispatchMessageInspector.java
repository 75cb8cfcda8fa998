package io.queuedservices.listener.dispatch;

/**
 * Observes requests after they are received and replies before they are sent.
 */
public interface DispatchMessageInspector {

    /**
     * Called for every request before any interceptor runs. Throwing rejects the message.
     */
    void afterReceiveRequest(InboundMessage request);

    /**
     * Called with the operation result before it is serialized. {@code reply} is {@code null} for
     * one-way operations.
     */
    default void beforeSendReply(InboundMessage request, Object reply) {
        // no-op
    }
}
