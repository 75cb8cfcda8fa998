package io.queuedservices.listener.dispatch;

/**
 * Terminal step of the dispatch pipeline: invokes the contract operation named by the message.
 */
@FunctionalInterface
public interface OperationInvoker {

    Object invoke(InboundMessage message) throws Exception;
}
