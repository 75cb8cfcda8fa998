package io.queuedservices.listener.transport.rabbit;

/**
 * A message that can never be processed: too large, or not addressed to an operation of the contract.
 */
public class MessageRejectedException extends RuntimeException {

    public MessageRejectedException(String message) {
        super(message);
    }

    public MessageRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
