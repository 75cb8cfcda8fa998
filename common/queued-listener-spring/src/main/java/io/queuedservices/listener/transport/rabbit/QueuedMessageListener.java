package io.queuedservices.listener.transport.rabbit;

import io.queuedservices.listener.dispatch.EndpointDispatcher;
import io.queuedservices.listener.dispatch.InboundMessage;
import io.queuedservices.listener.dispatch.ServiceContractInvoker;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageListener;
import org.springframework.amqp.rabbit.core.RabbitOperations;
import org.springframework.amqp.rabbit.support.ListenerExecutionFailedException;

/**
 * Container-facing listener of one queued endpoint: converts each delivery, runs it through the
 * endpoint dispatcher and publishes non-null results to the request's reply queue.
 */
final class QueuedMessageListener implements MessageListener {

    private static final Logger log = LoggerFactory.getLogger(QueuedMessageListener.class);

    private final String queueName;
    private final EndpointDispatcher dispatcher;
    private final ServiceContractInvoker<?> invoker;
    private final RabbitInboundMessageConverter converter;
    private final RabbitOperations replies;
    private final int maxReceivedMessageSize;

    QueuedMessageListener(String queueName,
                          EndpointDispatcher dispatcher,
                          ServiceContractInvoker<?> invoker,
                          RabbitInboundMessageConverter converter,
                          RabbitOperations replies,
                          int maxReceivedMessageSize) {
        this.queueName = Objects.requireNonNull(queueName, "queueName");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.replies = Objects.requireNonNull(replies, "replies");
        this.maxReceivedMessageSize = maxReceivedMessageSize;
    }

    @Override
    public void onMessage(Message message) {
        InboundMessage request = accept(message);
        Object result;
        try {
            result = dispatcher.dispatch(request, invoker);
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new ListenerExecutionFailedException("Operation " + request.operation() + " failed", ex, message);
        }
        if (result != null && request.expectsReply()) {
            reply(request, result, message);
        }
    }

    private InboundMessage accept(Message message) {
        int size = message.getBody() == null ? 0 : message.getBody().length;
        if (size > maxReceivedMessageSize) {
            log.warn("Rejecting message {} on queue {}: {} bytes exceeds limit of {}",
                message.getMessageProperties().getMessageId(), queueName, size, maxReceivedMessageSize);
            throw new MessageRejectedException("Message of " + size + " bytes exceeds maxReceivedMessageSize "
                + maxReceivedMessageSize);
        }
        InboundMessage request;
        try {
            request = converter.fromMessage(message);
        } catch (IllegalArgumentException ex) {
            log.warn("Rejecting message {} on queue {}: {}",
                message.getMessageProperties().getMessageId(), queueName, ex.getMessage());
            throw new MessageRejectedException(ex.getMessage(), ex);
        }
        if (!invoker.operationNames().contains(request.operation())) {
            log.warn("Rejecting message {} on queue {}: unknown operation {}",
                request.messageId(), queueName, request.operation());
            throw new MessageRejectedException("Operation '" + request.operation() + "' is not defined by "
                + invoker.contract().getSimpleName());
        }
        return request;
    }

    private void reply(InboundMessage request, Object result, Message message) {
        Message reply;
        try {
            reply = converter.toReply(request, result);
        } catch (Exception ex) {
            throw new ListenerExecutionFailedException("Failed to serialize reply of " + request.operation(), ex, message);
        }
        replies.send("", request.replyTo(), reply);
        log.debug("Replied to {} for operation {} (correlationId={})",
            request.replyTo(), request.operation(), reply.getMessageProperties().getCorrelationId());
    }
}
