package io.queuedservices.listener.transport.rabbit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.queuedservices.listener.dispatch.InboundMessage;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

/**
 * Converts between Spring AMQP {@link Message}s and {@link InboundMessage}s, and serializes operation
 * results into reply messages.
 */
public final class RabbitInboundMessageConverter {

    public static final String HEADER_OPERATION = "x-operation";

    private final ObjectMapper objectMapper;

    public RabbitInboundMessageConverter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Reads the operation from the {@value #HEADER_OPERATION} header, falling back to the AMQP
     * {@code type} property.
     *
     * @throws IllegalArgumentException when the message names no operation
     */
    public InboundMessage fromMessage(Message message) {
        Objects.requireNonNull(message, "message");
        MessageProperties properties = message.getMessageProperties();
        Map<String, Object> headers = new LinkedHashMap<>(properties.getHeaders());
        String operation = operationOf(headers.get(HEADER_OPERATION), properties.getType());
        if (operation == null) {
            throw new IllegalArgumentException("Message " + properties.getMessageId()
                + " does not name an operation (" + HEADER_OPERATION + " header or type property)");
        }
        return new InboundMessage(operation, message.getBody(), headers, properties.getMessageId(),
            properties.getCorrelationId(), properties.getReplyTo());
    }

    public Message toReply(InboundMessage request, Object result) throws JsonProcessingException {
        Objects.requireNonNull(request, "request");
        byte[] body = objectMapper.writeValueAsBytes(result);
        MessageProperties properties = new MessageProperties();
        properties.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        properties.setContentEncoding("UTF-8");
        properties.setContentLength(body.length);
        properties.setHeader(HEADER_OPERATION, request.operation());
        if (request.correlationId() != null) {
            properties.setCorrelationId(request.correlationId());
        } else if (request.messageId() != null) {
            properties.setCorrelationId(request.messageId());
        }
        return new Message(body, properties);
    }

    private static String operationOf(Object header, String type) {
        if (header != null && !header.toString().isBlank()) {
            return header.toString().trim();
        }
        if (type != null && !type.isBlank()) {
            return type.trim();
        }
        return null;
    }
}
