package io.queuedservices.listener.dispatch;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Transport-neutral view of a request taken off the queue.
 *
 * @param operation     contract operation the request targets
 * @param body          serialized request payload
 * @param headers       application headers
 * @param messageId     transport message id, may be {@code null}
 * @param correlationId correlation id to echo on the reply, may be {@code null}
 * @param replyTo       queue that receives the reply, {@code null} for one-way requests
 */
public record InboundMessage(
    String operation,
    byte[] body,
    Map<String, Object> headers,
    String messageId,
    String correlationId,
    String replyTo
) {

    public InboundMessage {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation must not be null or blank");
        }
        body = body == null ? new byte[0] : body;
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public boolean expectsReply() {
        return replyTo != null && !replyTo.isBlank();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public Object header(String name) {
        return headers.get(Objects.requireNonNull(name, "name"));
    }

    public static InboundMessage json(String operation, String json) {
        return new InboundMessage(operation, json.getBytes(StandardCharsets.UTF_8), Map.of(), null, null, null);
    }

    @Override
    public String toString() {
        return "InboundMessage[operation=" + operation + ", messageId=" + messageId
            + ", correlationId=" + correlationId + ", replyTo=" + replyTo + ", bodyLength=" + body.length + "]";
    }
}
