package io.queuedservices.listener.transport.rabbit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.queuedservices.listener.dispatch.EndpointDispatcher;
import io.queuedservices.listener.dispatch.ServiceContractInvoker;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitOperations;
import org.springframework.amqp.rabbit.support.ListenerExecutionFailedException;

class QueuedMessageListenerTest {

    interface OrderService {
        String status(String orderId);

        void cancel(String orderId);

        String audit(String orderId) throws Exception;
    }

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> cancelled = new ArrayList<>();
    private RabbitOperations replies;
    private EndpointDispatcher dispatcher;
    private QueuedMessageListener listener;

    @BeforeEach
    void setUp() {
        replies = mock(RabbitOperations.class);
        dispatcher = new EndpointDispatcher();
        OrderService service = new OrderService() {
            @Override
            public String status(String orderId) {
                return "open:" + orderId;
            }

            @Override
            public void cancel(String orderId) {
                cancelled.add(orderId);
            }

            @Override
            public String audit(String orderId) throws Exception {
                throw new Exception("audit store offline");
            }
        };
        listener = new QueuedMessageListener("OrderService", dispatcher,
            new ServiceContractInvoker<>(OrderService.class, service, mapper),
            new RabbitInboundMessageConverter(mapper), replies, 256);
    }

    @Test
    void repliesWithCorrelationIdOfRequest() {
        MessageProperties properties = new MessageProperties();
        properties.setHeader(RabbitInboundMessageConverter.HEADER_OPERATION, "status");
        properties.setReplyTo("order-replies");
        properties.setCorrelationId("c-42");
        properties.setMessageId("m-1");

        listener.onMessage(new Message("\"o-1\"".getBytes(StandardCharsets.UTF_8), properties));

        ArgumentCaptor<Message> reply = ArgumentCaptor.forClass(Message.class);
        verify(replies).send(eq(""), eq("order-replies"), reply.capture());
        assertThat(new String(reply.getValue().getBody(), StandardCharsets.UTF_8)).isEqualTo("\"open:o-1\"");
        assertThat(reply.getValue().getMessageProperties().getCorrelationId()).isEqualTo("c-42");
        assertThat(reply.getValue().getMessageProperties().getContentType()).isEqualTo(MessageProperties.CONTENT_TYPE_JSON);
        assertThat((String) reply.getValue().getMessageProperties().getHeader(RabbitInboundMessageConverter.HEADER_OPERATION))
            .isEqualTo("status");
    }

    @Test
    void oneWayOperationSendsNoReply() {
        MessageProperties properties = new MessageProperties();
        properties.setType("cancel");
        properties.setReplyTo("order-replies");

        listener.onMessage(new Message("\"o-7\"".getBytes(StandardCharsets.UTF_8), properties));

        assertThat(cancelled).containsExactly("o-7");
        verify(replies, never()).send(anyString(), anyString(), any(Message.class));
    }

    @Test
    void resultWithoutReplyQueueIsDropped() {
        MessageProperties properties = new MessageProperties();
        properties.setType("status");

        listener.onMessage(new Message("\"o-1\"".getBytes(StandardCharsets.UTF_8), properties));

        verify(replies, never()).send(anyString(), anyString(), any(Message.class));
    }

    @Test
    void interceptorsSeeAcceptedMessages() {
        List<String> seen = new ArrayList<>();
        dispatcher.addInterceptor((message, next) -> {
            seen.add(message.operation());
            return next.proceed(message);
        });
        MessageProperties properties = new MessageProperties();
        properties.setType("cancel");

        listener.onMessage(new Message("\"o-2\"".getBytes(StandardCharsets.UTF_8), properties));

        assertThat(seen).containsExactly("cancel");
        assertThat(cancelled).containsExactly("o-2");
    }

    @Test
    void rejectsOversizedMessage() {
        MessageProperties properties = new MessageProperties();
        properties.setType("status");

        assertThatThrownBy(() -> listener.onMessage(new Message(new byte[257], properties)))
            .isInstanceOf(MessageRejectedException.class)
            .hasMessageContaining("257 bytes");
    }

    @Test
    void rejectsMessageWithoutOperation() {
        assertThatThrownBy(() -> listener.onMessage(new Message("{}".getBytes(StandardCharsets.UTF_8), new MessageProperties())))
            .isInstanceOf(MessageRejectedException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsOperationOutsideContract() {
        MessageProperties properties = new MessageProperties();
        properties.setType("refund");

        assertThatThrownBy(() -> listener.onMessage(new Message(new byte[0], properties)))
            .isInstanceOf(MessageRejectedException.class)
            .hasMessageContaining("refund")
            .hasMessageContaining("OrderService");
    }

    @Test
    void wrapsCheckedServiceFailures() {
        MessageProperties properties = new MessageProperties();
        properties.setType("audit");

        assertThatThrownBy(() -> listener.onMessage(new Message("\"o-1\"".getBytes(StandardCharsets.UTF_8), properties)))
            .isInstanceOf(ListenerExecutionFailedException.class)
            .hasRootCauseMessage("audit store offline");
    }
}
