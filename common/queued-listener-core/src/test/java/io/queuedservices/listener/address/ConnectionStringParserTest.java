package io.queuedservices.listener.address;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.queuedservices.listener.ErrorCode;
import io.queuedservices.listener.QueuedListenerException;
import java.net.URI;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ConnectionStringParserTest {

    private final ConnectionStringParser parser = new ConnectionStringParser();

    @Test
    void parsesListenConnectionString() {
        ConnectionDescriptor descriptor = parser.parse(
            "Endpoint=sb://orders.servicebus.windows.net/;SharedAccessKeyName=listen;SharedAccessKey=c2VjcmV0PQ==");

        assertThat(descriptor.endpoints()).containsExactly(URI.create("sb://orders.servicebus.windows.net/"));
        assertThat(descriptor.sharedAccessKeyName()).isEqualTo("listen");
        assertThat(descriptor.sharedAccessKey()).isEqualTo("c2VjcmV0PQ==");
        assertThat(descriptor.entityPathOption()).isEmpty();
        assertThat(descriptor.runtimePortOption()).isEmpty();
    }

    @Test
    void keysAreCaseInsensitiveAndWhitespaceIsTrimmed() {
        ConnectionDescriptor descriptor = parser.parse(
            " endpoint = sb://a.example.net/ ; SHAREDACCESSKEYNAME=K ;;SharedAccessKey= S ;");

        assertThat(descriptor.endpoints()).containsExactly(URI.create("sb://a.example.net/"));
        assertThat(descriptor.sharedAccessKeyName()).isEqualTo("K");
        assertThat(descriptor.sharedAccessKey()).isEqualTo("S");
    }

    @Test
    void parsesOptionalKeys() {
        ConnectionDescriptor descriptor = parser.parse("Endpoint=sb://a.example.net/;EntityPath=orders;"
            + "TransportType=Amqp;OperationTimeout=00:01:30;RuntimePort=5671");

        assertThat(descriptor.entityPath()).isEqualTo("orders");
        assertThat(descriptor.transportType()).isEqualTo("Amqp");
        assertThat(descriptor.operationTimeout()).isEqualTo(Duration.ofSeconds(90));
        assertThat(descriptor.runtimePort()).isEqualTo(5671);
    }

    @Test
    void acceptsIsoOperationTimeout() {
        ConnectionDescriptor descriptor = parser.parse("Endpoint=sb://a.example.net/;OperationTimeout=PT2M");

        assertThat(descriptor.operationTimeout()).isEqualTo(Duration.ofMinutes(2));
    }

    @Test
    void splitsCommaSeparatedEndpoints() {
        ConnectionDescriptor descriptor = parser.parse("Endpoint=sb://a.example.net/, sb://b.example.net/");

        assertThat(descriptor.endpoints()).hasSize(2);
    }

    @Test
    void repeatedEndpointKeysAddEndpoints() {
        ConnectionDescriptor descriptor = parser.parse(
            "Endpoint=sb://a.example.net/;SharedAccessKeyName=K;endpoint=sb://b.example.net/");

        assertThat(descriptor.endpoints())
            .containsExactly(URI.create("sb://a.example.net/"), URI.create("sb://b.example.net/"));
    }

    @Test
    void rejectsOperationTimeoutOutOfRange() {
        assertThatThrownBy(() -> parser.parse("Endpoint=sb://a.example.net/;OperationTimeout=99999999999999999999:00:00"))
            .isInstanceOfSatisfying(QueuedListenerException.class,
                ex -> assertThat(ex.code()).isEqualTo(ErrorCode.MALFORMED_CONNECTION_STRING))
            .hasMessageContaining("OperationTimeout");
        assertThatThrownBy(() -> parser.parse("Endpoint=sb://a.example.net/;OperationTimeout=9999999999999999:00:00"))
            .isInstanceOfSatisfying(QueuedListenerException.class,
                ex -> assertThat(ex.code()).isEqualTo(ErrorCode.MALFORMED_CONNECTION_STRING));
    }

    @Test
    void emptyStringYieldsNoEndpoints() {
        assertThat(parser.parse("").endpoints()).isEmpty();
        assertThat(parser.parse(null).endpoints()).isEmpty();
    }

    @Test
    void rejectsUnknownAndDuplicateKeys() {
        assertThatThrownBy(() -> parser.parse("Endpoint=sb://a.example.net/;Colour=blue"))
            .isInstanceOfSatisfying(QueuedListenerException.class,
                ex -> assertThat(ex.code()).isEqualTo(ErrorCode.MALFORMED_CONNECTION_STRING))
            .hasMessageContaining("Colour");
        assertThatThrownBy(() -> parser.parse("SharedAccessKeyName=a;sharedaccesskeyname=b"))
            .isInstanceOfSatisfying(QueuedListenerException.class,
                ex -> assertThat(ex.code()).isEqualTo(ErrorCode.MALFORMED_CONNECTION_STRING))
            .hasMessageContaining("duplicate");
    }

    @Test
    void rejectsSegmentWithoutSeparatorWithoutEchoingIt() {
        assertThatThrownBy(() -> parser.parse("Endpoint=sb://a.example.net/;topsecret"))
            .isInstanceOf(QueuedListenerException.class)
            .hasMessageNotContaining("topsecret");
    }

    @Test
    void rejectsEndpointWithoutHostAndBadPort() {
        assertThatThrownBy(() -> parser.parse("Endpoint=not a uri"))
            .isInstanceOfSatisfying(QueuedListenerException.class,
                ex -> assertThat(ex.code()).isEqualTo(ErrorCode.MALFORMED_CONNECTION_STRING));
        assertThatThrownBy(() -> parser.parse("Endpoint=sb:///path"))
            .isInstanceOf(QueuedListenerException.class);
        assertThatThrownBy(() -> parser.parse("Endpoint=sb://a.example.net/;RuntimePort=70000"))
            .isInstanceOf(QueuedListenerException.class)
            .hasMessageContaining("RuntimePort");
        assertThatThrownBy(() -> parser.parse("Endpoint=sb://a.example.net/;OperationTimeout=soon"))
            .isInstanceOf(QueuedListenerException.class)
            .hasMessageContaining("OperationTimeout");
    }

    @Test
    void keyValuesMayContainEquals() {
        ConnectionDescriptor descriptor = parser.parse("SharedAccessKey=abc==");

        assertThat(descriptor.sharedAccessKey()).isEqualTo("abc==");
        assertThat(descriptor.toString()).doesNotContain("abc==");
    }
}
