package io.queuedservices.listener.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class EndpointDispatcherTest {

    @Test
    void runsInspectorsAndInterceptorsInRegistrationOrder() throws Exception {
        List<String> calls = new ArrayList<>();
        EndpointDispatcher dispatcher = new EndpointDispatcher()
            .addMessageInspector(new RecordingInspector("inspector-1", calls))
            .addMessageInspector(new RecordingInspector("inspector-2", calls))
            .addInterceptor((message, chain) -> {
                calls.add("outer-before");
                Object reply = chain.proceed(message);
                calls.add("outer-after");
                return reply;
            })
            .addInterceptor((message, chain) -> {
                calls.add("inner");
                return chain.proceed(message);
            });

        Object reply = dispatcher.dispatch(InboundMessage.json("ping", "{}"), message -> {
            calls.add("invoke");
            return "pong";
        });

        assertThat(reply).isEqualTo("pong");
        assertThat(calls).containsExactly(
            "inspector-1:receive", "inspector-2:receive",
            "outer-before", "inner", "invoke", "outer-after",
            "inspector-1:reply:pong", "inspector-2:reply:pong");
    }

    @Test
    void interceptorMayReplaceMessage() throws Exception {
        EndpointDispatcher dispatcher = new EndpointDispatcher()
            .addInterceptor((message, chain) -> chain.proceed(InboundMessage.json("rewritten", "{}")));

        Object reply = dispatcher.dispatch(InboundMessage.json("original", "{}"), InboundMessage::operation);

        assertThat(reply).isEqualTo("rewritten");
    }

    @Test
    void inspectorFailureStopsDispatch() {
        List<String> calls = new ArrayList<>();
        EndpointDispatcher dispatcher = new EndpointDispatcher()
            .addMessageInspector(request -> {
                throw new IllegalArgumentException("rejected");
            });

        assertThatThrownBy(() -> dispatcher.dispatch(InboundMessage.json("ping", "{}"), message -> {
            calls.add("invoke");
            return null;
        })).isInstanceOf(IllegalArgumentException.class);
        assertThat(calls).isEmpty();
    }

    @Test
    void exposesRegisteredHooksAsSnapshots() {
        EndpointDispatcher dispatcher = new EndpointDispatcher();
        dispatcher.addInterceptor((message, chain) -> chain.proceed(message));

        assertThat(dispatcher.interceptors()).hasSize(1);
        assertThat(dispatcher.messageInspectors()).isEmpty();
        assertThatThrownBy(() -> dispatcher.interceptors().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    private record RecordingInspector(String name, List<String> calls) implements DispatchMessageInspector {

        @Override
        public void afterReceiveRequest(InboundMessage request) {
            calls.add(name + ":receive");
        }

        @Override
        public void beforeSendReply(InboundMessage request, Object reply) {
            calls.add(name + ":reply:" + reply);
        }
    }
}
