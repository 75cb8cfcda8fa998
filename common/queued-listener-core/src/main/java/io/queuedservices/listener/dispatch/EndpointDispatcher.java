package io.queuedservices.listener.dispatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Per-endpoint dispatch pipeline populated by endpoint behaviors. Inspectors and interceptors run in
 * the order they were added.
 */
public final class EndpointDispatcher {

    private final List<DispatchMessageInspector> inspectors = new ArrayList<>();
    private final List<DispatchInterceptor> interceptors = new ArrayList<>();

    public EndpointDispatcher addMessageInspector(DispatchMessageInspector inspector) {
        inspectors.add(Objects.requireNonNull(inspector, "inspector"));
        return this;
    }

    public EndpointDispatcher addInterceptor(DispatchInterceptor interceptor) {
        interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
        return this;
    }

    public List<DispatchMessageInspector> messageInspectors() {
        return List.copyOf(inspectors);
    }

    public List<DispatchInterceptor> interceptors() {
        return List.copyOf(interceptors);
    }

    /**
     * Runs {@code message} through inspectors and interceptors, then {@code invoker}.
     *
     * @return the operation result, {@code null} for one-way operations
     */
    public Object dispatch(InboundMessage message, OperationInvoker invoker) throws Exception {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(invoker, "invoker");
        for (DispatchMessageInspector inspector : inspectors) {
            inspector.afterReceiveRequest(message);
        }
        Object reply = proceed(0, message, invoker);
        for (DispatchMessageInspector inspector : inspectors) {
            inspector.beforeSendReply(message, reply);
        }
        return reply;
    }

    private Object proceed(int index, InboundMessage message, OperationInvoker invoker) throws Exception {
        if (index < interceptors.size()) {
            DispatchInterceptor interceptor = interceptors.get(index);
            return interceptor.intercept(message, next -> proceed(index + 1, next, invoker));
        }
        return invoker.invoke(message);
    }
}
