package io.queuedservices.listener.endpoint;

import io.queuedservices.listener.dispatch.EndpointDispatcher;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every dispatched operation with its outcome and duration.
 */
public final class MessageLoggingBehavior implements EndpointBehavior {

    private final Logger log;

    public MessageLoggingBehavior() {
        this(LoggerFactory.getLogger(MessageLoggingBehavior.class));
    }

    public MessageLoggingBehavior(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public void applyDispatchBehavior(ServiceEndpoint endpoint, EndpointDispatcher dispatcher) {
        String queue = endpoint.address().queueName();
        dispatcher.addInterceptor((message, chain) -> {
            long started = System.nanoTime();
            try {
                Object reply = chain.proceed(message);
                if (log.isDebugEnabled()) {
                    log.debug("Dispatched {} from queue {} (messageId={}, tookMs={})",
                        message.operation(), queue, message.messageId(), elapsedMillis(started));
                }
                return reply;
            } catch (Exception ex) {
                log.warn("Operation {} from queue {} failed (messageId={}, tookMs={})",
                    message.operation(), queue, message.messageId(), elapsedMillis(started), ex);
                throw ex;
            }
        });
    }

    private static long elapsedMillis(long started) {
        return (System.nanoTime() - started) / 1_000_000L;
    }
}
