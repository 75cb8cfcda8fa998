package io.queuedservices.listener.transport.rabbit;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.queuedservices.listener.address.QueueAddress;
import io.queuedservices.listener.auth.TokenProvider;
import io.queuedservices.listener.auth.TransportClientEndpointBehavior;
import io.queuedservices.listener.dispatch.EndpointDispatcher;
import io.queuedservices.listener.dispatch.ServiceContractInvoker;
import io.queuedservices.listener.endpoint.ServiceEndpoint;
import io.queuedservices.listener.transport.BindingPolicy;
import io.queuedservices.listener.transport.ListenerBinding;
import io.queuedservices.listener.transport.ReceiveMode;
import io.queuedservices.listener.transport.TransportListener;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.rabbit.listener.ConditionalRejectingErrorHandler;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;

/**
 * {@link TransportListener} that consumes the endpoint's queue through a Spring AMQP
 * {@link SimpleMessageListenerContainer}. Endpoint behaviors are validated and applied when the
 * listener opens; the transport client behavior supplies the broker credentials.
 *
 * @param <C> service contract type
 */
public final class RabbitQueuedTransportListener<C> implements TransportListener {

    private static final Logger log = LoggerFactory.getLogger(RabbitQueuedTransportListener.class);

    private final ListenerBinding<C> binding;
    private final ServiceEndpoint endpoint;
    private final ObjectMapper objectMapper;
    private CachingConnectionFactory connectionFactory;
    private SimpleMessageListenerContainer container;

    RabbitQueuedTransportListener(ListenerBinding<C> binding, ObjectMapper objectMapper) {
        this.binding = Objects.requireNonNull(binding, "binding");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.endpoint = new ServiceEndpoint(binding.contract(), binding.address(), binding.binding());
    }

    @Override
    public ServiceEndpoint endpoint() {
        return endpoint;
    }

    @Override
    public synchronized String open() {
        if (container != null && container.isRunning()) {
            throw new IllegalStateException("Listener for " + endpoint.address() + " is already open");
        }
        SimpleMessageListenerContainer prepared = prepare();
        prepared.start();
        log.info("Queued listener for {} started (queue={}, instance={}, receiveMode={})",
            binding.contract().getSimpleName(), binding.address().queueName(), binding.context().instanceId(),
            binding.binding().getReceiveMode());
        return endpoint.address().uri().toString();
    }

    @Override
    public synchronized void close() {
        if (container == null) {
            return;
        }
        container.stop();
        release();
        log.info("Queued listener for {} stopped", binding.address());
    }

    @Override
    public synchronized void abort() {
        if (container == null) {
            return;
        }
        container.setShutdownTimeout(0);
        container.stop();
        release();
        log.info("Queued listener for {} aborted", binding.address());
    }

    /**
     * Builds the connection factory and the container without starting it.
     */
    synchronized SimpleMessageListenerContainer prepare() {
        EndpointDispatcher dispatcher = endpoint.buildDispatcher();
        TokenProvider tokenProvider = endpoint.behaviors().find(TransportClientEndpointBehavior.class)
            .map(TransportClientEndpointBehavior::tokenProvider)
            .orElseThrow(() -> new IllegalStateException(
                "Endpoint " + endpoint.address() + " has no transport client behavior"));
        BindingPolicy policy = binding.binding();
        QueueAddress address = binding.address();

        connectionFactory = createConnectionFactory(address, tokenProvider);
        ServiceContractInvoker<C> invoker =
            new ServiceContractInvoker<>(binding.contract(), binding.serviceObject(), objectMapper);
        QueuedMessageListener listener = new QueuedMessageListener(address.queueName(), dispatcher, invoker,
            new RabbitInboundMessageConverter(objectMapper), new RabbitTemplate(connectionFactory),
            policy.getMaxReceivedMessageSize());

        SimpleMessageListenerContainer prepared = new SimpleMessageListenerContainer(connectionFactory);
        prepared.setListenerId(binding.contract().getSimpleName() + "Listener");
        prepared.setQueueNames(address.queueName());
        prepared.setAcknowledgeMode(acknowledgeMode(policy.getReceiveMode()));
        prepared.setPrefetchCount(policy.getPrefetchCount());
        prepared.setConcurrentConsumers(policy.getMaxConcurrentCalls());
        prepared.setShutdownTimeout(policy.getCloseTimeout().toMillis());
        prepared.setErrorHandler(new ConditionalRejectingErrorHandler(new QueuedMessageFatalExceptionStrategy()));
        prepared.setMessageListener(listener);
        prepared.afterPropertiesSet();
        container = prepared;
        return prepared;
    }

    CachingConnectionFactory createConnectionFactory(QueueAddress address, TokenProvider tokenProvider) {
        CachingConnectionFactory factory = new CachingConnectionFactory(binding.host(), binding.port());
        factory.setVirtualHost(binding.binding().getVirtualHost());
        factory.getRabbitConnectionFactory()
            .setCredentialsProvider(new TokenCredentialsProvider(tokenProvider, address.uri().toString()));
        factory.setConnectionNameStrategy(ignored -> binding.context().serviceName()
            + ":" + binding.context().instanceId());
        return factory;
    }

    static AcknowledgeMode acknowledgeMode(ReceiveMode receiveMode) {
        return receiveMode == ReceiveMode.RECEIVE_AND_DELETE ? AcknowledgeMode.NONE : AcknowledgeMode.AUTO;
    }

    private void release() {
        container = null;
        if (connectionFactory != null) {
            connectionFactory.destroy();
            connectionFactory = null;
        }
    }

    @Override
    public String toString() {
        return "RabbitQueuedTransportListener[" + endpoint + "]";
    }
}
