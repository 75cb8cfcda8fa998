package io.queuedservices.listener;

import io.queuedservices.listener.address.ConnectionStringParser;
import io.queuedservices.listener.address.NamespaceAddressConvention;
import io.queuedservices.listener.address.QueueAddressDeriver;
import io.queuedservices.listener.credential.CredentialResolver;
import io.queuedservices.listener.credential.CredentialSource;
import io.queuedservices.listener.endpoint.EndpointBehavior;
import io.queuedservices.listener.transport.TransportListenerFactory;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point that adapts a service object to a queued transport.
 * <p>
 * {@link #create(QueuedListenerOptions)} only checks its arguments. Configuration access, connection
 * string parsing and transport construction happen when the host activates the returned
 * {@link DeferredListener}.
 */
public final class QueuedListenerFactory {

    private static final Logger log = LoggerFactory.getLogger(QueuedListenerFactory.class);

    private final CredentialResolver credentialResolver = new CredentialResolver();
    private final ConnectionStringParser parser = new ConnectionStringParser();
    private final QueueAddressDeriver addressDeriver;
    private final ListenerBinder binder;

    public QueuedListenerFactory(TransportListenerFactory transportFactory) {
        this(transportFactory, new NamespaceAddressConvention());
    }

    public QueuedListenerFactory(TransportListenerFactory transportFactory, NamespaceAddressConvention convention) {
        this.binder = new ListenerBinder(Objects.requireNonNull(transportFactory, "transportFactory"));
        this.addressDeriver = new QueueAddressDeriver(Objects.requireNonNull(convention, "convention"));
    }

    public <C> ListenerResult<DeferredListener<C>> create(QueuedListenerOptions<C> options) {
        if (options == null) {
            return ListenerResult.failure(ListenerError.nullArgument("options"));
        }
        ListenerError error = validate(options);
        if (error != null) {
            log.debug("Rejected listener options for {}: {}", describe(options.contract()), error);
            return ListenerResult.failure(error);
        }
        log.debug("Registered deferred listener for {}", options.contract().getSimpleName());
        return ListenerResult.success(
            new DeferredListener<>(options, credentialResolver, parser, addressDeriver, binder));
    }

    static ListenerError validate(QueuedListenerOptions<?> options) {
        if (options.contract() == null) {
            return ListenerError.nullArgument("contract");
        }
        if (options.serviceObject() == null) {
            return ListenerError.nullArgument("serviceObject");
        }
        if (!options.contract().isInstance(options.serviceObject())) {
            return ListenerError.of(ErrorCode.CONTRACT_MISMATCH,
                "serviceObject must implement " + options.contract().getName());
        }
        if (options.binding() == null) {
            return ListenerError.nullArgument("binding");
        }
        List<EndpointBehavior> behaviors = options.behaviors();
        if (behaviors == null) {
            return ListenerError.nullArgument("behaviors");
        }
        for (int i = 0; i < behaviors.size(); i++) {
            if (behaviors.get(i) == null) {
                return ListenerError.nullArgument("behaviors[" + i + "]");
            }
        }
        CredentialSource source = options.credentialSource();
        if (source == null) {
            return ListenerError.nullArgument("credentialSource");
        }
        if (source instanceof CredentialSource.Literal literal) {
            String connectionString = literal.connectionString();
            if (connectionString == null || connectionString.isEmpty()) {
                return ListenerError.of(ErrorCode.EMPTY_CONNECTION_STRING, "connectionString must not be null or empty");
            }
        } else if (((CredentialSource.Configured) source).accessor() == null) {
            return ListenerError.nullArgument("accessor");
        }
        return null;
    }

    private static String describe(Class<?> contract) {
        return contract == null ? "<null contract>" : contract.getSimpleName();
    }
}
