package io.queuedservices.listener;

import io.queuedservices.listener.address.ConnectionDescriptor;
import io.queuedservices.listener.address.ConnectionStringParser;
import io.queuedservices.listener.address.QueueAddress;
import io.queuedservices.listener.address.QueueAddressDeriver;
import io.queuedservices.listener.credential.CredentialResolver;
import io.queuedservices.listener.host.ActivationContext;
import io.queuedservices.listener.transport.TransportListener;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Listener registration returned by {@link QueuedListenerFactory}. Nothing is resolved until the host
 * calls {@link #activate(ActivationContext)}, which runs credential resolution, address derivation and
 * binding exactly once.
 *
 * @param <C> service contract type
 */
public final class DeferredListener<C> {

    private static final Logger log = LoggerFactory.getLogger(DeferredListener.class);

    private final QueuedListenerOptions<C> options;
    private final CredentialResolver credentialResolver;
    private final ConnectionStringParser parser;
    private final QueueAddressDeriver addressDeriver;
    private final ListenerBinder binder;

    private ListenerState state = ListenerState.REGISTERED;
    private ListenerResult<TransportListener> outcome;

    DeferredListener(QueuedListenerOptions<C> options,
                     CredentialResolver credentialResolver,
                     ConnectionStringParser parser,
                     QueueAddressDeriver addressDeriver,
                     ListenerBinder binder) {
        this.options = Objects.requireNonNull(options, "options");
        this.credentialResolver = Objects.requireNonNull(credentialResolver, "credentialResolver");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.addressDeriver = Objects.requireNonNull(addressDeriver, "addressDeriver");
        this.binder = Objects.requireNonNull(binder, "binder");
    }

    public Class<C> contract() {
        return options.contract();
    }

    public synchronized ListenerState state() {
        return state;
    }

    /**
     * Result of the activation, empty until {@link #activate(ActivationContext)} has finished.
     */
    public synchronized Optional<ListenerResult<TransportListener>> outcome() {
        return Optional.ofNullable(outcome);
    }

    /**
     * Resolves the connection string, derives the queue address and binds the transport listener.
     *
     * @throws IllegalStateException when called more than once
     */
    public synchronized ListenerResult<TransportListener> activate(ActivationContext context) {
        if (state != ListenerState.REGISTERED) {
            throw new IllegalStateException("Listener for " + contract().getSimpleName()
                + " was already activated (state " + state + ")");
        }
        state = ListenerState.RESOLVING;
        log.debug("Activating listener for {}", contract().getSimpleName());
        try {
            TransportListener listener = bind(context);
            state = ListenerState.BOUND;
            outcome = ListenerResult.success(listener);
        } catch (QueuedListenerException ex) {
            state = ListenerState.FAILED;
            log.debug("Activation of {} failed: {}", contract().getSimpleName(), ex.error());
            outcome = ListenerResult.failure(ex.error());
        } catch (RuntimeException ex) {
            state = ListenerState.FAILED;
            throw ex;
        }
        return outcome;
    }

    private TransportListener bind(ActivationContext context) {
        if (context == null) {
            throw new QueuedListenerException(ListenerError.nullArgument("context"));
        }
        String connectionString = credentialResolver.resolve(options.credentialSource(), context);
        ConnectionDescriptor descriptor = parser.parse(connectionString);
        QueueAddress address = addressDeriver.derive(descriptor, options.contract(), options.queueNameProvider());
        log.debug("Derived address {} for {}", address, contract().getSimpleName());
        return binder.bind(options.contract(), options.serviceObject(), context, descriptor, address,
            options.binding(), options.behaviors());
    }

    @Override
    public String toString() {
        return "DeferredListener[contract=" + contract().getSimpleName() + ", state=" + state() + "]";
    }
}
