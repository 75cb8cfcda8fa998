package io.queuedservices.listener.spring;

import io.queuedservices.listener.DeferredListener;
import io.queuedservices.listener.ListenerState;
import io.queuedservices.listener.QueuedListenerFactory;
import io.queuedservices.listener.QueuedListenerOptions;
import io.queuedservices.listener.credential.CredentialSource;
import io.queuedservices.listener.host.ActivationContext;
import io.queuedservices.listener.transport.BindingPolicy;
import io.queuedservices.listener.transport.TransportListener;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Host adapter for queued listeners. Registrations are turned into deferred listeners when the bean is
 * created; {@link #start()} activates and opens them, {@link #stop()} closes them again. A later
 * {@link #start()} registers fresh deferred listeners, since each one activates only once.
 * <p>
 * A failed activation is raised as {@link io.queuedservices.listener.QueuedListenerException}, which
 * aborts application startup.
 */
public final class QueuedListenerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(QueuedListenerLifecycle.class);

    private final QueuedListenerFactory factory;
    private final ActivationContext context;
    private final CredentialSource credentialSource;
    private final BindingPolicy binding;
    private final List<QueuedServiceRegistration<?>> services;
    private final List<TransportListener> opened = new ArrayList<>();
    private volatile List<DeferredListener<?>> registrations;
    private volatile boolean running;

    public QueuedListenerLifecycle(QueuedListenerFactory factory,
                                   ActivationContext context,
                                   CredentialSource credentialSource,
                                   BindingPolicy binding,
                                   List<QueuedServiceRegistration<?>> services) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.context = Objects.requireNonNull(context, "context");
        this.credentialSource = credentialSource;
        this.binding = binding;
        this.services = List.copyOf(Objects.requireNonNull(services, "services"));
        this.registrations = register();
    }

    private List<DeferredListener<?>> register() {
        List<DeferredListener<?>> deferred = new ArrayList<>();
        for (QueuedServiceRegistration<?> service : services) {
            deferred.add(register(factory, service, credentialSource, binding));
        }
        return List.copyOf(deferred);
    }

    private static <C> DeferredListener<C> register(QueuedListenerFactory factory,
                                                    QueuedServiceRegistration<C> service,
                                                    CredentialSource credentialSource,
                                                    BindingPolicy binding) {
        return factory.create(QueuedListenerOptions.builder(service.contract())
                .serviceObject(service.serviceObject())
                .binding(binding)
                .credentialSource(credentialSource)
                .queueNameProvider(service.queueNameProvider())
                .behaviors(service.behaviors())
                .build())
            .orElseThrow();
    }

    /**
     * Deferred listeners of the current run. Each {@link #start()} after a stop or a failed start
     * replaces them with fresh registrations.
     */
    public List<DeferredListener<?>> registrations() {
        return registrations;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (registrations.stream().anyMatch(registration -> registration.state() != ListenerState.REGISTERED)) {
            registrations = register();
        }
        try {
            registrations.forEach(this::open);
        } catch (RuntimeException ex) {
            closeOpened();
            throw ex;
        }
        running = true;
        if (log.isInfoEnabled()) {
            log.info("Queued listener lifecycle started (listeners={}, instance={})", opened.size(), context.instanceId());
        }
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        closeOpened();
        running = false;
        log.info("Queued listener lifecycle stopped");
    }

    private void open(DeferredListener<?> registration) {
        TransportListener listener = registration.activate(context).orElseThrow();
        try {
            String address = listener.open();
            opened.add(listener);
            log.info("Opened queued listener for {} at {}", registration.contract().getSimpleName(), address);
        } catch (Exception ex) {
            listener.abort();
            throw new IllegalStateException("Failed to open queued listener for "
                + registration.contract().getSimpleName(), ex);
        }
    }

    private void closeOpened() {
        for (TransportListener listener : opened) {
            try {
                listener.close();
            } catch (Exception ex) {
                log.warn("Failed to close queued listener {}, aborting", listener, ex);
                listener.abort();
            }
        }
        opened.clear();
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public int getPhase() {
        return 0;
    }
}
