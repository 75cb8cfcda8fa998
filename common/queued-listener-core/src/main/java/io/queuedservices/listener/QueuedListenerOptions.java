package io.queuedservices.listener;

import io.queuedservices.listener.credential.CredentialSource;
import io.queuedservices.listener.endpoint.EndpointBehavior;
import io.queuedservices.listener.transport.BindingPolicy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Inputs of {@link QueuedListenerFactory#create(QueuedListenerOptions)}. The builder does not validate;
 * the factory reports invalid options as a {@link ListenerResult.Failure}.
 *
 * @param <C> service contract type
 */
public final class QueuedListenerOptions<C> {

    private final Class<C> contract;
    private final C serviceObject;
    private final BindingPolicy binding;
    private final CredentialSource credentialSource;
    private final Supplier<String> queueNameProvider;
    private final List<EndpointBehavior> behaviors;

    private QueuedListenerOptions(Builder<C> builder) {
        this.contract = builder.contract;
        this.serviceObject = builder.serviceObject;
        this.binding = builder.binding;
        this.credentialSource = builder.credentialSource;
        this.queueNameProvider = builder.queueNameProvider;
        this.behaviors = builder.behaviors == null
            ? null
            : Collections.unmodifiableList(new ArrayList<>(builder.behaviors));
    }

    public static <C> Builder<C> builder(Class<C> contract) {
        return new Builder<>(contract);
    }

    public Class<C> contract() {
        return contract;
    }

    public C serviceObject() {
        return serviceObject;
    }

    public BindingPolicy binding() {
        return binding;
    }

    public CredentialSource credentialSource() {
        return credentialSource;
    }

    /**
     * Optional queue name provider; {@code null} means the contract's simple name is used.
     */
    public Supplier<String> queueNameProvider() {
        return queueNameProvider;
    }

    public List<EndpointBehavior> behaviors() {
        return behaviors;
    }

    public static final class Builder<C> {

        private final Class<C> contract;
        private C serviceObject;
        private BindingPolicy binding;
        private CredentialSource credentialSource = CredentialSource.configured();
        private Supplier<String> queueNameProvider;
        private List<EndpointBehavior> behaviors = new ArrayList<>();

        private Builder(Class<C> contract) {
            this.contract = contract;
        }

        public Builder<C> serviceObject(C serviceObject) {
            this.serviceObject = serviceObject;
            return this;
        }

        public Builder<C> binding(BindingPolicy binding) {
            this.binding = binding;
            return this;
        }

        public Builder<C> credentialSource(CredentialSource credentialSource) {
            this.credentialSource = credentialSource;
            return this;
        }

        /**
         * Shortcut for {@code credentialSource(CredentialSource.literal(connectionString))}.
         */
        public Builder<C> connectionString(String connectionString) {
            return credentialSource(CredentialSource.literal(connectionString));
        }

        public Builder<C> queueName(String queueName) {
            return queueNameProvider(() -> queueName);
        }

        public Builder<C> queueNameProvider(Supplier<String> queueNameProvider) {
            this.queueNameProvider = queueNameProvider;
            return this;
        }

        /**
         * Replaces the behavior list. A {@code null} list is kept and rejected by the factory.
         */
        public Builder<C> behaviors(List<? extends EndpointBehavior> behaviors) {
            this.behaviors = behaviors == null ? null : new ArrayList<>(behaviors);
            return this;
        }

        public Builder<C> behavior(EndpointBehavior behavior) {
            if (behaviors == null) {
                behaviors = new ArrayList<>();
            }
            behaviors.add(behavior);
            return this;
        }

        public QueuedListenerOptions<C> build() {
            return new QueuedListenerOptions<>(this);
        }
    }
}
