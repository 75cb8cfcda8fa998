package io.queuedservices.listener.address;

import io.queuedservices.listener.ErrorCode;
import io.queuedservices.listener.QueuedListenerException;
import java.net.URI;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Computes the queue address a listener binds to. Pure: the only call-out is the optional queue-name
 * provider.
 */
public final class QueueAddressDeriver {

    static final String NO_ENDPOINT_MESSAGE = "No endpoint was detected in connection string";
    static final String AMBIGUOUS_ENDPOINT_MESSAGE = "More than one endpoint was detected in connection string";

    private final NamespaceAddressConvention convention;

    public QueueAddressDeriver() {
        this(new NamespaceAddressConvention());
    }

    public QueueAddressDeriver(NamespaceAddressConvention convention) {
        this.convention = Objects.requireNonNull(convention, "convention");
    }

    /**
     * @param descriptor        parsed connection string
     * @param contract          service contract type; its simple name is the default queue name
     * @param queueNameProvider optional override, may be {@code null}
     * @throws QueuedListenerException {@code NO_ENDPOINT}, {@code AMBIGUOUS_ENDPOINT} or
     *                                 {@code BLANK_QUEUE_NAME}
     */
    public QueueAddress derive(ConnectionDescriptor descriptor, Class<?> contract, Supplier<String> queueNameProvider) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(contract, "contract");
        URI endpoint = singleEndpoint(descriptor);
        String namespace = namespaceOf(endpoint);
        String queueName = queueName(contract, queueNameProvider);
        return convention.queueAddress(namespace, queueName);
    }

    /**
     * Returns the only endpoint of {@code descriptor}.
     */
    public URI singleEndpoint(ConnectionDescriptor descriptor) {
        URI match = null;
        int count = 0;
        for (URI endpoint : descriptor.endpoints()) {
            if (endpoint == null) {
                continue;
            }
            count++;
            if (count > 1) {
                throw new QueuedListenerException(ErrorCode.AMBIGUOUS_ENDPOINT, AMBIGUOUS_ENDPOINT_MESSAGE);
            }
            match = endpoint;
        }
        if (match == null) {
            throw new QueuedListenerException(ErrorCode.NO_ENDPOINT, NO_ENDPOINT_MESSAGE);
        }
        return match;
    }

    static String namespaceOf(URI endpoint) {
        String host = endpoint.getHost();
        int dot = host.indexOf('.');
        return dot < 0 ? host : host.substring(0, dot);
    }

    static String queueName(Class<?> contract, Supplier<String> queueNameProvider) {
        if (queueNameProvider == null) {
            return contract.getSimpleName();
        }
        String provided = queueNameProvider.get();
        if (provided == null || provided.isBlank()) {
            throw new QueuedListenerException(ErrorCode.BLANK_QUEUE_NAME,
                "queueNameProvider returned a null or blank queue name");
        }
        return provided;
    }
}
