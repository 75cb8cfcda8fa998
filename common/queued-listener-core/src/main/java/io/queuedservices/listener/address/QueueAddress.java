package io.queuedservices.listener.address;

import java.net.URI;
import java.util.Objects;

/**
 * Fully-qualified identity of the queue a listener consumes from.
 *
 * @param scheme     transport scheme, e.g. {@code sb}
 * @param namespace  messaging namespace (leftmost label of the endpoint host)
 * @param hostSuffix DNS suffix appended to the namespace
 * @param queueName  queue name, case-sensitive and used verbatim
 * @param uri        canonical URI built by the {@link NamespaceAddressConvention}
 */
public record QueueAddress(String scheme, String namespace, String hostSuffix, String queueName, URI uri) {

    public QueueAddress {
        requireText(scheme, "scheme");
        requireText(namespace, "namespace");
        requireText(hostSuffix, "hostSuffix");
        requireText(queueName, "queueName");
        Objects.requireNonNull(uri, "uri");
    }

    /**
     * Returns {@code namespace.hostSuffix}.
     */
    public String host() {
        return namespace + "." + hostSuffix;
    }

    @Override
    public String toString() {
        return uri.toString();
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }
}
