package io.queuedservices.listener.address;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * The messaging fabric's own address-construction rule for namespace-scoped entities:
 * {@code <scheme>://<namespace>.<hostSuffix>/<path>/}.
 */
public final class NamespaceAddressConvention {

    public static final String DEFAULT_SCHEME = "sb";
    public static final String DEFAULT_HOST_SUFFIX = "servicebus.windows.net";

    private final String scheme;
    private final String hostSuffix;

    public NamespaceAddressConvention() {
        this(DEFAULT_SCHEME, DEFAULT_HOST_SUFFIX);
    }

    public NamespaceAddressConvention(String scheme, String hostSuffix) {
        this.scheme = normaliseScheme(scheme);
        this.hostSuffix = normaliseSuffix(hostSuffix);
    }

    public String scheme() {
        return scheme;
    }

    public String hostSuffix() {
        return hostSuffix;
    }

    /**
     * Builds the address of queue {@code queueName} inside {@code namespace} using the configured scheme.
     */
    public QueueAddress queueAddress(String namespace, String queueName) {
        return new QueueAddress(scheme, namespace, hostSuffix, queueName, createServiceUri(scheme, namespace, queueName));
    }

    /**
     * Builds {@code <scheme>://<namespace>.<hostSuffix>/<path>/}, escaping characters that are not
     * legal in a URI path.
     */
    public URI createServiceUri(String scheme, String namespace, String path) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be null or blank");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be null or blank");
        }
        String trimmedPath = path.startsWith("/") ? path.substring(1) : path;
        String normalisedPath = "/" + (trimmedPath.endsWith("/") ? trimmedPath : trimmedPath + "/");
        try {
            return new URI(normaliseScheme(scheme), null, namespace + "." + hostSuffix, -1, normalisedPath, null, null);
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Cannot build service URI for namespace " + namespace, ex);
        }
    }

    private static String normaliseScheme(String scheme) {
        if (scheme == null || scheme.isBlank()) {
            return DEFAULT_SCHEME;
        }
        return scheme.trim().toLowerCase(Locale.ROOT);
    }

    private static String normaliseSuffix(String hostSuffix) {
        if (hostSuffix == null || hostSuffix.isBlank()) {
            return DEFAULT_HOST_SUFFIX;
        }
        String trimmed = hostSuffix.trim();
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }

    @Override
    public String toString() {
        return scheme + "://<namespace>." + hostSuffix;
    }
}
