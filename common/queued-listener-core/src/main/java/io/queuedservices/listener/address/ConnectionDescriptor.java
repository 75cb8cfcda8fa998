package io.queuedservices.listener.address;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Parsed form of a listen-capable connection string.
 *
 * @param endpoints           candidate namespace endpoints, in declaration order
 * @param sharedAccessKeyName name of the shared access policy
 * @param sharedAccessKey     secret of the shared access policy
 * @param entityPath          optional entity the credential is scoped to
 * @param transportType       optional transport hint
 * @param operationTimeout    optional operation timeout
 * @param runtimePort         optional port override for the messaging runtime
 */
public record ConnectionDescriptor(
    List<URI> endpoints,
    String sharedAccessKeyName,
    String sharedAccessKey,
    String entityPath,
    String transportType,
    Duration operationTimeout,
    Integer runtimePort
) {

    public ConnectionDescriptor {
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
    }

    public Optional<String> entityPathOption() {
        return Optional.ofNullable(entityPath);
    }

    public Optional<Integer> runtimePortOption() {
        return Optional.ofNullable(runtimePort);
    }

    @Override
    public String toString() {
        return "ConnectionDescriptor[endpoints=" + endpoints
            + ", sharedAccessKeyName=" + sharedAccessKeyName
            + ", sharedAccessKey=" + (sharedAccessKey == null ? null : "***")
            + ", entityPath=" + entityPath
            + ", transportType=" + transportType
            + ", operationTimeout=" + operationTimeout
            + ", runtimePort=" + runtimePort + "]";
    }
}
