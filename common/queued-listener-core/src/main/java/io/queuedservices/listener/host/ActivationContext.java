package io.queuedservices.listener.host;

import java.util.Optional;

/**
 * Host-provided view of the service instance being activated. A listener is activated once per
 * context.
 */
public interface ActivationContext {

    String serviceName();

    String instanceId();

    /**
     * Returns the named configuration package deployed with the service, if any.
     */
    Optional<ConfigurationPackage> configurationPackage(String packageName);

    /**
     * Returns the host mechanism used to decrypt protected configuration values.
     */
    default ValueProtector valueProtector() {
        return ValueProtector.UNAVAILABLE;
    }
}
