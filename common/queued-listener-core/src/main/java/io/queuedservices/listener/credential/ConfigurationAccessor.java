package io.queuedservices.listener.credential;

import io.queuedservices.listener.host.ActivationContext;
import io.queuedservices.listener.host.ConfigurationPackage;
import io.queuedservices.listener.host.ConfigurationProperty;
import io.queuedservices.listener.host.ConfigurationSection;
import java.util.Optional;

/**
 * Reads a named parameter from the host configuration store.
 */
@FunctionalInterface
public interface ConfigurationAccessor {

    /**
     * Looks up {@code packageName/sectionName/parameterName} for the supplied activation context.
     *
     * @return the stored property, or empty when any level of the path is missing
     */
    Optional<ConfigurationProperty> lookup(ActivationContext context,
                                           String packageName,
                                           String sectionName,
                                           String parameterName);

    /**
     * Accessor that navigates the configuration packages deployed with the activation context.
     */
    static ConfigurationAccessor fromActivationContext() {
        return (context, packageName, sectionName, parameterName) -> context.configurationPackage(packageName)
            .flatMap((ConfigurationPackage configPackage) -> configPackage.section(sectionName))
            .flatMap((ConfigurationSection section) -> section.parameter(parameterName));
    }
}
