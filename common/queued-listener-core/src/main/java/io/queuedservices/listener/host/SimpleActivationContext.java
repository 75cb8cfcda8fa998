package io.queuedservices.listener.host;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable {@link ActivationContext} backed by in-memory configuration packages.
 */
public final class SimpleActivationContext implements ActivationContext {

    private final String serviceName;
    private final String instanceId;
    private final Map<String, ConfigurationPackage> packages;
    private final ValueProtector valueProtector;

    private SimpleActivationContext(Builder builder) {
        this.serviceName = builder.serviceName;
        this.instanceId = builder.instanceId;
        this.packages = Map.copyOf(builder.packages);
        this.valueProtector = builder.valueProtector;
    }

    public static Builder builder(String serviceName, String instanceId) {
        return new Builder(serviceName, instanceId);
    }

    @Override
    public String serviceName() {
        return serviceName;
    }

    @Override
    public String instanceId() {
        return instanceId;
    }

    @Override
    public Optional<ConfigurationPackage> configurationPackage(String packageName) {
        return Optional.ofNullable(packages.get(packageName));
    }

    @Override
    public ValueProtector valueProtector() {
        return valueProtector;
    }

    @Override
    public String toString() {
        return "SimpleActivationContext[serviceName=" + serviceName + ", instanceId=" + instanceId
            + ", packages=" + packages.keySet() + "]";
    }

    public static final class Builder {
        private final String serviceName;
        private final String instanceId;
        private final Map<String, ConfigurationPackage> packages = new LinkedHashMap<>();
        private ValueProtector valueProtector = ValueProtector.UNAVAILABLE;

        private Builder(String serviceName, String instanceId) {
            this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
            this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        }

        public Builder configurationPackage(ConfigurationPackage configurationPackage) {
            Objects.requireNonNull(configurationPackage, "configurationPackage");
            packages.put(configurationPackage.name(), configurationPackage);
            return this;
        }

        public Builder valueProtector(ValueProtector valueProtector) {
            this.valueProtector = Objects.requireNonNull(valueProtector, "valueProtector");
            return this;
        }

        public SimpleActivationContext build() {
            return new SimpleActivationContext(this);
        }
    }
}
