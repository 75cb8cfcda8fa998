package io.queuedservices.listener.host;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Named group of configuration parameters inside a {@link ConfigurationPackage}.
 */
public record ConfigurationSection(String name, Map<String, ConfigurationProperty> parameters) {

    public ConfigurationSection {
        Objects.requireNonNull(name, "name");
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public Optional<ConfigurationProperty> parameter(String parameterName) {
        return Optional.ofNullable(parameters.get(parameterName));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final Map<String, ConfigurationProperty> parameters = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder plain(String parameterName, String value) {
            parameters.put(parameterName, ConfigurationProperty.plain(parameterName, value));
            return this;
        }

        public Builder encrypted(String parameterName, String cipherText) {
            parameters.put(parameterName, ConfigurationProperty.encrypted(parameterName, cipherText));
            return this;
        }

        public Builder property(ConfigurationProperty property) {
            parameters.put(property.name(), property);
            return this;
        }

        public ConfigurationSection build() {
            return new ConfigurationSection(name, parameters);
        }
    }
}
