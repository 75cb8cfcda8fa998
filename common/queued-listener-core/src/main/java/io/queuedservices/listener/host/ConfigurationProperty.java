package io.queuedservices.listener.host;

import java.util.Objects;

/**
 * A named configuration value as stored by the host. Encrypted values hold ciphertext in
 * {@link #value()} and must go through a {@link ValueProtector} before use.
 */
public record ConfigurationProperty(String name, String value, boolean encrypted) {

    public ConfigurationProperty {
        Objects.requireNonNull(name, "name");
    }

    public static ConfigurationProperty plain(String name, String value) {
        return new ConfigurationProperty(name, value, false);
    }

    public static ConfigurationProperty encrypted(String name, String cipherText) {
        return new ConfigurationProperty(name, cipherText, true);
    }

    @Override
    public String toString() {
        return "ConfigurationProperty[name=" + name + ", encrypted=" + encrypted + "]";
    }
}
