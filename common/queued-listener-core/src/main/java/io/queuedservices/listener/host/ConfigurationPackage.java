package io.queuedservices.listener.host;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Named set of configuration sections deployed alongside a service.
 */
public record ConfigurationPackage(String name, Map<String, ConfigurationSection> sections) {

    public ConfigurationPackage {
        Objects.requireNonNull(name, "name");
        sections = sections == null ? Map.of() : Map.copyOf(sections);
    }

    public static ConfigurationPackage of(String name, List<ConfigurationSection> sections) {
        Map<String, ConfigurationSection> byName = new LinkedHashMap<>();
        for (ConfigurationSection section : sections) {
            byName.put(section.name(), section);
        }
        return new ConfigurationPackage(name, byName);
    }

    public Optional<ConfigurationSection> section(String sectionName) {
        return Optional.ofNullable(sections.get(sectionName));
    }
}
