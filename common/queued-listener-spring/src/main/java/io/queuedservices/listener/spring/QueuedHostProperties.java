package io.queuedservices.listener.spring;

import io.queuedservices.listener.host.ActivationContext;
import io.queuedservices.listener.host.ConfigurationPackage;
import io.queuedservices.listener.host.ConfigurationSection;
import io.queuedservices.listener.host.SimpleActivationContext;
import io.queuedservices.listener.host.ValueProtector;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Host identity and deployed configuration packages bound from {@code queued.host.*}.
 * <p>
 * Packages are declared as {@code queued.host.packages.<package>.<section>.<parameter>=value}. Values
 * written as <code>{cipher}&lt;base64&gt;</code> are treated as encrypted.
 */
@ConfigurationProperties(prefix = "queued.host")
public class QueuedHostProperties implements InitializingBean {

    public static final String SERVICE_NAME_PROPERTY = "queued.host.service-name";
    public static final String CIPHER_PREFIX = "{cipher}";

    private String serviceName;
    private String instanceId;
    private String encryptionKey;
    private Map<String, Map<String, Map<String, String>>> packages = new LinkedHashMap<>();

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    public String getEncryptionKey() {
        return encryptionKey;
    }

    public void setEncryptionKey(String encryptionKey) {
        this.encryptionKey = encryptionKey;
    }

    public Map<String, Map<String, Map<String, String>>> getPackages() {
        return packages;
    }

    public void setPackages(Map<String, Map<String, Map<String, String>>> packages) {
        this.packages = packages == null ? new LinkedHashMap<>() : packages;
    }

    /**
     * Instance id, defaulting to the service name when not set.
     */
    public String resolvedInstanceId() {
        return instanceId == null || instanceId.isBlank() ? serviceName : instanceId;
    }

    public ActivationContext toActivationContext(ValueProtector valueProtector) {
        Objects.requireNonNull(valueProtector, "valueProtector");
        SimpleActivationContext.Builder builder = SimpleActivationContext.builder(serviceName, resolvedInstanceId())
            .valueProtector(valueProtector);
        packages.forEach((packageName, sections) -> builder.configurationPackage(toPackage(packageName, sections)));
        return builder.build();
    }

    private static ConfigurationPackage toPackage(String packageName, Map<String, Map<String, String>> sections) {
        List<ConfigurationSection> converted = new ArrayList<>();
        sections.forEach((sectionName, parameters) -> {
            ConfigurationSection.Builder section = ConfigurationSection.builder(sectionName);
            parameters.forEach((parameterName, value) -> {
                if (value != null && value.startsWith(CIPHER_PREFIX)) {
                    section.encrypted(parameterName, value.substring(CIPHER_PREFIX.length()));
                } else {
                    section.plain(parameterName, value);
                }
            });
            converted.add(section.build());
        });
        return ConfigurationPackage.of(packageName, converted);
    }

    @Override
    public void afterPropertiesSet() {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalStateException(SERVICE_NAME_PROPERTY + " must not be null or blank");
        }
    }
}
