package io.queuedservices.listener.spring;

import io.queuedservices.listener.address.NamespaceAddressConvention;
import io.queuedservices.listener.credential.ConfigurationAccessor;
import io.queuedservices.listener.credential.CredentialSource;
import io.queuedservices.listener.transport.BindingPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Listener settings bound from {@code queued.listener.*}.
 * <p>
 * When {@code connection-string} is set it is used literally; otherwise the connection string is read
 * from host configuration at {@code config.package-name/section-name/parameter-name}.
 */
@ConfigurationProperties(prefix = "queued.listener")
public class QueuedListenerProperties {

    private boolean enabled = true;
    private String connectionString;
    private final Config config = new Config();
    private final Address address = new Address();
    private final BindingPolicy binding = new BindingPolicy();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConnectionString() {
        return connectionString;
    }

    public void setConnectionString(String connectionString) {
        this.connectionString = connectionString;
    }

    public Config getConfig() {
        return config;
    }

    public Address getAddress() {
        return address;
    }

    public BindingPolicy getBinding() {
        return binding;
    }

    /**
     * Returns the literal source when a connection string is configured, the configured source otherwise.
     */
    public CredentialSource credentialSource(ConfigurationAccessor accessor) {
        if (connectionString != null && !connectionString.isBlank()) {
            return CredentialSource.literal(connectionString.trim());
        }
        return CredentialSource.configured(accessor, config.getPackageName(), config.getSectionName(),
            config.getParameterName());
    }

    public static class Config {

        private String packageName = CredentialSource.DEFAULT_PACKAGE_NAME;
        private String sectionName = CredentialSource.DEFAULT_SECTION_NAME;
        private String parameterName = CredentialSource.DEFAULT_PARAMETER_NAME;

        public String getPackageName() {
            return packageName;
        }

        public void setPackageName(String packageName) {
            this.packageName = packageName;
        }

        public String getSectionName() {
            return sectionName;
        }

        public void setSectionName(String sectionName) {
            this.sectionName = sectionName;
        }

        public String getParameterName() {
            return parameterName;
        }

        public void setParameterName(String parameterName) {
            this.parameterName = parameterName;
        }
    }

    public static class Address {

        private String scheme = NamespaceAddressConvention.DEFAULT_SCHEME;
        private String hostSuffix = NamespaceAddressConvention.DEFAULT_HOST_SUFFIX;

        public String getScheme() {
            return scheme;
        }

        public void setScheme(String scheme) {
            this.scheme = scheme;
        }

        public String getHostSuffix() {
            return hostSuffix;
        }

        public void setHostSuffix(String hostSuffix) {
            this.hostSuffix = hostSuffix;
        }
    }
}
