package io.queuedservices.listener.credential;

/**
 * Where the listen-capable connection string comes from.
 */
public sealed interface CredentialSource permits CredentialSource.Literal, CredentialSource.Configured {

    String DEFAULT_PACKAGE_NAME = "Config";
    String DEFAULT_SECTION_NAME = "ServiceBus";
    String DEFAULT_PARAMETER_NAME = "ListenConnectionString";

    static CredentialSource literal(String connectionString) {
        return new Literal(connectionString);
    }

    /**
     * Reads {@code Config/ServiceBus/ListenConnectionString} through the activation context.
     */
    static CredentialSource configured() {
        return configured(ConfigurationAccessor.fromActivationContext());
    }

    static CredentialSource configured(ConfigurationAccessor accessor) {
        return new Configured(accessor, null, null, null);
    }

    static CredentialSource configured(ConfigurationAccessor accessor,
                                       String packageName,
                                       String sectionName,
                                       String parameterName) {
        return new Configured(accessor, packageName, sectionName, parameterName);
    }

    /**
     * A connection string supplied directly by the caller. Validation of its content is deferred to
     * activation.
     */
    record Literal(String connectionString) implements CredentialSource {

        @Override
        public String toString() {
            return "Literal[connectionString=***]";
        }
    }

    /**
     * A connection string read from host configuration. Null or blank names fall back to the defaults.
     */
    record Configured(ConfigurationAccessor accessor,
                      String packageName,
                      String sectionName,
                      String parameterName) implements CredentialSource {

        public Configured {
            packageName = defaultIfBlank(packageName, DEFAULT_PACKAGE_NAME);
            sectionName = defaultIfBlank(sectionName, DEFAULT_SECTION_NAME);
            parameterName = defaultIfBlank(parameterName, DEFAULT_PARAMETER_NAME);
        }

        /**
         * Returns {@code package/section/parameter} for diagnostics.
         */
        public String path() {
            return packageName + "/" + sectionName + "/" + parameterName;
        }

        private static String defaultIfBlank(String value, String fallback) {
            if (value == null) {
                return fallback;
            }
            String trimmed = value.trim();
            return trimmed.isEmpty() ? fallback : trimmed;
        }
    }
}
