package io.queuedservices.listener.credential;

import io.queuedservices.listener.ErrorCode;
import io.queuedservices.listener.ListenerError;
import io.queuedservices.listener.QueuedListenerException;
import io.queuedservices.listener.host.ActivationContext;
import io.queuedservices.listener.host.ConfigurationProperty;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the plaintext connection string for a {@link CredentialSource}. Nothing is cached; each
 * activation reads the host configuration again.
 */
public final class CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    /**
     * @throws QueuedListenerException with {@code INVALID_ARGUMENT} or {@code CONFIGURATION_ERROR}
     */
    public String resolve(CredentialSource source, ActivationContext context) {
        Objects.requireNonNull(source, "source");
        if (source instanceof CredentialSource.Literal literal) {
            return resolveLiteral(literal);
        }
        return resolveConfigured((CredentialSource.Configured) source, context);
    }

    private static String resolveLiteral(CredentialSource.Literal literal) {
        String connectionString = literal.connectionString();
        if (connectionString == null || connectionString.isEmpty()) {
            throw new QueuedListenerException(ErrorCode.EMPTY_CONNECTION_STRING,
                "connectionString must not be null or empty");
        }
        return connectionString;
    }

    private static String resolveConfigured(CredentialSource.Configured source, ActivationContext context) {
        if (context == null) {
            throw new QueuedListenerException(ListenerError.nullArgument("context"));
        }
        if (source.accessor() == null) {
            throw new QueuedListenerException(ListenerError.nullArgument("accessor"));
        }
        ConfigurationProperty property = source.accessor()
            .lookup(context, source.packageName(), source.sectionName(), source.parameterName())
            .orElseThrow(() -> new QueuedListenerException(ErrorCode.MISSING_PARAMETER,
                "Configuration parameter " + source.path() + " was not found"));
        if (!property.encrypted()) {
            log.debug("Resolved connection string from {} for instance {}", source.path(), context.instanceId());
            return property.value();
        }
        try {
            String plainText = context.valueProtector().decrypt(property.value());
            log.debug("Decrypted connection string from {} for instance {}", source.path(), context.instanceId());
            return plainText;
        } catch (RuntimeException ex) {
            throw new QueuedListenerException(ErrorCode.DECRYPTION_FAILED,
                "Unable to decrypt configuration parameter " + source.path(), ex);
        }
    }
}
