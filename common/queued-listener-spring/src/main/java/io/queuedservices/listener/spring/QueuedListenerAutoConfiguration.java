package io.queuedservices.listener.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.queuedservices.listener.QueuedListenerFactory;
import io.queuedservices.listener.address.NamespaceAddressConvention;
import io.queuedservices.listener.credential.ConfigurationAccessor;
import io.queuedservices.listener.host.ActivationContext;
import io.queuedservices.listener.host.AesGcmValueProtector;
import io.queuedservices.listener.host.ValueProtector;
import io.queuedservices.listener.transport.BindingPolicy;
import io.queuedservices.listener.transport.TransportListenerFactory;
import io.queuedservices.listener.transport.rabbit.RabbitTransportListenerFactory;
import java.util.List;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the queued listener pipeline: address convention, value protection, activation context,
 * RabbitMQ transport, the listener factory and the lifecycle that opens one listener per
 * {@link QueuedServiceRegistration} bean.
 */
@Configuration(proxyBeanMethods = false)
@AutoConfigureAfter(JacksonAutoConfiguration.class)
@ConditionalOnClass(SimpleMessageListenerContainer.class)
@ConditionalOnProperty(prefix = "queued.listener", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties({QueuedListenerProperties.class, QueuedHostProperties.class})
public class QueuedListenerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    NamespaceAddressConvention namespaceAddressConvention(QueuedListenerProperties properties) {
        QueuedListenerProperties.Address address = properties.getAddress();
        return new NamespaceAddressConvention(address.getScheme(), address.getHostSuffix());
    }

    @Bean
    @ConditionalOnMissingBean
    ValueProtector queuedValueProtector(QueuedHostProperties hostProperties) {
        String key = hostProperties.getEncryptionKey();
        if (key == null || key.isBlank()) {
            return ValueProtector.UNAVAILABLE;
        }
        return AesGcmValueProtector.fromBase64Key(key);
    }

    @Bean
    @ConditionalOnMissingBean
    ActivationContext queuedActivationContext(QueuedHostProperties hostProperties, ValueProtector valueProtector) {
        return hostProperties.toActivationContext(valueProtector);
    }

    @Bean
    @ConditionalOnMissingBean
    ConfigurationAccessor queuedConfigurationAccessor() {
        return ConfigurationAccessor.fromActivationContext();
    }

    @Bean
    @ConditionalOnMissingBean
    TransportListenerFactory queuedTransportListenerFactory(ObjectProvider<ObjectMapper> objectMapper) {
        return new RabbitTransportListenerFactory(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    QueuedListenerFactory queuedListenerFactory(TransportListenerFactory transportListenerFactory,
                                                NamespaceAddressConvention convention) {
        return new QueuedListenerFactory(transportListenerFactory, convention);
    }

    @Bean
    @ConditionalOnMissingBean
    BindingPolicy queuedBindingPolicy(QueuedListenerProperties properties) {
        return properties.getBinding();
    }

    @Bean
    @ConditionalOnMissingBean
    QueuedListenerLifecycle queuedListenerLifecycle(QueuedListenerFactory factory,
                                                    ActivationContext context,
                                                    ConfigurationAccessor accessor,
                                                    QueuedListenerProperties properties,
                                                    BindingPolicy binding,
                                                    ObjectProvider<QueuedServiceRegistration<?>> registrations) {
        List<QueuedServiceRegistration<?>> services = registrations.orderedStream().toList();
        return new QueuedListenerLifecycle(factory, context, properties.credentialSource(accessor), binding, services);
    }
}
