package io.queuedservices.listener;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import io.queuedservices.listener.auth.SharedAccessSignatureTokenProvider;
import io.queuedservices.listener.auth.TransportClientEndpointBehavior;
import io.queuedservices.listener.credential.ConfigurationAccessor;
import io.queuedservices.listener.credential.CredentialSource;
import io.queuedservices.listener.endpoint.EndpointBehavior;
import io.queuedservices.listener.endpoint.MessageLoggingBehavior;
import io.queuedservices.listener.host.ActivationContext;
import io.queuedservices.listener.host.AesGcmValueProtector;
import io.queuedservices.listener.host.ConfigurationPackage;
import io.queuedservices.listener.host.ConfigurationSection;
import io.queuedservices.listener.host.SimpleActivationContext;
import io.queuedservices.listener.transport.BindingPolicy;
import io.queuedservices.listener.transport.ListenerBinding;
import io.queuedservices.listener.transport.TransportListener;
import io.queuedservices.listener.transport.TransportListenerFactory;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class QueuedListenerFactoryTest {

    private static final String CONNECTION_STRING =
        "Endpoint=sb://foo.bar.net/;SharedAccessKeyName=K;SharedAccessKey=S";

    interface IMyContract {
        String echo(String value);
    }

    private final IMyContract service = value -> value;
    private final RecordingTransportListenerFactory transport = new RecordingTransportListenerFactory();
    private final QueuedListenerFactory factory = new QueuedListenerFactory(transport);
    private final ActivationContext context = SimpleActivationContext.builder("echo", "instance-1").build();

    @Test
    void createDefersConfigurationAccessUntilActivation() {
        ConfigurationAccessor accessor = mock(ConfigurationAccessor.class);

        ListenerResult<DeferredListener<IMyContract>> result = factory.create(QueuedListenerOptions.builder(IMyContract.class)
            .serviceObject(service)
            .binding(new BindingPolicy())
            .credentialSource(CredentialSource.configured(accessor))
            .build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.orElseThrow().state()).isEqualTo(ListenerState.REGISTERED);
        assertThat(result.orElseThrow().outcome()).isEmpty();
        verifyNoInteractions(accessor);
        assertThat(transport.bindings).isEmpty();
    }

    @Test
    void literalDefersParsingUntilActivation() {
        ListenerResult<DeferredListener<IMyContract>> result = factory.create(options("no endpoint here=1").build());

        assertThat(result.isSuccess()).isTrue();
        ListenerResult<TransportListener> activation = result.orElseThrow().activate(context);
        assertThat(activation.error()).hasValueSatisfying(
            error -> assertThat(error.code()).isEqualTo(ErrorCode.MALFORMED_CONNECTION_STRING));
    }

    @Test
    void rejectsEmptyLiteralBeforeActivation() {
        ListenerResult<DeferredListener<IMyContract>> empty = factory.create(options("").build());
        ListenerResult<DeferredListener<IMyContract>> missing = factory.create(options(null).build());

        assertThat(empty.error()).hasValueSatisfying(error -> {
            assertThat(error.kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
            assertThat(error.code()).isEqualTo(ErrorCode.EMPTY_CONNECTION_STRING);
        });
        assertThat(missing.error()).map(ListenerError::kind).contains(ErrorKind.INVALID_ARGUMENT);
        assertThatThrownBy(empty::orElseThrow)
            .isInstanceOfSatisfying(QueuedListenerException.class,
                ex -> assertThat(ex.code()).isEqualTo(ErrorCode.EMPTY_CONNECTION_STRING));
    }

    @Test
    void rejectsMissingArgumentsNamingTheParameter() {
        assertThat(factory.create(null).error()).map(ListenerError::message).contains("options must not be null");
        assertThat(factory.create(options(CONNECTION_STRING).serviceObject(null).build()).error())
            .map(ListenerError::message).contains("serviceObject must not be null");
        assertThat(factory.create(options(CONNECTION_STRING).binding(null).build()).error())
            .map(ListenerError::message).contains("binding must not be null");
        assertThat(factory.create(options(CONNECTION_STRING).behaviors(null).build()).error())
            .map(ListenerError::message).contains("behaviors must not be null");
        assertThat(factory.create(options(CONNECTION_STRING).behavior(null).build()).error())
            .map(ListenerError::message).contains("behaviors[0] must not be null");
        assertThat(factory.create(options(CONNECTION_STRING).credentialSource(null).build()).error())
            .map(ListenerError::message).contains("credentialSource must not be null");
        assertThat(factory.create(QueuedListenerOptions.builder(IMyContract.class)
            .serviceObject(service)
            .binding(new BindingPolicy())
            .credentialSource(CredentialSource.configured(null))
            .build()).error())
            .map(ListenerError::message).contains("accessor must not be null");
    }

    @SuppressWarnings("unchecked")
    @Test
    void rejectsServiceObjectNotImplementingContract() {
        QueuedListenerOptions.Builder<Object> builder =
            (QueuedListenerOptions.Builder<Object>) (QueuedListenerOptions.Builder<?>) QueuedListenerOptions.builder(IMyContract.class);
        builder.serviceObject("not a service").binding(new BindingPolicy()).connectionString(CONNECTION_STRING);

        ListenerResult<?> result = factory.create(builder.build());

        assertThat(result.error()).map(ListenerError::code).contains(ErrorCode.CONTRACT_MISMATCH);
    }

    @Test
    void bindsListenerWithDerivedAddressAndAuthentication() {
        BindingPolicy binding = new BindingPolicy();
        DeferredListener<IMyContract> deferred = factory.create(options(CONNECTION_STRING).binding(binding).build())
            .orElseThrow();

        TransportListener listener = deferred.activate(context).orElseThrow();

        assertThat(deferred.state()).isEqualTo(ListenerState.BOUND);
        ListenerBinding<?> recorded = transport.bindings.get(0);
        assertThat(recorded.serviceObject()).isSameAs(service);
        assertThat(recorded.context()).isSameAs(context);
        assertThat(recorded.binding()).isSameAs(binding);
        assertThat(recorded.address().namespace()).isEqualTo("foo");
        assertThat(recorded.address().queueName()).isEqualTo("IMyContract");
        assertThat(recorded.endpointHost()).isEqualTo("foo.bar.net");
        assertThat(recorded.host()).isEqualTo("foo.bar.net");
        assertThat(listener.endpoint().address().uri())
            .isEqualTo(URI.create("sb://foo.servicebus.windows.net/IMyContract/"));

        List<EndpointBehavior> behaviors = listener.endpoint().behaviors().asList();
        assertThat(behaviors).hasSize(1);
        TransportClientEndpointBehavior auth = (TransportClientEndpointBehavior) behaviors.get(0);
        SharedAccessSignatureTokenProvider tokens = (SharedAccessSignatureTokenProvider) auth.tokenProvider();
        assertThat(tokens.keyName()).isEqualTo("K");
        assertThat(tokens.sharedAccessKey()).isEqualTo("S");
    }

    @Test
    void authenticationPrecedesCallerBehaviorsInOrder() {
        List<EndpointBehavior> callerBehaviors = new ArrayList<>();
        callerBehaviors.add(new MessageLoggingBehavior());
        callerBehaviors.add(new EndpointBehavior() {
        });
        callerBehaviors.add(new MessageLoggingBehavior());

        TransportListener listener = factory.create(options(CONNECTION_STRING).behaviors(callerBehaviors).build())
            .orElseThrow()
            .activate(context)
            .orElseThrow();

        List<EndpointBehavior> behaviors = listener.endpoint().behaviors().asList();
        assertThat(behaviors).hasSize(4);
        assertThat(behaviors.get(0)).isInstanceOf(TransportClientEndpointBehavior.class);
        assertThat(behaviors.subList(1, 4)).containsExactlyElementsOf(callerBehaviors);
    }

    @Test
    void queueNameProviderOverridesContractName() {
        TransportListener listener = factory.create(options(CONNECTION_STRING).queueName("custom-queue").build())
            .orElseThrow()
            .activate(context)
            .orElseThrow();

        assertThat(listener.endpoint().address().uri().getPath()).isEqualTo("/custom-queue/");
    }

    @Test
    void endpointCountErrorsSurfaceAsConfigurationFailures() {
        DeferredListener<IMyContract> none = factory.create(options("SharedAccessKeyName=K;SharedAccessKey=S").build())
            .orElseThrow();
        DeferredListener<IMyContract> many = factory.create(options(
            "Endpoint=sb://a.example.net/,sb://b.example.net/;SharedAccessKeyName=K;SharedAccessKey=S").build())
            .orElseThrow();

        assertThat(none.activate(context).error()).map(ListenerError::code).contains(ErrorCode.NO_ENDPOINT);
        assertThat(many.activate(context).error()).map(ListenerError::code).contains(ErrorCode.AMBIGUOUS_ENDPOINT);
        assertThat(none.state()).isEqualTo(ListenerState.FAILED);
        assertThat(transport.bindings).isEmpty();
    }

    @Test
    void repeatedEndpointKeysAreAmbiguous() {
        DeferredListener<IMyContract> deferred = factory.create(options(
            "Endpoint=sb://a.example.net/;Endpoint=sb://b.example.net/;SharedAccessKeyName=K;SharedAccessKey=S").build())
            .orElseThrow();

        assertThat(deferred.activate(context).error()).map(ListenerError::code).contains(ErrorCode.AMBIGUOUS_ENDPOINT);
    }

    @Test
    void oversizedOperationTimeoutIsMalformedFailure() {
        DeferredListener<IMyContract> deferred = factory.create(options(CONNECTION_STRING
            + ";OperationTimeout=99999999999999999999:00:00").build()).orElseThrow();

        ListenerResult<TransportListener> result = deferred.activate(context);

        assertThat(result.error()).map(ListenerError::code).contains(ErrorCode.MALFORMED_CONNECTION_STRING);
        assertThat(deferred.state()).isEqualTo(ListenerState.FAILED);
        assertThat(transport.bindings).isEmpty();
    }

    @Test
    void missingKeyIsMissingCredential() {
        DeferredListener<IMyContract> deferred = factory.create(
            options("Endpoint=sb://foo.bar.net/;SharedAccessKeyName=K").build()).orElseThrow();

        assertThat(deferred.activate(context).error()).map(ListenerError::code).contains(ErrorCode.MISSING_CREDENTIAL);
        assertThat(transport.bindings).isEmpty();
    }

    @Test
    void configuredEncryptedConnectionStringIsDecryptedAndParsed() {
        AesGcmValueProtector protector = new AesGcmValueProtector(new byte[32]);
        ActivationContext encryptedContext = SimpleActivationContext.builder("echo", "instance-1")
            .configurationPackage(ConfigurationPackage.of("Config", List.of(ConfigurationSection.builder("ServiceBus")
                .encrypted("ListenConnectionString", protector.protect(CONNECTION_STRING))
                .build())))
            .valueProtector(protector)
            .build();

        TransportListener listener = factory.create(QueuedListenerOptions.builder(IMyContract.class)
                .serviceObject(service)
                .binding(new BindingPolicy())
                .build())
            .orElseThrow()
            .activate(encryptedContext)
            .orElseThrow();

        assertThat(listener.endpoint().address().namespace()).isEqualTo("foo");
    }

    @Test
    void nullContextIsInvalidArgumentAtActivation() {
        DeferredListener<IMyContract> deferred = factory.create(options(CONNECTION_STRING).build()).orElseThrow();

        ListenerResult<TransportListener> result = deferred.activate(null);

        assertThat(result.error()).hasValueSatisfying(error -> {
            assertThat(error.kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
            assertThat(error.message()).contains("context");
        });
        assertThat(deferred.state()).isEqualTo(ListenerState.FAILED);
    }

    @Test
    void activatesOnlyOnce() {
        DeferredListener<IMyContract> deferred = factory.create(options(CONNECTION_STRING).build()).orElseThrow();
        deferred.activate(context);

        assertThatThrownBy(() -> deferred.activate(context))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already activated");
        assertThat(transport.bindings).hasSize(1);
        assertThat(deferred.outcome()).hasValueSatisfying(outcome -> assertThat(outcome.isSuccess()).isTrue());
    }

    @Test
    void transportFailuresPropagateAndMarkListenerFailed() {
        QueuedListenerFactory failing = new QueuedListenerFactory(new TransportListenerFactory() {
            @Override
            public <C> TransportListener create(ListenerBinding<C> binding) {
                throw new IllegalStateException("transport unavailable");
            }
        });
        DeferredListener<IMyContract> deferred = failing.create(options(CONNECTION_STRING).build()).orElseThrow();

        assertThatThrownBy(() -> deferred.activate(context)).hasMessage("transport unavailable");
        assertThat(deferred.state()).isEqualTo(ListenerState.FAILED);
    }

    private QueuedListenerOptions.Builder<IMyContract> options(String connectionString) {
        return QueuedListenerOptions.builder(IMyContract.class)
            .serviceObject(service)
            .binding(new BindingPolicy())
            .connectionString(connectionString);
    }
}
