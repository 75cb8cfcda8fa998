package io.queuedservices.listener.dispatch;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Invokes operations of a service contract interface on a service object. The operation name is the
 * contract method name; overloaded operations are rejected up front.
 * <p>
 * Argument decoding: operations without parameters ignore the body, single-parameter operations read
 * the whole JSON body as that parameter, and multi-parameter operations expect a JSON array with one
 * element per parameter.
 *
 * @param <C> service contract type
 */
public final class ServiceContractInvoker<C> implements OperationInvoker {

    private final Class<C> contract;
    private final C service;
    private final ObjectMapper objectMapper;
    private final Map<String, Method> operations;

    public ServiceContractInvoker(Class<C> contract, C service, ObjectMapper objectMapper) {
        this.contract = Objects.requireNonNull(contract, "contract");
        this.service = Objects.requireNonNull(service, "service");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        if (!contract.isInterface()) {
            throw new IllegalArgumentException("Service contract " + contract.getName() + " must be an interface");
        }
        this.operations = resolveOperations(contract);
    }

    public Class<C> contract() {
        return contract;
    }

    public Set<String> operationNames() {
        return operations.keySet();
    }

    @Override
    public Object invoke(InboundMessage message) throws Exception {
        Method method = operations.get(message.operation());
        if (method == null) {
            throw new IllegalArgumentException(
                "Operation '" + message.operation() + "' is not defined by " + contract.getSimpleName());
        }
        Object[] arguments = decodeArguments(method, message);
        try {
            return method.invoke(service, arguments);
        } catch (InvocationTargetException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw ex;
        }
    }

    private Object[] decodeArguments(Method method, InboundMessage message) throws IOException {
        Type[] parameterTypes = method.getGenericParameterTypes();
        if (parameterTypes.length == 0) {
            return new Object[0];
        }
        if (parameterTypes.length == 1) {
            JavaType type = objectMapper.constructType(parameterTypes[0]);
            if (message.body().length == 0) {
                return new Object[] {null};
            }
            return new Object[] {objectMapper.readValue(message.body(), type)};
        }
        JsonNode root = objectMapper.readTree(message.body());
        if (root == null || !root.isArray() || root.size() != parameterTypes.length) {
            throw new IllegalArgumentException("Operation '" + message.operation() + "' expects a JSON array of "
                + parameterTypes.length + " arguments");
        }
        Object[] arguments = new Object[parameterTypes.length];
        for (int i = 0; i < parameterTypes.length; i++) {
            JavaType type = objectMapper.constructType(parameterTypes[i]);
            arguments[i] = objectMapper.readerFor(type).readValue(root.get(i));
        }
        return arguments;
    }

    private static Map<String, Method> resolveOperations(Class<?> contract) {
        Map<String, Method> operations = new LinkedHashMap<>();
        for (Method method : contract.getMethods()) {
            if (method.isDefault() || Modifier.isStatic(method.getModifiers())) {
                continue;
            }
            Method previous = operations.putIfAbsent(method.getName(), method);
            if (previous != null) {
                throw new IllegalArgumentException("Service contract " + contract.getName()
                    + " declares overloaded operation '" + method.getName() + "'");
            }
            method.setAccessible(true);
        }
        if (operations.isEmpty()) {
            throw new IllegalArgumentException("Service contract " + contract.getName() + " declares no operations");
        }
        return Collections.unmodifiableMap(operations);
    }
}
