package io.queuedservices.listener.address;

import io.queuedservices.listener.ErrorCode;
import io.queuedservices.listener.QueuedListenerException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the messaging-fabric connection string grammar: {@code Key=Value} pairs separated by
 * {@code ;}. Keys are case-insensitive and values are split at the first {@code =} only, so
 * base64 keys keep their padding.
 * <p>
 * {@code Endpoint} may repeat; every occurrence adds endpoints. Any other repeated key is malformed.
 */
public final class ConnectionStringParser {

    static final String ENDPOINT = "endpoint";
    static final String SHARED_ACCESS_KEY_NAME = "sharedaccesskeyname";
    static final String SHARED_ACCESS_KEY = "sharedaccesskey";
    static final String ENTITY_PATH = "entitypath";
    static final String TRANSPORT_TYPE = "transporttype";
    static final String OPERATION_TIMEOUT = "operationtimeout";
    static final String RUNTIME_PORT = "runtimeport";

    private static final Set<String> KNOWN_KEYS = Set.of(
        ENDPOINT, SHARED_ACCESS_KEY_NAME, SHARED_ACCESS_KEY, ENTITY_PATH, TRANSPORT_TYPE, OPERATION_TIMEOUT, RUNTIME_PORT);
    private static final Pattern TIME_SPAN = Pattern.compile("(\\d+):(\\d{1,2}):(\\d{1,2})");

    /**
     * @throws QueuedListenerException with {@link ErrorCode#MALFORMED_CONNECTION_STRING} when the string
     *                                 does not follow the grammar
     */
    public ConnectionDescriptor parse(String connectionString) {
        List<URI> endpoints = new ArrayList<>();
        String keyName = null;
        String key = null;
        String entityPath = null;
        String transportType = null;
        Duration operationTimeout = null;
        Integer runtimePort = null;
        Set<String> seen = new HashSet<>();

        String source = connectionString == null ? "" : connectionString;
        for (String segment : source.split(";")) {
            if (segment.isBlank()) {
                continue;
            }
            int separator = segment.indexOf('=');
            if (separator <= 0) {
                throw malformed("segment " + (seen.size() + 1) + " is not a Key=Value pair");
            }
            String name = segment.substring(0, separator).trim().toLowerCase(Locale.ROOT);
            String value = segment.substring(separator + 1).trim();
            if (!KNOWN_KEYS.contains(name)) {
                throw malformed("unsupported key '" + segment.substring(0, separator).trim() + "'");
            }
            if (!seen.add(name) && !ENDPOINT.equals(name)) {
                throw malformed("duplicate key '" + segment.substring(0, separator).trim() + "'");
            }
            switch (name) {
                case ENDPOINT -> endpoints.addAll(parseEndpoints(value));
                case SHARED_ACCESS_KEY_NAME -> keyName = emptyToNull(value);
                case SHARED_ACCESS_KEY -> key = emptyToNull(value);
                case ENTITY_PATH -> entityPath = emptyToNull(value);
                case TRANSPORT_TYPE -> transportType = emptyToNull(value);
                case OPERATION_TIMEOUT -> operationTimeout = parseTimeout(value);
                case RUNTIME_PORT -> runtimePort = parsePort(value);
                default -> throw new IllegalStateException("Unhandled key " + name);
            }
        }
        return new ConnectionDescriptor(endpoints, keyName, key, entityPath, transportType, operationTimeout, runtimePort);
    }

    private static List<URI> parseEndpoints(String value) {
        List<URI> endpoints = new ArrayList<>();
        for (String candidate : value.split(",")) {
            String trimmed = candidate.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            URI uri;
            try {
                uri = new URI(trimmed);
            } catch (URISyntaxException ex) {
                throw new QueuedListenerException(ErrorCode.MALFORMED_CONNECTION_STRING,
                    "Malformed connection string: invalid endpoint '" + trimmed + "'", ex);
            }
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw malformed("endpoint '" + trimmed + "' has no host");
            }
            endpoints.add(uri);
        }
        return endpoints;
    }

    private static Duration parseTimeout(String value) {
        Matcher matcher = TIME_SPAN.matcher(value);
        if (matcher.matches()) {
            try {
                return Duration.ofHours(Long.parseLong(matcher.group(1)))
                    .plusMinutes(Long.parseLong(matcher.group(2)))
                    .plusSeconds(Long.parseLong(matcher.group(3)));
            } catch (NumberFormatException | ArithmeticException ex) {
                throw new QueuedListenerException(ErrorCode.MALFORMED_CONNECTION_STRING,
                    "Malformed connection string: OperationTimeout out of range '" + value + "'", ex);
            }
        }
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException ex) {
            throw new QueuedListenerException(ErrorCode.MALFORMED_CONNECTION_STRING,
                "Malformed connection string: invalid OperationTimeout '" + value + "'", ex);
        }
    }

    private static Integer parsePort(String value) {
        try {
            int port = Integer.parseInt(value);
            if (port < 1 || port > 65535) {
                throw malformed("RuntimePort out of range: " + value);
            }
            return port;
        } catch (NumberFormatException ex) {
            throw new QueuedListenerException(ErrorCode.MALFORMED_CONNECTION_STRING,
                "Malformed connection string: invalid RuntimePort '" + value + "'", ex);
        }
    }

    private static String emptyToNull(String value) {
        return value.isEmpty() ? null : value;
    }

    private static QueuedListenerException malformed(String detail) {
        return new QueuedListenerException(ErrorCode.MALFORMED_CONNECTION_STRING, "Malformed connection string: " + detail);
    }
}
