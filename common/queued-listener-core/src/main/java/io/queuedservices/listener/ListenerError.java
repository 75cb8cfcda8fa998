package io.queuedservices.listener;

import java.util.Objects;

/**
 * Describes why the listener pipeline could not produce a result.
 *
 * @param code    failure code; {@link #kind()} is derived from it
 * @param message human readable description, never containing key material
 */
public record ListenerError(ErrorCode code, String message) {

    public ListenerError {
        Objects.requireNonNull(code, "code");
        if (message == null || message.isBlank()) {
            message = code.name();
        }
    }

    public ErrorKind kind() {
        return code.kind();
    }

    public static ListenerError nullArgument(String parameterName) {
        return new ListenerError(ErrorCode.NULL_ARGUMENT, parameterName + " must not be null");
    }

    public static ListenerError of(ErrorCode code, String message) {
        return new ListenerError(code, message);
    }

    @Override
    public String toString() {
        return kind() + "/" + code + ": " + message;
    }
}
