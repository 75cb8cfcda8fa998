package io.queuedservices.listener;

import java.util.Objects;

/**
 * Raised inside the listener pipeline and by {@link ListenerResult#orElseThrow()}.
 */
public class QueuedListenerException extends RuntimeException {

    private final transient ListenerError error;

    public QueuedListenerException(ListenerError error) {
        super(Objects.requireNonNull(error, "error").toString());
        this.error = error;
    }

    public QueuedListenerException(ListenerError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error").toString(), cause);
        this.error = error;
    }

    public QueuedListenerException(ErrorCode code, String message) {
        this(ListenerError.of(code, message));
    }

    public QueuedListenerException(ErrorCode code, String message, Throwable cause) {
        this(ListenerError.of(code, message), cause);
    }

    public ListenerError error() {
        return error;
    }

    public ErrorKind kind() {
        return error.kind();
    }

    public ErrorCode code() {
        return error.code();
    }
}
