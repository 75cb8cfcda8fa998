package io.queuedservices.listener;

/**
 * Top-level classification of listener pipeline failures.
 */
public enum ErrorKind {
    /**
     * A caller-supplied parameter is null, empty or otherwise unusable.
     */
    INVALID_ARGUMENT,
    /**
     * The resolved connection descriptor or host configuration cannot be used to bind a listener.
     */
    CONFIGURATION_ERROR
}
