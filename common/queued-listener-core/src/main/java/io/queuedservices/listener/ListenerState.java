package io.queuedservices.listener;

/**
 * Activation state of a {@link DeferredListener}.
 */
public enum ListenerState {
    REGISTERED,
    RESOLVING,
    BOUND,
    FAILED
}
