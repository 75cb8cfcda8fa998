package io.queuedservices.listener.dispatch;

/**
 * Hook that wraps the invocation of a contract operation. Endpoint behaviors register interceptors for
 * cross-cutting concerns such as logging.
 */
@FunctionalInterface
public interface DispatchInterceptor {

    /**
     * Applies cross-cutting logic around an operation invocation.
     *
     * @return the operation result, {@code null} for one-way operations
     */
    Object intercept(InboundMessage message, Chain chain) throws Exception;

    interface Chain {
        /**
         * Invokes the next interceptor or the operation itself.
         */
        Object proceed(InboundMessage message) throws Exception;
    }
}
