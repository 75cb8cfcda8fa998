package io.queuedservices.listener.transport;

import java.time.Duration;

/**
 * Transport configuration applied to a queued listener. The binding pipeline only passes it through;
 * the transport interprets it.
 */
public class BindingPolicy {

    private ReceiveMode receiveMode = ReceiveMode.PEEK_LOCK;
    private int prefetchCount = 50;
    private int maxConcurrentCalls = 1;
    private int maxReceivedMessageSize = 65_536;
    private int port = 5672;
    private String virtualHost = "/";
    private Duration closeTimeout = Duration.ofSeconds(30);

    public ReceiveMode getReceiveMode() {
        return receiveMode;
    }

    public void setReceiveMode(ReceiveMode receiveMode) {
        this.receiveMode = receiveMode == null ? ReceiveMode.PEEK_LOCK : receiveMode;
    }

    public int getPrefetchCount() {
        return prefetchCount;
    }

    public void setPrefetchCount(int prefetchCount) {
        this.prefetchCount = requirePositive(prefetchCount, "prefetchCount");
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    public void setMaxConcurrentCalls(int maxConcurrentCalls) {
        this.maxConcurrentCalls = requirePositive(maxConcurrentCalls, "maxConcurrentCalls");
    }

    public int getMaxReceivedMessageSize() {
        return maxReceivedMessageSize;
    }

    public void setMaxReceivedMessageSize(int maxReceivedMessageSize) {
        this.maxReceivedMessageSize = requirePositive(maxReceivedMessageSize, "maxReceivedMessageSize");
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
        this.port = port;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    public void setVirtualHost(String virtualHost) {
        this.virtualHost = virtualHost == null || virtualHost.isBlank() ? "/" : virtualHost.trim();
    }

    public Duration getCloseTimeout() {
        return closeTimeout;
    }

    public void setCloseTimeout(Duration closeTimeout) {
        if (closeTimeout == null || closeTimeout.isNegative()) {
            throw new IllegalArgumentException("closeTimeout must not be null or negative");
        }
        this.closeTimeout = closeTimeout;
    }

    private static int requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    @Override
    public String toString() {
        return "BindingPolicy[receiveMode=" + receiveMode + ", prefetchCount=" + prefetchCount
            + ", maxConcurrentCalls=" + maxConcurrentCalls + ", maxReceivedMessageSize=" + maxReceivedMessageSize
            + ", port=" + port + ", virtualHost=" + virtualHost + ", closeTimeout=" + closeTimeout + "]";
    }
}
