package com.ouc.arq.sdk;

/**
 * One protocol entity, driven entirely by events from its {@link SystemContext}.
 * The environment delivers one event at a time and each handler runs to completion.
 */
public interface TransportProtocol {
    /**
     * Called exactly once before any other event.
     */
    void init(SystemContext ctx);

    /**
     * Called when a packet arrives from the network.
     */
    void onPacket(SystemContext ctx, Packet packet);

    /**
     * Called when a timer started through {@link SystemContext#startTimer} expires.
     */
    void onTimer(SystemContext ctx, int timerId);

    /**
     * Called when the application layer wants a message sent reliably.
     */
    void onAppData(SystemContext ctx, byte[] data);
}
