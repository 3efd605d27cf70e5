package com.ouc.arq.sdk;

/**
 * The capability provided by the network environment to one protocol entity.
 * Protocols call these methods to reach the channel, the timer and the application layer.
 */
public interface SystemContext {
    /**
     * Hand a packet to the unreliable channel. It may be lost, corrupted or delayed,
     * but packets that get through keep their order.
     */
    void sendPacket(Packet packet);

    /**
     * Start a timer.
     * @param delay Interval in simulation ticks.
     * @param timerId Identifies the timer when it expires.
     */
    void startTimer(long delay, int timerId);

    /**
     * Cancel a running timer.
     */
    void cancelTimer(int timerId);

    /**
     * Deliver a payload to the application layer.
     * Call this only with valid, in-order data, once per payload.
     */
    void deliverData(byte[] data);

    /**
     * Log a trace line to the environment's debug output.
     */
    void log(String message);

    /**
     * Current simulation time in ticks.
     */
    long now();

    void recordMetric(String name, double value);
}
