package com.ouc.arq.sdk;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Wraps an entity's context and mirrors every call to Log4j before passing it on.
 */
public final class LoggingSystemContext implements SystemContext {
    private static final Logger LOG = LogManager.getLogger(LoggingSystemContext.class);

    private final String entity;
    private final SystemContext delegate;

    public LoggingSystemContext(String entity, SystemContext delegate) {
        this.entity = entity;
        this.delegate = delegate;
    }

    @Override
    public void sendPacket(Packet packet) {
        LOG.debug("[{}] t={} to network: {}", entity, delegate.now(), packet);
        delegate.sendPacket(packet);
    }

    @Override
    public void startTimer(long delay, int timerId) {
        LOG.debug("[{}] t={} start timer {} for {}", entity, delegate.now(), timerId, delay);
        delegate.startTimer(delay, timerId);
    }

    @Override
    public void cancelTimer(int timerId) {
        LOG.debug("[{}] t={} cancel timer {}", entity, delegate.now(), timerId);
        delegate.cancelTimer(timerId);
    }

    @Override
    public void deliverData(byte[] data) {
        LOG.debug("[{}] t={} deliver {} bytes to application", entity, delegate.now(), data.length);
        delegate.deliverData(data);
    }

    @Override
    public void log(String message) {
        LOG.info("[{}] t={} {}", entity, delegate.now(), message);
        delegate.log(message);
    }

    @Override
    public long now() {
        return delegate.now();
    }

    @Override
    public void recordMetric(String name, double value) {
        LOG.trace("[{}] metric {}={}", entity, name, value);
        delegate.recordMetric(name, value);
    }
}
