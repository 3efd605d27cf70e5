package com.ouc.arq.sdk;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Window and timer parameters shared by a sender and its receiver.
 * Both ends must be built from equal configurations.
 */
public final class ProtocolConfig {
    public static final String RESOURCE = "arq-protocol.properties";

    public static final String WINDOW_SIZE_KEY = "arq.window-size";
    public static final String SEQ_SPACE_KEY = "arq.seq-space";
    public static final String TIMEOUT_KEY = "arq.timeout";

    public static final int DEFAULT_WINDOW_SIZE = 6;
    public static final int DEFAULT_SEQ_SPACE = 12;
    public static final long DEFAULT_TIMEOUT = 16;

    private final int windowSize;
    private final int seqSpace;
    private final long timeout;

    public ProtocolConfig(int windowSize, int seqSpace, long timeout) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("window size must be positive, got " + windowSize);
        }
        // Selective Repeat: an old and a new packet sharing a slot must stay distinguishable.
        if (seqSpace < 2 * windowSize) {
            throw new IllegalArgumentException(
                    "sequence space " + seqSpace + " must be at least twice the window size " + windowSize);
        }
        if (timeout <= 0) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        this.windowSize = windowSize;
        this.seqSpace = seqSpace;
        this.timeout = timeout;
    }

    public static ProtocolConfig defaults() {
        return new ProtocolConfig(DEFAULT_WINDOW_SIZE, DEFAULT_SEQ_SPACE, DEFAULT_TIMEOUT);
    }

    public static ProtocolConfig fromProperties(Properties props) {
        return new ProtocolConfig(
                (int) readLong(props, WINDOW_SIZE_KEY, DEFAULT_WINDOW_SIZE),
                (int) readLong(props, SEQ_SPACE_KEY, DEFAULT_SEQ_SPACE),
                readLong(props, TIMEOUT_KEY, DEFAULT_TIMEOUT));
    }

    /**
     * Reads {@value #RESOURCE} from the classpath, or returns the defaults if it is absent.
     */
    public static ProtocolConfig load() {
        try (InputStream in = ProtocolConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    private static long readLong(Properties props, String key, long fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad value for " + key + ": " + value, e);
        }
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getSeqSpace() {
        return seqSpace;
    }

    public long getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "ProtocolConfig[window=" + windowSize + ", seqSpace=" + seqSpace + ", timeout=" + timeout + "]";
    }
}
