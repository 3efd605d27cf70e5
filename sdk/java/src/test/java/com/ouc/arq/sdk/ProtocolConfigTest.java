package com.ouc.arq.sdk;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolConfigTest {

    @Test
    void defaults() {
        ProtocolConfig config = ProtocolConfig.defaults();
        assertEquals(6, config.getWindowSize());
        assertEquals(12, config.getSeqSpace());
        assertEquals(16, config.getTimeout());
    }

    @Test
    void bundledResourceMatchesDefaults() {
        ProtocolConfig config = ProtocolConfig.load();
        assertEquals(6, config.getWindowSize());
        assertEquals(12, config.getSeqSpace());
        assertEquals(16, config.getTimeout());
    }

    @Test
    void readsPropertiesAndFallsBack() {
        Properties props = new Properties();
        props.setProperty(ProtocolConfig.WINDOW_SIZE_KEY, "4");
        props.setProperty(ProtocolConfig.SEQ_SPACE_KEY, " 9 ");
        ProtocolConfig config = ProtocolConfig.fromProperties(props);

        assertEquals(4, config.getWindowSize());
        assertEquals(9, config.getSeqSpace());
        assertEquals(ProtocolConfig.DEFAULT_TIMEOUT, config.getTimeout());
    }

    @Test
    void rejectsNonNumericValue() {
        Properties props = new Properties();
        props.setProperty(ProtocolConfig.TIMEOUT_KEY, "soon");
        assertThrows(IllegalArgumentException.class, () -> ProtocolConfig.fromProperties(props));
    }

    @Test
    void sequenceSpaceMustCoverTwoWindows() {
        assertThrows(IllegalArgumentException.class, () -> new ProtocolConfig(6, 11, 16));
        assertDoesNotThrow(() -> new ProtocolConfig(6, 12, 16));
    }

    @Test
    void rejectsNonPositiveWindowAndTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new ProtocolConfig(0, 12, 16));
        assertThrows(IllegalArgumentException.class, () -> new ProtocolConfig(6, 12, 0));
    }
}
