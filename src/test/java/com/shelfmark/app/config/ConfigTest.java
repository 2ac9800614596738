package com.shelfmark.app.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty("shelfmark.indexDuration");
        System.clearProperty("shelfmark.disableSync");
        System.clearProperty("shelfmark.skipDeleteCheck");
        System.clearProperty("shelfmark.busyTimeoutMs");
        System.setProperty("shelfmark.hashBufferSize", "4096");
    }

    @Test
    void systemPropertyOverridesBufferSize() {
        System.setProperty("shelfmark.hashBufferSize", "4096");
        assertEquals(4096, Config.getHashBufferSize());
    }

    @Test
    void bufferSizeHasFloor_andInvalidFallsBack() {
        System.setProperty("shelfmark.hashBufferSize", "1");
        assertEquals(512, Config.getHashBufferSize());

        System.setProperty("shelfmark.hashBufferSize", "not-a-number");
        assertEquals(64 * 1024, Config.getHashBufferSize());
    }

    @Test
    void indexDurationParsesAndRejectsBadValues() {
        System.setProperty("shelfmark.indexDuration", "42");
        assertEquals(OptionalLong.of(42), Config.getIndexDurationSeconds());

        System.setProperty("shelfmark.indexDuration", "-5");
        assertEquals(OptionalLong.empty(), Config.getIndexDurationSeconds());

        System.setProperty("shelfmark.indexDuration", "soon");
        assertEquals(OptionalLong.empty(), Config.getIndexDurationSeconds());
    }

    @Test
    void flagsAcceptCommonTruthyValues() {
        System.setProperty("shelfmark.disableSync", "yes");
        assertTrue(Config.isDisableSyncDefault());

        System.setProperty("shelfmark.skipDeleteCheck", "TRUE");
        assertTrue(Config.isSkipDeleteCheckDefault());

        System.setProperty("shelfmark.skipDeleteCheck", "nope");
        assertFalse(Config.isSkipDeleteCheckDefault());
    }

    @Test
    void busyTimeoutNeverNegative() {
        System.setProperty("shelfmark.busyTimeoutMs", "-1");
        assertEquals(0, Config.getBusyTimeoutMillis());

        System.setProperty("shelfmark.busyTimeoutMs", "2500");
        assertEquals(2500, Config.getBusyTimeoutMillis());
    }
}
