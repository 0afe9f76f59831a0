package com.pcoptimizer.licensing.config;

import com.pcoptimizer.licensing.config.LicenseProperties.LicenseEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LicenseProperties}.
 */
class LicensePropertiesTest {

    @Test
    @DisplayName("catalog entry without a key or customer name is rejected at binding time")
    void entry_missingFields_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new LicenseEntry(" ", "Demo", true, Duration.ofDays(1), 1));
        assertThrows(IllegalArgumentException.class,
                () -> new LicenseEntry("DEMO-1", null, true, Duration.ofDays(1), 1));
    }

    @Test
    @DisplayName("omitted entry fields take their defaults")
    void entry_defaults() {
        LicenseEntry e = new LicenseEntry("DEMO-1", "Demo", null, null, 0);

        assertTrue(e.enabled());
        assertEquals(Duration.ofDays(365), e.validFor());
        assertEquals(1, e.maxActivations());
    }
}
