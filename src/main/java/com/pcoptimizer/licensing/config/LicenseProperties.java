package com.pcoptimizer.licensing.config;

import com.pcoptimizer.licensing.model.License;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Built-in license catalog. Serves the in-memory fallback store and seeds an empty durable store.
 */
@ConfigurationProperties(prefix = "licenses")
public record LicenseProperties(List<LicenseEntry> keys) {

    public LicenseProperties {
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    /**
     * @param validFor how long the license stays valid, counted from process start
     */
    public record LicenseEntry(String key, String customerName, Boolean enabled, Duration validFor, int maxActivations) {
        public LicenseEntry {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("licenses.keys[].key is required");
            }
            if (customerName == null || customerName.isBlank()) {
                throw new IllegalArgumentException("licenses.keys[].customer-name is required for " + key);
            }
            if (enabled == null) enabled = Boolean.TRUE;
            if (validFor == null) validFor = Duration.ofDays(365);
            if (maxActivations <= 0) maxActivations = 1;
        }

        public License toLicense(Instant now) {
            return new License(null, key, customerName, null, maxActivations, now, now.plus(validFor), enabled);
        }
    }
}
