package com.pcoptimizer.licensing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app")
public record AppProperties(String adminSecret, Keys keys, Storage storage) {

    public AppProperties {
        if (keys == null) keys = new Keys(null, 0, 0);
        if (storage == null) storage = new Storage(null, null, null, false);
    }

    public record Keys(
            String prefix,
            int groups,
            int insertAttempts
    ) {
        public Keys {
            if (prefix == null || prefix.isBlank()) prefix = "PCOPT";
            if (groups <= 0) groups = 4;
            if (insertAttempts <= 0) insertAttempts = 2;
        }
    }

    /**
     * Storage operation policy. The store itself is chosen by {@code app.storage.mode}, see StorageConfig.
     */
    public record Storage(
            Duration timeout,
            Integer maxRetries,
            Duration backoff,
            boolean seedDemoLicenses
    ) {
        public Storage {
            if (timeout == null) timeout = Duration.ofSeconds(30);
            if (maxRetries == null) maxRetries = 3;
            if (backoff == null) backoff = Duration.ofMillis(200);
        }
    }
}
