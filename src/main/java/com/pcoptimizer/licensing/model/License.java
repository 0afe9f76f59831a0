package com.pcoptimizer.licensing.model;

import java.time.Instant;

/**
 * A license as seen by the validation and issuing paths. {@code id} is null until the license is stored.
 */
public record License(
        Long id,
        String licenseKey,
        String customerName,
        String customerEmail,
        int maxActivations,
        Instant creationDate,
        Instant expirationDate,
        boolean active
) {
    public License {
        if (licenseKey == null || licenseKey.isBlank()) {
            throw new IllegalArgumentException("licenseKey is required");
        }
        if (maxActivations < 1) {
            throw new IllegalArgumentException("maxActivations must be >= 1, was " + maxActivations);
        }
    }

    public static License issue(String licenseKey, String customerName, String customerEmail,
                                int maxActivations, Instant creationDate, Instant expirationDate) {
        return new License(null, licenseKey, customerName, customerEmail, maxActivations,
                creationDate, expirationDate, true);
    }

    public boolean isExpired(Instant now) {
        return expirationDate != null && now.isAfter(expirationDate);
    }

    public License withId(Long newId) {
        return new License(newId, licenseKey, customerName, customerEmail, maxActivations,
                creationDate, expirationDate, active);
    }
}
