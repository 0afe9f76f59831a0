package com.pcoptimizer.licensing.model;

import java.time.Instant;

public record Activation(
        Long id,
        long licenseId,
        String hardwareFingerprint,
        String machineName,
        Instant firstActivated,
        Instant lastSeen,
        String productVersion
) {
    public static Activation first(long licenseId, String hardwareFingerprint, String machineName,
                                   String productVersion, Instant now) {
        return new Activation(null, licenseId, hardwareFingerprint, machineName, now, now, productVersion);
    }

    /**
     * Seen again from the same hardware. A null product version keeps the recorded one.
     */
    public Activation renewed(String newMachineName, String newProductVersion, Instant now) {
        return new Activation(id, licenseId, hardwareFingerprint, newMachineName, firstActivated, now,
                newProductVersion == null ? productVersion : newProductVersion);
    }
}
