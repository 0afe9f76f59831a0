package com.pcoptimizer.licensing.model;

import java.time.Instant;

/**
 * One validation attempt. {@code licenseId} is set only when the key resolved to a known license.
 */
public record ValidationLogEntry(
        Long licenseId,
        String licenseKey,
        String hardwareFingerprint,
        Instant validationDate,
        boolean successful,
        String errorMessage,
        String ipAddress
) {}
