package com.pcoptimizer.licensing.dto;

public record ValidateRequest(
        String licenseKey,
        String hardwareFingerprint,
        String machineName,
        String productVersion
) {}
