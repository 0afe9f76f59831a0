package com.pcoptimizer.licensing.dto;

import java.time.Instant;

public record HealthResponse(
        String status,
        String mode,
        boolean storageReachable,
        long totalLicenses,
        long activeLicenses,
        Instant serverTime,
        String version
) {}
