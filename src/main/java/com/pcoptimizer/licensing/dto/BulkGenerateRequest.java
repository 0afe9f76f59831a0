package com.pcoptimizer.licensing.dto;

public record BulkGenerateRequest(
        String adminSecret,
        String customerNamePrefix,
        Integer count,
        Integer validityDays
) {}
