package com.pcoptimizer.licensing.dto;

public record GenerateLicenseRequest(
        String adminSecret,
        String customerName,
        String customerEmail,
        Integer validityDays
) {}
