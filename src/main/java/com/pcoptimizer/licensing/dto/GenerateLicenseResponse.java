package com.pcoptimizer.licensing.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerateLicenseResponse(
        boolean success,
        String licenseKey,
        String customerName,
        Instant creationDate,
        Instant expirationDate,
        Integer validityDays,
        String message
) {
    public static GenerateLicenseResponse failed(String customerName, int validityDays, String message) {
        return new GenerateLicenseResponse(false, null, customerName, null, null, validityDays, message);
    }
}
