package com.pcoptimizer.licensing.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidateResponse(
        @JsonProperty("isValid") boolean valid,
        String customerName,
        Instant expirationDate,
        Integer remainingActivations,
        String errorMessage
) {}
