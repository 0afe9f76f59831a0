package com.pcoptimizer.licensing.model;

import java.time.Instant;

/**
 * Outcome of one validation request. A rejected verdict always has a {@code failure}; an accepted one never does.
 */
public record ValidationVerdict(
        boolean valid,
        Failure failure,
        String errorMessage,
        String customerName,
        Instant expirationDate,
        Integer remainingActivations
) {

    public enum Failure {
        INVALID_INPUT,
        UNKNOWN_KEY,
        DEACTIVATED,
        EXPIRED,
        ACTIVATION_LIMIT_REACHED
    }

    public static ValidationVerdict accepted(License license, int remainingActivations) {
        return new ValidationVerdict(true, null, null, license.customerName(), license.expirationDate(),
                remainingActivations);
    }

    public static ValidationVerdict rejected(Failure failure, String errorMessage) {
        return new ValidationVerdict(false, failure, errorMessage, null, null, null);
    }
}
