package com.pcoptimizer.licensing.service;

import com.pcoptimizer.licensing.config.AppProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link AdminSecretVerifier}.
 */
class AdminSecretVerifierTest {

    @Test
    @DisplayName("matches only the configured secret")
    void matches_configuredSecret() {
        var verifier = new AdminSecretVerifier(new AppProperties("s3cret!", null, null));

        assertTrue(verifier.matches("s3cret!"));
        assertFalse(verifier.matches("s3cret"));
        assertFalse(verifier.matches("s3cret!!"));
        assertFalse(verifier.matches(""));
        assertFalse(verifier.matches(null));
    }

    @Test
    @DisplayName("nothing matches when no secret is configured")
    void matches_noSecretConfigured_rejectsAll() {
        var verifier = new AdminSecretVerifier(new AppProperties(null, null, null));

        assertFalse(verifier.matches(""));
        assertFalse(verifier.matches("anything"));
    }
}
