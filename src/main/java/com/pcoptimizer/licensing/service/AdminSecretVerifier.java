package com.pcoptimizer.licensing.service;

import com.pcoptimizer.licensing.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Checks the shared admin secret. Both sides are hashed before a constant-time compare, so the
 * time taken depends on neither the content nor the length of the candidate.
 */
@Component
public class AdminSecretVerifier {

    private static final Logger log = LoggerFactory.getLogger(AdminSecretVerifier.class);

    private final byte[] expectedDigest;

    public AdminSecretVerifier(AppProperties props) {
        String secret = props.adminSecret();
        if (secret == null || secret.isBlank()) {
            log.warn("app.admin-secret is not set; license generation is disabled");
            this.expectedDigest = null;
        } else {
            this.expectedDigest = sha256(secret);
        }
    }

    public boolean matches(String candidate) {
        if (expectedDigest == null || candidate == null) {
            return false;
        }
        return MessageDigest.isEqual(expectedDigest, sha256(candidate));
    }

    private static byte[] sha256(String s) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
