package com.pcoptimizer.licensing.service;

import com.pcoptimizer.licensing.config.AppProperties;
import com.pcoptimizer.licensing.dto.ApiException;
import com.pcoptimizer.licensing.dto.BulkGenerateRequest;
import com.pcoptimizer.licensing.dto.BulkGenerateResponse;
import com.pcoptimizer.licensing.dto.GenerateLicenseRequest;
import com.pcoptimizer.licensing.dto.GenerateLicenseResponse;
import com.pcoptimizer.licensing.model.License;
import com.pcoptimizer.licensing.store.DuplicateLicenseKeyException;
import com.pcoptimizer.licensing.store.LicenseStore;
import com.pcoptimizer.licensing.store.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Administrative license generation. Requests are checked in order (admin secret, customer name,
 * validity, storage) and nothing touches storage until all input checks pass.
 */
@Service
public class LicenseIssuingService {

    private static final Logger log = LoggerFactory.getLogger(LicenseIssuingService.class);

    static final int MAX_CUSTOMER_NAME_LENGTH = 250;
    static final int MAX_CUSTOMER_EMAIL_LENGTH = 320;
    static final int MIN_VALIDITY_DAYS = 1;
    static final int MAX_VALIDITY_DAYS = 3650;
    static final int DEFAULT_VALIDITY_DAYS = 365;
    static final int MAX_BULK_COUNT = 1000;

    // standard licenses bind to a single machine
    static final int STANDARD_MAX_ACTIVATIONS = 1;

    private final LicenseStore store;
    private final LicenseKeyGenerator keys;
    private final AdminSecretVerifier secret;
    private final Clock clock;
    private final int insertAttempts;

    public LicenseIssuingService(LicenseStore store,
                                 LicenseKeyGenerator keys,
                                 AdminSecretVerifier secret,
                                 AppProperties props,
                                 Clock clock) {
        this.store = store;
        this.keys = keys;
        this.secret = secret;
        this.clock = clock;
        this.insertAttempts = props.keys().insertAttempts();
    }

    public GenerateLicenseResponse generate(GenerateLicenseRequest req, String ipAddress) {
        requireAdmin(req.adminSecret(), ipAddress);
        String customerName = requireName(req.customerName(), MAX_CUSTOMER_NAME_LENGTH,
                "CUSTOMER_NAME_REQUIRED", "Customer name is required",
                "CUSTOMER_NAME_TOO_LONG", "Customer name must be " + MAX_CUSTOMER_NAME_LENGTH + " characters or less");
        int days = requireValidityDays(req.validityDays());
        String email = optionalEmail(req.customerEmail());
        requireDurableStore();

        log.info("Generating license for '{}' valid for {} days", customerName, days);
        License license = issue(customerName, email, days);
        log.info("Generated license {} for '{}' (expires {})", license.licenseKey(), customerName, license.expirationDate());

        return success(license, days);
    }

    public BulkGenerateResponse generateBulk(BulkGenerateRequest req, String ipAddress) {
        requireAdmin(req.adminSecret(), ipAddress);
        int count = req.count() == null ? 0 : req.count();
        String prefix = requireName(req.customerNamePrefix(), MAX_CUSTOMER_NAME_LENGTH - suffix(MAX_BULK_COUNT).length(),
                "CUSTOMER_NAME_REQUIRED", "Customer name prefix is required",
                "CUSTOMER_NAME_TOO_LONG", "Customer name prefix must be "
                        + (MAX_CUSTOMER_NAME_LENGTH - suffix(MAX_BULK_COUNT).length()) + " characters or less");
        int days = requireValidityDays(req.validityDays());
        if (count < 1 || count > MAX_BULK_COUNT) {
            throw ApiException.badRequest("COUNT_OUT_OF_RANGE",
                    "Count must be between 1 and " + MAX_BULK_COUNT, Map.of("count", count));
        }
        requireDurableStore();

        log.info("Bulk generating {} license(s) for prefix '{}' valid for {} days", count, prefix, days);

        List<GenerateLicenseResponse> results = new ArrayList<>(count);
        int generated = 0;
        StorageUnavailableException outage = null;
        for (int n = 1; n <= count; n++) {
            String customerName = prefix + suffix(n);
            if (outage != null) {
                results.add(GenerateLicenseResponse.failed(customerName, days, "Not attempted: license storage unavailable"));
                continue;
            }
            try {
                results.add(success(issue(customerName, null, days), days));
                generated++;
            } catch (StorageUnavailableException e) {
                log.error("Bulk generation stopped at #{} of {}: {}", n, count, e.getMessage());
                outage = e;
                results.add(GenerateLicenseResponse.failed(customerName, days, "License storage unavailable"));
            } catch (ApiException e) {
                results.add(GenerateLicenseResponse.failed(customerName, days, e.getMessage()));
            }
        }

        if (generated == 0 && outage != null) {
            throw outage;
        }
        int failed = count - generated;
        if (failed > 0) {
            log.warn("Bulk generation for prefix '{}' finished with {} of {} failed", prefix, failed, count);
        } else {
            log.info("Bulk generation for prefix '{}' finished: {} license(s)", prefix, generated);
        }
        return new BulkGenerateResponse(count, generated, failed, results);
    }

    private License issue(String customerName, String customerEmail, int days) {
        Instant now = clock.instant();
        Instant expiration = now.plus(Duration.ofDays(days));
        for (int attempt = 1; attempt <= insertAttempts; attempt++) {
            String key = keys.generate();
            try {
                return store.insert(License.issue(key, customerName, customerEmail,
                        STANDARD_MAX_ACTIVATIONS, now, expiration));
            } catch (DuplicateLicenseKeyException e) {
                log.warn("Duplicate license key generated: {} (attempt {}/{})", key, attempt, insertAttempts);
            }
        }
        throw ApiException.internal("LICENSE_KEY_COLLISION",
                "Could not generate a unique license key", Map.of("attempts", insertAttempts));
    }

    private void requireAdmin(String candidate, String ipAddress) {
        if (!secret.matches(candidate)) {
            log.warn("Unauthorized license generation attempt from IP: {}", ipAddress);
            throw ApiException.unauthorized("ADMIN_SECRET_INVALID", "Invalid admin secret");
        }
    }

    private static String requireName(String value, int maxLength,
                                      String missingCode, String missingMessage,
                                      String tooLongCode, String tooLongMessage) {
        if (value == null || value.isBlank()) {
            throw ApiException.badRequest(missingCode, missingMessage);
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            throw ApiException.badRequest(tooLongCode, tooLongMessage, Map.of("length", trimmed.length()));
        }
        return trimmed;
    }

    private static int requireValidityDays(Integer validityDays) {
        int days = validityDays == null ? DEFAULT_VALIDITY_DAYS : validityDays;
        if (days < MIN_VALIDITY_DAYS || days > MAX_VALIDITY_DAYS) {
            throw ApiException.badRequest("VALIDITY_DAYS_OUT_OF_RANGE",
                    "Validity days must be between " + MIN_VALIDITY_DAYS + " and " + MAX_VALIDITY_DAYS,
                    Map.of("validityDays", days));
        }
        return days;
    }

    private static String optionalEmail(String email) {
        if (email == null || email.isBlank()) return null;
        String trimmed = email.trim();
        if (trimmed.length() > MAX_CUSTOMER_EMAIL_LENGTH || trimmed.indexOf('@') < 1) {
            throw ApiException.badRequest("CUSTOMER_EMAIL_INVALID", "Customer email is not a valid address");
        }
        return trimmed;
    }

    private void requireDurableStore() {
        if (!store.isDurable()) {
            log.error("License generation refused: durable storage is not configured");
            throw ApiException.serviceUnavailable("STORAGE_UNAVAILABLE",
                    "License generation unavailable - database not connected", null);
        }
    }

    private static String suffix(int n) {
        return " #" + n;
    }

    private static GenerateLicenseResponse success(License license, int days) {
        return new GenerateLicenseResponse(true, license.licenseKey(), license.customerName(),
                license.creationDate(), license.expirationDate(), days, "Standard license generated successfully");
    }
}
