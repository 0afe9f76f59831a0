package com.pcoptimizer.licensing.service;

import com.pcoptimizer.licensing.dto.ValidateRequest;
import com.pcoptimizer.licensing.model.Activation;
import com.pcoptimizer.licensing.model.License;
import com.pcoptimizer.licensing.model.ValidationLogEntry;
import com.pcoptimizer.licensing.model.ValidationVerdict;
import com.pcoptimizer.licensing.model.ValidationVerdict.Failure;
import com.pcoptimizer.licensing.store.LicenseStore;
import com.pcoptimizer.licensing.store.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Decides whether a license key may be used on a given machine and binds the machine to it.
 * <p>
 * Checks run in a fixed order: key exists, license active, license not expired, activation slot.
 * A machine that is already bound is always accepted, whatever the current activation count.
 * Every attempt is written to the {@link AuditLog}.
 */
@Service
public class LicenseValidationService {

    private static final Logger log = LoggerFactory.getLogger(LicenseValidationService.class);

    static final int MAX_FINGERPRINT_LENGTH = 100;

    static final String KEY_REQUIRED = "License key is required";
    static final String FINGERPRINT_REQUIRED = "Hardware fingerprint is required";
    static final String FINGERPRINT_TOO_LONG = "Hardware fingerprint must be " + MAX_FINGERPRINT_LENGTH + " characters or less";
    static final String UNKNOWN_KEY = "Invalid license key";
    static final String DEACTIVATED = "License has been deactivated";
    static final String EXPIRED = "License has expired";
    static final String LIMIT_REACHED = "License is already activated on the maximum number of machines (%d)";
    static final String STORAGE_UNAVAILABLE = "License storage unavailable";

    private final LicenseStore store;
    private final AuditLog audit;
    private final Clock clock;

    public LicenseValidationService(LicenseStore store, AuditLog audit, Clock clock) {
        this.store = store;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * @throws StorageUnavailableException if the license store cannot be reached; never turned into an accepted verdict
     */
    public ValidationVerdict validate(ValidateRequest req, String ipAddress) {
        String key = req.licenseKey() == null ? null : req.licenseKey().trim();
        String fingerprint = req.hardwareFingerprint();

        if (key == null || key.isEmpty()) {
            return reject(null, req, ipAddress, Failure.INVALID_INPUT, KEY_REQUIRED);
        }
        if (fingerprint == null || fingerprint.isBlank()) {
            return reject(null, req, ipAddress, Failure.INVALID_INPUT, FINGERPRINT_REQUIRED);
        }
        if (fingerprint.length() > MAX_FINGERPRINT_LENGTH) {
            return reject(null, req, ipAddress, Failure.INVALID_INPUT, FINGERPRINT_TOO_LONG);
        }

        Instant now = clock.instant();
        License license = null;
        try {
            license = store.findByKey(key).orElse(null);
            if (license == null) {
                return reject(null, req, ipAddress, Failure.UNKNOWN_KEY, UNKNOWN_KEY);
            }
            if (!license.active()) {
                return reject(license.id(), req, ipAddress, Failure.DEACTIVATED, DEACTIVATED);
            }
            if (license.isExpired(now)) {
                return reject(license.id(), req, ipAddress, Failure.EXPIRED, EXPIRED);
            }

            License resolved = license;
            Binding binding = store.atomically(resolved.id(), () -> bind(resolved, req, now));
            if (!binding.granted()) {
                return reject(license.id(), req, ipAddress, Failure.ACTIVATION_LIMIT_REACHED,
                        String.format(LIMIT_REACHED, license.maxActivations()));
            }

            int remaining = Math.max(0, license.maxActivations() - binding.boundCount());
            log.info("License {} validated for fingerprint {} ({}), {} activation(s) remaining",
                    key, fingerprint, binding.renewal() ? "renewal" : "new activation", remaining);
            audit.append(new ValidationLogEntry(license.id(), req.licenseKey(), fingerprint, now, true, null, ipAddress));
            return ValidationVerdict.accepted(license, remaining);

        } catch (StorageUnavailableException e) {
            log.error("Validation of license {} aborted: {}", key, e.getMessage());
            audit.appendDuringOutage(new ValidationLogEntry(license == null ? null : license.id(),
                    req.licenseKey(), fingerprint, now, false, STORAGE_UNAVAILABLE, ipAddress));
            throw e;
        }
    }

    // runs inside LicenseStore.atomically for the license
    private Binding bind(License license, ValidateRequest req, Instant now) {
        List<Activation> bound = store.listActivations(license.id());

        for (Activation a : bound) {
            if (a.hardwareFingerprint().equals(req.hardwareFingerprint())) {
                store.updateActivation(a.renewed(req.machineName(), req.productVersion(), now));
                return new Binding(true, true, store.countActivations(license.id()));
            }
        }

        if (bound.size() >= license.maxActivations()) {
            return new Binding(false, false, bound.size());
        }

        store.addActivation(Activation.first(license.id(), req.hardwareFingerprint(), req.machineName(),
                req.productVersion(), now));
        return new Binding(true, false, store.countActivations(license.id()));
    }

    private ValidationVerdict reject(Long licenseId, ValidateRequest req, String ipAddress,
                                     Failure failure, String message) {
        log.info("License validation rejected key={} fingerprint={} reason={}",
                req.licenseKey(), req.hardwareFingerprint(), failure);
        audit.append(new ValidationLogEntry(licenseId, req.licenseKey(), req.hardwareFingerprint(),
                clock.instant(), false, message, ipAddress));
        return ValidationVerdict.rejected(failure, message);
    }

    private record Binding(boolean granted, boolean renewal, int boundCount) {}
}
