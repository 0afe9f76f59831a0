package com.pcoptimizer.licensing.service;

import com.pcoptimizer.licensing.model.ValidationLogEntry;
import com.pcoptimizer.licensing.store.LicenseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records validation attempts. A failed write is logged and dropped, never reported to the caller.
 */
@Service
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final LicenseStore store;

    public AuditLog(LicenseStore store) {
        this.store = store;
    }

    public void append(ValidationLogEntry entry) {
        try {
            store.appendLog(entry);
        } catch (RuntimeException e) {
            logDropped(entry, e);
        }
    }

    /**
     * One attempt only, so a request that already hit a storage outage is not held up by retries.
     */
    public void appendDuringOutage(ValidationLogEntry entry) {
        try {
            store.appendLogOnce(entry);
        } catch (RuntimeException e) {
            logDropped(entry, e);
        }
    }

    private static void logDropped(ValidationLogEntry entry, RuntimeException e) {
        log.warn("Failed to write validation log entry for key={} success={}: {}",
                entry.licenseKey(), entry.successful(), e.toString());
    }
}
