package com.pcoptimizer.licensing.store;

import com.pcoptimizer.licensing.config.LicenseProperties;
import com.pcoptimizer.licensing.model.Activation;
import com.pcoptimizer.licensing.model.License;
import com.pcoptimizer.licensing.model.StorageStatus;
import com.pcoptimizer.licensing.model.ValidationLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Read-only store used when no durable storage is configured.
 * <p>
 * Holds the configured catalog for the lifetime of the process. Bindings are never recorded, so every
 * license always reports its full activation capacity, and new licenses cannot be issued.
 */
public class InMemoryLicenseStore implements LicenseStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLicenseStore.class);

    private final Map<String, License> catalog;
    private final Map<Long, Object> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryLicenseStore(LicenseProperties props, Clock clock) {
        this.clock = clock;
        Instant now = clock.instant();
        Map<String, License> byKey = new LinkedHashMap<>();
        long id = 1;
        for (LicenseProperties.LicenseEntry entry : props.keys()) {
            byKey.put(entry.key(), entry.toLicense(now).withId(id++));
        }
        this.catalog = Map.copyOf(byKey);
        log.info("In-memory license store loaded with {} license(s)", catalog.size());
    }

    @Override
    public Optional<License> findByKey(String licenseKey) {
        return licenseKey == null ? Optional.empty() : Optional.ofNullable(catalog.get(licenseKey));
    }

    @Override
    public License insert(License license) {
        throw new StorageUnavailableException("License storage is running in memory mode; new licenses cannot be persisted");
    }

    @Override
    public List<Activation> listActivations(long licenseId) {
        return List.of();
    }

    @Override
    public int countActivations(long licenseId) {
        return 0;
    }

    @Override
    public void addActivation(Activation activation) {
        log.debug("In-memory mode: activation for license {} on {} not recorded",
                activation.licenseId(), activation.hardwareFingerprint());
    }

    @Override
    public void updateActivation(Activation activation) {
        log.debug("In-memory mode: activation {} not updated", activation.id());
    }

    @Override
    public void appendLog(ValidationLogEntry entry) {
        log.info("Validation key={} fingerprint={} ip={} success={} error={}",
                entry.licenseKey(), entry.hardwareFingerprint(), entry.ipAddress(),
                entry.successful(), entry.errorMessage());
    }

    @Override
    public <T> T atomically(long licenseId, Supplier<T> work) {
        synchronized (locks.computeIfAbsent(licenseId, id -> new Object())) {
            return work.get();
        }
    }

    @Override
    public StorageStatus status() {
        Instant now = clock.instant();
        long usable = catalog.values().stream().filter(l -> l.active() && !l.isExpired(now)).count();
        return new StorageStatus(false, true, catalog.size(), usable);
    }

    @Override
    public boolean isDurable() {
        return false;
    }
}
