package com.pcoptimizer.licensing.store;

import com.pcoptimizer.licensing.model.Activation;
import com.pcoptimizer.licensing.model.License;
import com.pcoptimizer.licensing.model.StorageStatus;
import com.pcoptimizer.licensing.model.ValidationLogEntry;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Owns licenses, their activations and the validation log.
 * <p>
 * One implementation is chosen at startup. Any method may throw {@link StorageUnavailableException}
 * when the backing storage cannot be reached within the configured policy.
 */
public interface LicenseStore {

    Optional<License> findByKey(String licenseKey);

    /**
     * @return the stored license, with its id assigned
     * @throws DuplicateLicenseKeyException if a license with the same key already exists
     */
    License insert(License license);

    /**
     * Activations of a license, oldest first.
     */
    List<Activation> listActivations(long licenseId);

    int countActivations(long licenseId);

    void addActivation(Activation activation);

    void updateActivation(Activation activation);

    void appendLog(ValidationLogEntry entry);

    /**
     * Like {@link #appendLog}, but a single attempt with no retries. Used once storage is already known to be failing.
     */
    default void appendLogOnce(ValidationLogEntry entry) {
        appendLog(entry);
    }

    /**
     * Runs {@code work} so that no other {@code atomically} call for the same license interleaves with it.
     * Store calls made by {@code work} take part in the same unit.
     */
    <T> T atomically(long licenseId, Supplier<T> work);

    StorageStatus status();

    boolean isDurable();
}
