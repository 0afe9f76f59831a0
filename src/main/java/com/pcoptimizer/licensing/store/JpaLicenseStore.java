package com.pcoptimizer.licensing.store;

import com.pcoptimizer.licensing.model.Activation;
import com.pcoptimizer.licensing.model.License;
import com.pcoptimizer.licensing.model.StorageStatus;
import com.pcoptimizer.licensing.model.ValidationLogEntry;
import com.pcoptimizer.licensing.model.entity.ActivationEntity;
import com.pcoptimizer.licensing.model.entity.LicenseEntity;
import com.pcoptimizer.licensing.model.entity.ValidationLogEntity;
import com.pcoptimizer.licensing.repository.ActivationRepo;
import com.pcoptimizer.licensing.repository.LicenseRepo;
import com.pcoptimizer.licensing.repository.ValidationLogRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Durable store over Spring Data JPA.
 * <p>
 * Each call is its own transaction, wrapped in the {@link StorageOperationPolicy}. Inside
 * {@link #atomically} the license row is held with a pessimistic write lock, and nested calls join
 * that transaction instead of opening their own.
 */
public class JpaLicenseStore implements LicenseStore {

    private static final Logger log = LoggerFactory.getLogger(JpaLicenseStore.class);

    /** SQLSTATE for a unique constraint violation. */
    private static final String UNIQUE_VIOLATION = "23505";

    private final LicenseRepo licenses;
    private final ActivationRepo activations;
    private final ValidationLogRepo logs;
    private final StorageOperationPolicy policy;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;
    private final Clock clock;

    public JpaLicenseStore(LicenseRepo licenses,
                           ActivationRepo activations,
                           ValidationLogRepo logs,
                           PlatformTransactionManager txManager,
                           StorageOperationPolicy policy,
                           Clock clock) {
        this.licenses = licenses;
        this.activations = activations;
        this.logs = logs;
        this.policy = policy;
        this.clock = clock;

        this.writeTx = new TransactionTemplate(txManager);
        this.writeTx.setTimeout(policy.timeoutSeconds());

        this.readTx = new TransactionTemplate(txManager);
        this.readTx.setTimeout(policy.timeoutSeconds());
        this.readTx.setReadOnly(true);
    }

    @Override
    public Optional<License> findByKey(String licenseKey) {
        return run("findByKey", readTx, () -> licenses.findByLicenseKey(licenseKey).map(LicenseEntity::toLicense));
    }

    @Override
    public License insert(License license) {
        return run("insert", writeTx, () -> {
            if (licenses.existsByLicenseKey(license.licenseKey())) {
                throw new DuplicateLicenseKeyException(license.licenseKey(), null);
            }
            try {
                return licenses.saveAndFlush(LicenseEntity.from(license)).toLicense();
            } catch (DataIntegrityViolationException e) {
                if (!isUniqueViolation(e)) {
                    throw e;
                }
                // unique index hit by a concurrent insert
                throw new DuplicateLicenseKeyException(license.licenseKey(), e);
            }
        });
    }

    @Override
    public List<Activation> listActivations(long licenseId) {
        return run("listActivations", readTx, () ->
                activations.findByLicenseIdOrderByFirstActivatedAscIdAsc(licenseId).stream()
                        .map(ActivationEntity::toActivation)
                        .toList());
    }

    @Override
    public int countActivations(long licenseId) {
        return run("countActivations", readTx, () -> Math.toIntExact(activations.countByLicenseId(licenseId)));
    }

    @Override
    public void addActivation(Activation activation) {
        run("addActivation", writeTx, () -> {
            LicenseEntity owner = licenses.getReferenceById(activation.licenseId());
            activations.save(ActivationEntity.of(owner, activation));
            return null;
        });
    }

    @Override
    public void updateActivation(Activation activation) {
        run("updateActivation", writeTx, () -> {
            ActivationEntity e = activations.findById(activation.id())
                    .orElseThrow(() -> new IllegalStateException("Activation " + activation.id() + " does not exist"));
            e.touch(activation);
            activations.save(e);
            return null;
        });
    }

    @Override
    public void appendLog(ValidationLogEntry entry) {
        run("appendLog", writeTx, () -> logs.save(ValidationLogEntity.of(entry)));
    }

    @Override
    public void appendLogOnce(ValidationLogEntry entry) {
        try {
            writeTx.executeWithoutResult(status -> logs.save(ValidationLogEntity.of(entry)));
        } catch (DataAccessException | TransactionException e) {
            throw new StorageUnavailableException("Storage operation appendLog failed", e);
        }
    }

    @Override
    public <T> T atomically(long licenseId, Supplier<T> work) {
        return run("atomically", writeTx, () -> {
            licenses.lockById(licenseId)
                    .orElseThrow(() -> new IllegalStateException("License " + licenseId + " does not exist"));
            return work.get();
        });
    }

    @Override
    public StorageStatus status() {
        try {
            return run("status", readTx, () -> new StorageStatus(true, true,
                    licenses.count(), licenses.countUsable(clock.instant())));
        } catch (StorageUnavailableException e) {
            log.warn("Storage status check failed: {}", e.getMessage());
            return StorageStatus.unreachable(true);
        }
    }

    @Override
    public boolean isDurable() {
        return true;
    }

    static boolean isUniqueViolation(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    private <T> T run(String operation, TransactionTemplate tx, Supplier<T> call) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return call.get();
        }
        return policy.execute(operation, () -> tx.execute(status -> call.get()));
    }
}
