package com.pcoptimizer.licensing.config;

import com.pcoptimizer.licensing.model.StorageStatus;
import com.pcoptimizer.licensing.repository.ActivationRepo;
import com.pcoptimizer.licensing.repository.LicenseRepo;
import com.pcoptimizer.licensing.repository.ValidationLogRepo;
import com.pcoptimizer.licensing.store.DuplicateLicenseKeyException;
import com.pcoptimizer.licensing.store.InMemoryLicenseStore;
import com.pcoptimizer.licensing.store.JpaLicenseStore;
import com.pcoptimizer.licensing.store.LicenseStore;
import com.pcoptimizer.licensing.store.StorageOperationPolicy;
import com.pcoptimizer.licensing.store.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Picks the license store once, from {@code app.storage.mode}. The {@code fallback} profile also turns
 * off datasource and JPA auto-configuration.
 */
@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    /**
     * UTC, ticking in microseconds to match the precision of stored timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.tick(Clock.systemUTC(), Duration.ofNanos(1_000));
    }

    @Bean
    public StorageOperationPolicy storageOperationPolicy(AppProperties props) {
        return StorageOperationPolicy.from(props.storage());
    }

    @Bean
    @ConditionalOnProperty(name = "app.storage.mode", havingValue = "durable", matchIfMissing = true)
    public LicenseStore jpaLicenseStore(LicenseRepo licenses,
                                        ActivationRepo activations,
                                        ValidationLogRepo logs,
                                        PlatformTransactionManager txManager,
                                        StorageOperationPolicy policy,
                                        Clock clock) {
        log.info("License storage mode: DURABLE (timeout={}, retries={})", policy.timeout(), policy.maxRetries());
        return new JpaLicenseStore(licenses, activations, logs, txManager, policy, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "app.storage.mode", havingValue = "fallback")
    public LicenseStore inMemoryLicenseStore(LicenseProperties catalog, Clock clock) {
        log.warn("License storage mode: FALLBACK (in-memory, read-only; license generation disabled)");
        return new InMemoryLicenseStore(catalog, clock);
    }

    /**
     * Loads the configured catalog into an empty durable store.
     */
    @Bean
    @ConditionalOnProperty(name = "app.storage.seed-demo-licenses", havingValue = "true")
    public ApplicationRunner demoLicenseSeeder(LicenseStore store, LicenseProperties catalog, Clock clock) {
        return args -> {
            if (!store.isDurable() || catalog.keys().isEmpty()) {
                return;
            }
            StorageStatus status = store.status();
            if (!status.reachable()) {
                log.error("Cannot reach license storage; demo licenses not seeded");
                return;
            }
            if (status.totalLicenses() > 0) {
                log.info("Found {} existing license(s); skipping demo seeding", status.totalLicenses());
                return;
            }
            Instant now = clock.instant();
            int seeded = 0;
            for (LicenseProperties.LicenseEntry entry : catalog.keys()) {
                try {
                    store.insert(entry.toLicense(now));
                    seeded++;
                } catch (DuplicateLicenseKeyException e) {
                    log.info("Demo license {} already present", entry.key());
                } catch (StorageUnavailableException e) {
                    log.error("Demo seeding aborted: {}", e.getMessage());
                    return;
                }
            }
            log.info("Seeded {} demo license(s)", seeded);
        };
    }
}
