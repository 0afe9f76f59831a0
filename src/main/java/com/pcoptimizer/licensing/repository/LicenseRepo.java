package com.pcoptimizer.licensing.repository;

import com.pcoptimizer.licensing.model.entity.LicenseEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface LicenseRepo extends JpaRepository<LicenseEntity, Long> {

    Optional<LicenseEntity> findByLicenseKey(String licenseKey);

    boolean existsByLicenseKey(String licenseKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from LicenseEntity l where l.id = :id")
    Optional<LicenseEntity> lockById(@Param("id") Long id);

    @Query("select count(l) from LicenseEntity l where l.active = true and l.expirationDate > :now")
    long countUsable(@Param("now") Instant now);
}
