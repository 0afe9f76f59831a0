package com.pcoptimizer.licensing.repository;

import com.pcoptimizer.licensing.model.entity.ActivationEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ActivationRepo extends JpaRepository<ActivationEntity, Long> {

    List<ActivationEntity> findByLicenseIdOrderByFirstActivatedAscIdAsc(Long licenseId);

    long countByLicenseId(Long licenseId);
}
