package com.pcoptimizer.licensing.repository;

import com.pcoptimizer.licensing.model.entity.ValidationLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ValidationLogRepo extends JpaRepository<ValidationLogEntity, Long> {
}
