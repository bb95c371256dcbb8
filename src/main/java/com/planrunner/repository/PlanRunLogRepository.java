package com.planrunner.repository;

import com.planrunner.entity.PlanRunLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link PlanRunLog} entities.
 */
public interface PlanRunLogRepository extends JpaRepository<PlanRunLog, UUID> {

    List<PlanRunLog> findByCorrelationId(String correlationId);
}
