package com.planrunner.repository;

import com.planrunner.entity.StepLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link StepLog} entities.
 */
public interface StepLogRepository extends JpaRepository<StepLog, UUID> {

    List<StepLog> findByPlanIdOrderByCreatedAtAsc(UUID planId);
}
