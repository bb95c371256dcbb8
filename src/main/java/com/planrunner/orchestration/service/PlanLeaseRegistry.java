package com.planrunner.orchestration.service;

import com.planrunner.orchestration.exception.PlanAlreadyRunningException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-owner leases on plan ids. A plan is only driven by the worker holding its lease.
 */
@Component
@Slf4j
public class PlanLeaseRegistry {

    private final Map<UUID, String> owners = new ConcurrentHashMap<>();

    public void acquire(UUID planId, String owner) {
        String current = owners.putIfAbsent(planId, owner);
        if (current != null) {
            throw new PlanAlreadyRunningException(planId, current);
        }
        log.debug("Lease on plan {} acquired by {}.", planId, owner);
    }

    /**
     * Releases the lease only if {@code owner} holds it.
     */
    public boolean release(UUID planId, String owner) {
        boolean released = owners.remove(planId, owner);
        if (!released) {
            log.warn("Lease release for plan {} by {} ignored, current owner is {}.", planId, owner, owners.get(planId));
        }
        return released;
    }

    public Optional<String> ownerOf(UUID planId) {
        return Optional.ofNullable(owners.get(planId));
    }
}
