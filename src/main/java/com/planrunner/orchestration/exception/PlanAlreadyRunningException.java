package com.planrunner.orchestration.exception;

import java.util.UUID;

public class PlanAlreadyRunningException extends RuntimeException {

    public PlanAlreadyRunningException(UUID planId, String owner) {
        super("Plan " + planId + " is already driven by " + owner);
    }
}
