package com.taskflow.core.model;

import java.util.UUID;

/**
 * A user attached to a step in a given role.
 */
public record StepAssignment(UUID userId, String role) {

    public static final String ROLE_APPROVER = "approver";

    public static StepAssignment approver(UUID userId) {
        return new StepAssignment(userId, ROLE_APPROVER);
    }

    public boolean isApprover() {
        return ROLE_APPROVER.equalsIgnoreCase(role);
    }
}
