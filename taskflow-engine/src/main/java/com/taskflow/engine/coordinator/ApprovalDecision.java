package com.taskflow.engine.coordinator;

import java.util.UUID;

/**
 * Decision on a waiting approval step.
 */
public record ApprovalDecision(boolean approved, UUID decidedBy, String comment) {

    public ApprovalDecision {
        if (decidedBy == null) {
            throw new IllegalArgumentException("decidedBy must not be null");
        }
    }

    public static ApprovalDecision approve(UUID decidedBy, String comment) {
        return new ApprovalDecision(true, decidedBy, comment);
    }

    public static ApprovalDecision reject(UUID decidedBy, String comment) {
        return new ApprovalDecision(false, decidedBy, comment);
    }
}
