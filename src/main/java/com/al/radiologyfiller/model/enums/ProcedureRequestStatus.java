package com.al.radiologyfiller.model.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a procedure request. Forward-only; CANCELLED is reachable from every non-terminal state.
 */
public enum ProcedureRequestStatus {
    PENDING,
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    /**
     * Accepts the enum name or its display form ("IN_PROGRESS", "InProgress", "in progress").
     */
    public static ProcedureRequestStatus fromValue(String value) {
        if (value != null) {
            String normalized = value.replaceAll("[^A-Za-z]", "").toUpperCase();
            for (ProcedureRequestStatus status : values()) {
                if (status.name().replace("_", "").equals(normalized)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown procedure request status: " + value);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean canTransitionTo(ProcedureRequestStatus next) {
        return allowedNext().contains(next);
    }

    public Set<ProcedureRequestStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(SCHEDULED, IN_PROGRESS, COMPLETED, CANCELLED);
            case SCHEDULED:
                return EnumSet.of(IN_PROGRESS, COMPLETED, CANCELLED);
            case IN_PROGRESS:
                return EnumSet.of(COMPLETED, CANCELLED);
            default:
                return EnumSet.noneOf(ProcedureRequestStatus.class);
        }
    }
}
