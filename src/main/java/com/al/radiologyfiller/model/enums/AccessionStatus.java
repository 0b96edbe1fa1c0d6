package com.al.radiologyfiller.model.enums;

import java.util.EnumSet;
import java.util.Set;

public enum AccessionStatus {
    SCHEDULED,
    ARRIVED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    /**
     * Accepts the enum name or its display form ("IN_PROGRESS", "InProgress", "in progress").
     */
    public static AccessionStatus fromValue(String value) {
        if (value != null) {
            String normalized = value.replaceAll("[^A-Za-z]", "").toUpperCase();
            for (AccessionStatus status : values()) {
                if (status.name().replace("_", "").equals(normalized)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown accession status: " + value);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean canTransitionTo(AccessionStatus next) {
        return allowedNext().contains(next);
    }

    public Set<AccessionStatus> allowedNext() {
        switch (this) {
            case SCHEDULED:
                return EnumSet.of(ARRIVED, IN_PROGRESS, COMPLETED, CANCELLED);
            case ARRIVED:
                return EnumSet.of(IN_PROGRESS, COMPLETED, CANCELLED);
            case IN_PROGRESS:
                return EnumSet.of(COMPLETED, CANCELLED);
            default:
                return EnumSet.noneOf(AccessionStatus.class);
        }
    }
}
