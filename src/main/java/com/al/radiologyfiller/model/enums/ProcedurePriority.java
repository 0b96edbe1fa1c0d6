package com.al.radiologyfiller.model.enums;

public enum ProcedurePriority {
    ROUTINE,
    STAT,
    ASAP,
    URGENT;

    /**
     * Maps an OBR-5 priority code. Unknown or empty codes are routine.
     */
    public static ProcedurePriority fromHl7Code(String code) {
        if (code == null || code.isEmpty()) {
            return ROUTINE;
        }
        switch (code.trim().toUpperCase()) {
            case "S":
                return STAT;
            case "A":
                return ASAP;
            case "U":
                return URGENT;
            default:
                return ROUTINE;
        }
    }
}
