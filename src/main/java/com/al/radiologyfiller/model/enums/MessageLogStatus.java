package com.al.radiologyfiller.model.enums;

public enum MessageLogStatus {
    PENDING,
    PROCESSED,
    FAILED
}
