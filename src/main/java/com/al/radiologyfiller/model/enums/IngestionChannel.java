package com.al.radiologyfiller.model.enums;

/**
 * Transport an order arrived on.
 */
public enum IngestionChannel {
    HTTP,
    MLLP,
    AMQP,
    FHIR
}
