package com.al.radiologyfiller.hl7;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything the reconciliation needs from one ORM message.
 */
@Value
@Builder
public class ExtractedOrder {
    String messageControlId;
    String messageType;
    /** MSH-3 namespace id, null when absent. */
    String sourceSystem;
    /** Namespace in which the RPIDs of this message are unique. */
    String requestScope;
    PatientDemographics patient;
    @Singular
    List<OrderLine> lines;

    public OrderLine firstLine() {
        return lines.get(0);
    }
}
