package com.al.radiologyfiller.hl7;

import com.al.radiologyfiller.model.enums.ProcedurePriority;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Identifiers and order details of one OBR (with its ORC).
 */
@Value
@Builder(toBuilder = true)
public class OrderLine {

    /** 1-based position of the OBR in the message. */
    int sequence;

    String requestedProcedureId;
    /** OBR-18, null when the placer left it empty. */
    String accessionNumber;

    String placerOrderNumber;
    String fillerOrderNumber;
    String serviceCode;
    String serviceName;
    String orderingProvider;
    LocalDateTime requestedDateTime;
    ProcedurePriority priority;
    String modality;
    LocalDate scheduledDate;
    LocalTime scheduledTime;
    String notes;

    public boolean hasAccessionNumber() {
        return accessionNumber != null && !accessionNumber.isBlank();
    }
}
