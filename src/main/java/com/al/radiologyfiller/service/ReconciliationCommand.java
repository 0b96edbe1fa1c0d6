package com.al.radiologyfiller.service;

import com.al.radiologyfiller.hl7.OrderLine;
import lombok.Builder;
import lombok.Value;

/**
 * One order line to reconcile, with the already-resolved patient.
 */
@Value
@Builder
public class ReconciliationCommand {
    String requestScope;
    String sourceSystem;
    String patientId;
    String messageControlId;
    OrderLine line;

    public String getRequestedProcedureId() {
        return line.getRequestedProcedureId();
    }

    public String getAccessionHint() {
        return line.hasAccessionNumber() ? line.getAccessionNumber() : null;
    }
}
