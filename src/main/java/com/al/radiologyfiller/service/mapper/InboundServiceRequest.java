package com.al.radiologyfiller.service.mapper;

import com.al.radiologyfiller.hl7.OrderLine;
import lombok.Builder;
import lombok.Value;

/**
 * An order received as a FHIR ServiceRequest, in the shape the reconciliation consumes.
 */
@Value
@Builder
public class InboundServiceRequest {
    String patientId;
    /** System of the RPID identifier; null when the identifier carried none. */
    String sourceSystem;
    OrderLine line;
}
