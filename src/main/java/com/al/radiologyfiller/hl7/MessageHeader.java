package com.al.radiologyfiller.hl7;

import ca.uhn.hl7v2.HL7Exception;
import ca.uhn.hl7v2.model.Segment;
import ca.uhn.hl7v2.util.Terser;
import lombok.Builder;
import lombok.Value;

/**
 * MSH fields used for routing, auditing and acknowledgements. Absent fields are null.
 */
@Value
@Builder
public class MessageHeader {
    String sendingApplication;   // MSH-3.1
    String sendingFacility;      // MSH-4.1
    String receivingApplication; // MSH-5.1
    String receivingFacility;    // MSH-6.1
    String messageCode;          // MSH-9.1
    String triggerEvent;         // MSH-9.2
    String messageControlId;     // MSH-10
    String processingId;         // MSH-11.1
    String versionId;            // MSH-12.1

    public static MessageHeader from(Segment msh) throws HL7Exception {
        return MessageHeader.builder()
                .sendingApplication(Terser.get(msh, 3, 0, 1, 1))
                .sendingFacility(Terser.get(msh, 4, 0, 1, 1))
                .receivingApplication(Terser.get(msh, 5, 0, 1, 1))
                .receivingFacility(Terser.get(msh, 6, 0, 1, 1))
                .messageCode(Terser.get(msh, 9, 0, 1, 1))
                .triggerEvent(Terser.get(msh, 9, 0, 2, 1))
                .messageControlId(Terser.get(msh, 10, 0, 1, 1))
                .processingId(Terser.get(msh, 11, 0, 1, 1))
                .versionId(Terser.get(msh, 12, 0, 1, 1))
                .build();
    }

    /**
     * MSH-9 as "TYPE^EVENT" (e.g. ORM^O01), just the type when no trigger event is present, or null.
     */
    public String getMessageType() {
        if (messageCode == null || messageCode.isEmpty()) {
            return null;
        }
        return triggerEvent == null || triggerEvent.isEmpty() ? messageCode : messageCode + "^" + triggerEvent;
    }
}
