package com.al.radiologyfiller.mllp;

import ca.uhn.hl7v2.HL7Exception;
import ca.uhn.hl7v2.protocol.ReceivingApplicationExceptionHandler;
import com.al.radiologyfiller.dto.IngestionResponse;
import com.al.radiologyfiller.model.enums.IngestionChannel;
import com.al.radiologyfiller.service.Hl7IngestionService;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Runs messages that HAPI's MLLP router failed to parse (unknown version, missing MSH-9, ...) through
 * the ingestion pipeline anyway, so they are audited and answered with the pipeline's own AR.
 * Failures after the message reached {@link MllpOrderReceiver} were audited there and keep HAPI's ACK.
 */
@Slf4j
public class MllpParseFailureHandler implements ReceivingApplicationExceptionHandler {

    private final Hl7IngestionService ingestionService;

    public MllpParseFailureHandler(Hl7IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @Override
    public String processException(String incomingMessage, Map<String, Object> incomingMetadata,
            String outgoingMessage, Exception e) throws HL7Exception {
        if (incomingMetadata != null && incomingMetadata.containsKey(MllpOrderReceiver.INGESTED_KEY)) {
            return outgoingMessage;
        }
        log.warn("MLLP router could not parse the inbound message: {}", e.getMessage());
        IngestionResponse response = ingestionService.ingest(incomingMessage, null, IngestionChannel.MLLP);
        if (response.getAck() != null) {
            return response.getAck();
        }
        if (outgoingMessage == null) {
            throw new HL7Exception("No acknowledgement could be built: " + response.getMessage(), e);
        }
        return outgoingMessage;
    }
}
