package com.al.radiologyfiller.mllp;

import ca.uhn.hl7v2.HL7Exception;
import ca.uhn.hl7v2.HapiContext;
import ca.uhn.hl7v2.model.Message;
import ca.uhn.hl7v2.protocol.ReceivingApplication;
import com.al.radiologyfiller.dto.IngestionResponse;
import com.al.radiologyfiller.model.enums.IngestionChannel;
import com.al.radiologyfiller.service.Hl7IngestionService;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Hands messages arriving over MLLP to the ingestion pipeline and answers with its ACK. Messages HAPI
 * cannot parse never get here; {@link MllpParseFailureHandler} takes those.
 */
@Slf4j
public class MllpOrderReceiver implements ReceivingApplication<Message> {

    /** Metadata key under which HAPI's router passes the message text as received. */
    static final String RAW_MESSAGE_KEY = "raw-message";
    /** Set once the message has been handed to the pipeline, which has then audited it. */
    static final String INGESTED_KEY = "radiology-ingested";

    private final Hl7IngestionService ingestionService;
    private final HapiContext hapiContext;

    public MllpOrderReceiver(Hl7IngestionService ingestionService, HapiContext hapiContext) {
        this.ingestionService = ingestionService;
        this.hapiContext = hapiContext;
    }

    @Override
    public Message processMessage(Message message, Map<String, Object> metadata) throws HL7Exception {
        Object raw = metadata == null ? null : metadata.get(RAW_MESSAGE_KEY);
        String text = raw instanceof String ? (String) raw : message.encode();

        if (metadata != null) {
            metadata.put(INGESTED_KEY, Boolean.TRUE);
        }
        IngestionResponse response = ingestionService.ingestParsed(text, message, IngestionChannel.MLLP);
        if (response.getAck() == null) {
            // HAPI answers with its own AE
            throw new HL7Exception("No acknowledgement could be built: " + response.getMessage());
        }
        return hapiContext.getPipeParser().parse(response.getAck());
    }

    @Override
    public boolean canProcess(Message message) {
        return true;
    }
}
