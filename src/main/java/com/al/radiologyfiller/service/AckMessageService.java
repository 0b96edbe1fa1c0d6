package com.al.radiologyfiller.service;

import ca.uhn.hl7v2.AcknowledgmentCode;
import ca.uhn.hl7v2.HL7Exception;
import ca.uhn.hl7v2.HapiContext;
import ca.uhn.hl7v2.model.v25.message.ACK;
import ca.uhn.hl7v2.model.v25.segment.ERR;
import ca.uhn.hl7v2.model.v25.segment.MSA;
import ca.uhn.hl7v2.model.v25.segment.MSH;
import com.al.radiologyfiller.exception.ErrorKind;
import com.al.radiologyfiller.hl7.MessageHeader;
import com.al.radiologyfiller.util.DateTimeUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Builds HL7 v2.5 ACK messages for inbound orders.
 *
 * ACK Types:
 * - AA (Application Accept): order reconciled
 * - AE (Application Error): order understood but not applied
 * - AR (Application Reject): unparsable or unsupported message
 */
@Service
@Slf4j
public class AckMessageService {

    private static final String APPLICATION_NAME = "RADIOLOGY-FILLER";
    private static final String FACILITY_NAME = "RADIOLOGY";

    private final HapiContext hl7Context;
    private final Clock clock;

    public AckMessageService(HapiContext hl7Context, Clock clock) {
        this.hl7Context = hl7Context;
        this.clock = clock;
    }

    public String generateAckAccept(MessageHeader original) throws HL7Exception {
        return generateAck(original, AcknowledgmentCode.AA, null, null);
    }

    /**
     * Chooses AR for messages that could not be read or are not orders, AE for everything else.
     *
     * @param original header of the inbound message, or null when not even MSH could be read
     */
    public String generateAckFor(MessageHeader original, ErrorKind kind, String errorMessage) throws HL7Exception {
        AcknowledgmentCode code = kind == ErrorKind.PARSE_ERROR || kind == ErrorKind.UNSUPPORTED_MESSAGE_TYPE
                ? AcknowledgmentCode.AR
                : AcknowledgmentCode.AE;
        return generateAck(original, code, kind, errorMessage);
    }

    public String generateAck(MessageHeader original, AcknowledgmentCode ackCode, ErrorKind kind,
            String errorMessage) throws HL7Exception {
        ACK ack = new ACK();
        MSH msh = ack.getMSH();
        msh.getFieldSeparator().setValue("|");
        msh.getEncodingCharacters().setValue("^~\\&");
        msh.getDateTimeOfMessage().getTime().setValue(DateTimeUtil.formatToHl7DateTime(LocalDateTime.now(clock)));
        msh.getMessageType().getMessageCode().setValue("ACK");
        msh.getMessageType().getMessageStructure().setValue("ACK");
        msh.getMessageControlID().setValue("ACK-" + UUID.randomUUID().toString().substring(0, 8));

        String originalControlId = "UNKNOWN";
        if (original != null) {
            // sender and receiver swap
            msh.getSendingApplication().getNamespaceID().setValue(
                    orDefault(original.getReceivingApplication(), APPLICATION_NAME));
            msh.getSendingFacility().getNamespaceID().setValue(
                    orDefault(original.getReceivingFacility(), FACILITY_NAME));
            msh.getReceivingApplication().getNamespaceID().setValue(original.getSendingApplication());
            msh.getReceivingFacility().getNamespaceID().setValue(original.getSendingFacility());
            msh.getMessageType().getTriggerEvent().setValue(original.getTriggerEvent());
            msh.getProcessingID().getProcessingID().setValue(orDefault(original.getProcessingId(), "P"));
            msh.getVersionID().getVersionID().setValue(orDefault(original.getVersionId(), "2.5"));
            originalControlId = orDefault(original.getMessageControlId(), originalControlId);
        } else {
            msh.getSendingApplication().getNamespaceID().setValue(APPLICATION_NAME);
            msh.getSendingFacility().getNamespaceID().setValue(FACILITY_NAME);
            msh.getProcessingID().getProcessingID().setValue("P");
            msh.getVersionID().getVersionID().setValue("2.5");
        }

        MSA msa = ack.getMSA();
        msa.getAcknowledgmentCode().setValue(ackCode.name());
        msa.getMessageControlID().setValue(originalControlId);
        if (errorMessage != null && !errorMessage.isEmpty()) {
            msa.getTextMessage().setValue(truncateMessage(errorMessage, 80));
        }

        if (ackCode != AcknowledgmentCode.AA && errorMessage != null) {
            ERR err = ack.getERR();
            err.getErrorCodeAndLocation(0).getSegmentID().setValue(kind == ErrorKind.PARSE_ERROR ? "MSH" : "OBR");
            err.getErrorCodeAndLocation(0).getCodeIdentifyingError().getIdentifier().setValue(hl7ErrorCode(kind));
            err.getErrorCodeAndLocation(0).getCodeIdentifyingError().getText().setValue(
                    truncateMessage(errorMessage, 200));
        }

        String encoded = hl7Context.getPipeParser().encode(ack);
        log.debug("Generated ACK {} for message {}", ackCode, originalControlId);
        return encoded;
    }

    /**
     * HL7 table 0357 message error condition code.
     */
    static String hl7ErrorCode(ErrorKind kind) {
        if (kind == null) {
            return "207";
        }
        switch (kind) {
            case PARSE_ERROR:
                return "100";
            case MISSING_IDENTIFIER:
            case ACCESSION_REQUIRED:
                return "101";
            case UNSUPPORTED_MESSAGE_TYPE:
                return "200";
            case PATIENT_NOT_FOUND:
                return "204";
            case CONCURRENCY_CONFLICT:
                return "206";
            default:
                return "207";
        }
    }

    private String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }

    private String truncateMessage(String message, int maxLength) {
        if (message == null)
            return null;
        if (message.length() <= maxLength)
            return message;
        return message.substring(0, maxLength - 3) + "...";
    }
}
