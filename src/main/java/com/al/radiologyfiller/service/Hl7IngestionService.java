package com.al.radiologyfiller.service;

import ca.uhn.hl7v2.HL7Exception;
import ca.uhn.hl7v2.model.Message;
import com.al.radiologyfiller.dto.IngestionResponse;
import com.al.radiologyfiller.dto.OrderOutcome;
import com.al.radiologyfiller.exception.ErrorKind;
import com.al.radiologyfiller.exception.RadiologyException;
import com.al.radiologyfiller.exception.UnsupportedMessageTypeException;
import com.al.radiologyfiller.hl7.ExtractedOrder;
import com.al.radiologyfiller.hl7.Hl7MessageParser;
import com.al.radiologyfiller.hl7.MessageHeader;
import com.al.radiologyfiller.hl7.OrderIdentifierExtractor;
import com.al.radiologyfiller.hl7.OrderLine;
import com.al.radiologyfiller.model.Patient;
import com.al.radiologyfiller.model.enums.IngestionChannel;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for inbound HL7 order messages, whatever the transport.
 * <p>
 * Parse, extract, resolve the patient, then reconcile the order lines of the message as one unit: either
 * every line is applied or none is. The outcome is always returned as a structured response (never
 * thrown), recorded once in the message log, and accompanied by the HL7 ACK the transport should send
 * back.
 */
@Slf4j
@Service
public class Hl7IngestionService {

    public static final String MDC_MESSAGE_CONTROL_ID = "messageControlId";

    private final Hl7MessageParser parser;
    private final OrderIdentifierExtractor extractor;
    private final PatientRegistryService patientRegistryService;
    private final ReconciliationService reconciliationService;
    private final AuditService auditService;
    private final AckMessageService ackMessageService;
    private final MeterRegistry meterRegistry;

    public Hl7IngestionService(Hl7MessageParser parser,
            OrderIdentifierExtractor extractor,
            PatientRegistryService patientRegistryService,
            ReconciliationService reconciliationService,
            AuditService auditService,
            AckMessageService ackMessageService,
            MeterRegistry meterRegistry) {
        this.parser = parser;
        this.extractor = extractor;
        this.patientRegistryService = patientRegistryService;
        this.reconciliationService = reconciliationService;
        this.auditService = auditService;
        this.ackMessageService = ackMessageService;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param rawMessage      pipe-delimited HL7 v2 text
     * @param messageTypeHint optional type (e.g. "ORM^O01") that takes precedence over MSH-9
     * @param channel         transport the message arrived on
     */
    public IngestionResponse ingest(String rawMessage, String messageTypeHint, IngestionChannel channel) {
        return process(rawMessage, null, messageTypeHint, channel);
    }

    /**
     * For transports that receive the message already parsed by HAPI; the raw text is still what gets
     * audited.
     */
    public IngestionResponse ingestParsed(String rawMessage, Message message, IngestionChannel channel) {
        return process(rawMessage, message, null, channel);
    }

    private IngestionResponse process(String rawMessage, Message preParsed, String messageTypeHint,
            IngestionChannel channel) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String logId = auditService.recordReceived(rawMessage, channel);

        MessageHeader header = null;
        String messageType = blankToNull(messageTypeHint);
        try {
            Message message = preParsed != null ? preParsed : parser.parse(rawMessage);
            header = parser.header(message);
            MDC.put(MDC_MESSAGE_CONTROL_ID, header.getMessageControlId());
            if (messageType == null) {
                messageType = header.getMessageType();
            }
            if (!isOrderMessage(messageType)) {
                throw new UnsupportedMessageTypeException(messageType);
            }

            ExtractedOrder order = extractor.extract(message);
            Patient patient = patientRegistryService.resolve(order.getPatient());

            List<ReconciliationCommand> commands = new ArrayList<>(order.getLines().size());
            for (OrderLine line : order.getLines()) {
                commands.add(ReconciliationCommand.builder()
                        .requestScope(order.getRequestScope())
                        .sourceSystem(order.getSourceSystem())
                        .patientId(patient.getId())
                        .messageControlId(order.getMessageControlId())
                        .line(line)
                        .build());
            }
            List<ReconciliationResult> results = reconciliationService.reconcileAll(commands);

            List<OrderOutcome> outcomes = new ArrayList<>(results.size());
            for (int i = 0; i < results.size(); i++) {
                outcomes.add(toOutcome(order.getLines().get(i).getSequence(), results.get(i)));
            }
            IngestionResponse response = success(order, patient, results, outcomes);
            response.setAck(ack(header, null, null));
            auditService.markProcessed(logId, order.getMessageControlId(), messageType, patient.getId(),
                    response.getMessage());
            count(channel, IngestionResponse.SUCCESS);
            log.info("{} message {} processed: {} line(s), first accession {}", channel,
                    order.getMessageControlId(), results.size(), response.getAccessionNumber());
            return response;
        } catch (RadiologyException e) {
            log.warn("{} message rejected with {}: {}\n{}", channel, e.getKind().getCode(), e.getMessage(),
                    rawMessage);
            if (header == null) {
                header = parser.criticalHeader(rawMessage);
            }
            return failure(logId, header, messageType, channel, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error processing {} message: {}", channel, e.getMessage(), e);
            return failure(logId, header, messageType, channel, ErrorKind.INTERNAL_ERROR,
                    "Unexpected error: " + e.getMessage());
        } finally {
            sample.stop(meterRegistry.timer("radiology.hl7.processing", "channel", channel.name()));
            MDC.remove(MDC_MESSAGE_CONTROL_ID);
        }
    }

    private IngestionResponse success(ExtractedOrder order, Patient patient, List<ReconciliationResult> results,
            List<OrderOutcome> outcomes) {
        ReconciliationResult first = results.get(0);
        String message;
        if (results.stream().allMatch(ReconciliationResult::isReplayed)) {
            message = "Order already received; returning the existing procedure request";
        } else if (results.size() == 1) {
            message = "HL7 message processed successfully";
        } else {
            message = "HL7 message processed successfully (" + results.size() + " order lines)";
        }
        return IngestionResponse.builder()
                .status(IngestionResponse.SUCCESS)
                .message(message)
                .patient(patient.getId())
                .requestId(first.getRequest().getId())
                .externalRequestId(first.getRequest().getExternalRequestId())
                .accessionNumber(first.getAccession().getAccessionNumber())
                .accessionGenerated(first.isGenerated())
                .messageControlId(order.getMessageControlId())
                .orders(outcomes)
                .build();
    }

    private IngestionResponse failure(String logId, MessageHeader header, String messageType,
            IngestionChannel channel, ErrorKind kind, String detail) {
        String controlId = header == null ? null : header.getMessageControlId();
        auditService.markFailed(logId, controlId, messageType, kind.getCode(), detail);
        count(channel, kind.getCode());

        return IngestionResponse.builder()
                .status(IngestionResponse.ERROR)
                .message("Error processing HL7 message: " + detail)
                .error(kind.getCode())
                .retryable(kind.isRetryable())
                .messageControlId(controlId)
                .errorKind(kind)
                .ack(ack(header, kind, detail))
                .build();
    }

    private OrderOutcome toOutcome(int sequence, ReconciliationResult result) {
        return OrderOutcome.builder()
                .sequence(sequence)
                .requestId(result.getRequest().getId())
                .externalRequestId(result.getRequest().getExternalRequestId())
                .accessionNumber(result.getAccession().getAccessionNumber())
                .accessionGenerated(result.isGenerated())
                .replayed(result.isReplayed())
                .build();
    }

    private String ack(MessageHeader header, ErrorKind kind, String detail) {
        try {
            return kind == null
                    ? ackMessageService.generateAckAccept(header)
                    : ackMessageService.generateAckFor(header, kind, detail);
        } catch (HL7Exception e) {
            log.error("Failed to generate ACK: {}", e.getMessage(), e);
            return null;
        }
    }

    private void count(IngestionChannel channel, String outcome) {
        meterRegistry.counter("radiology.hl7.messages", "channel", channel.name(), "outcome", outcome).increment();
    }

    static boolean isOrderMessage(String messageType) {
        return messageType != null && (messageType.equals("ORM") || messageType.startsWith("ORM^"));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
