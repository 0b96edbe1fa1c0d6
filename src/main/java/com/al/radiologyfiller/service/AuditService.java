package com.al.radiologyfiller.service;

import com.al.radiologyfiller.model.Hl7MessageLog;
import com.al.radiologyfiller.model.enums.IngestionChannel;
import com.al.radiologyfiller.model.enums.MessageLogStatus;
import com.al.radiologyfiller.repository.Hl7MessageLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Message log: each inbound message is stored as PENDING on arrival and completed exactly once as
 * PROCESSED or FAILED. Audit write failures are logged and never fail the message itself.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final Hl7MessageLogRepository messageLogRepository;
    private final Clock clock;

    public AuditService(Hl7MessageLogRepository messageLogRepository, Clock clock) {
        this.messageLogRepository = messageLogRepository;
        this.clock = clock;
    }

    /**
     * @return id of the log entry, or null when it could not be stored
     */
    public String recordReceived(String rawMessage, IngestionChannel channel) {
        try {
            Hl7MessageLog entry = new Hl7MessageLog();
            entry.setRawMessage(rawMessage);
            entry.setChannel(channel);
            entry.setStatus(MessageLogStatus.PENDING);
            entry.setReceivedAt(LocalDateTime.now(clock));
            return messageLogRepository.save(entry).getId();
        } catch (Exception e) {
            log.error("Failed to store inbound {} message in the message log: {}", channel, e.getMessage(), e);
            return null;
        }
    }

    public void markProcessed(String logId, String messageControlId, String messageType, String patientId,
            String note) {
        complete(logId, MessageLogStatus.PROCESSED, messageControlId, messageType, patientId, note, null, null);
    }

    public void markFailed(String logId, String messageControlId, String messageType, String errorKind,
            String error) {
        complete(logId, MessageLogStatus.FAILED, messageControlId, messageType, null, null, errorKind, error);
    }

    private void complete(String logId, MessageLogStatus status, String messageControlId, String messageType,
            String patientId, String note, String errorKind, String error) {
        if (logId == null) {
            return;
        }
        try {
            messageLogRepository.findById(logId).ifPresent(entry -> {
                entry.setStatus(status);
                entry.setMessageControlId(messageControlId);
                entry.setMessageType(messageType);
                entry.setPatientId(patientId);
                entry.setNote(note);
                entry.setErrorKind(errorKind);
                entry.setError(error);
                entry.setCompletedAt(LocalDateTime.now(clock));
                messageLogRepository.save(entry);
            });
        } catch (Exception e) {
            log.error("Failed to complete message log {} as {}: {}", logId, status, e.getMessage(), e);
        }
    }

    public Optional<Hl7MessageLog> findById(String logId) {
        return messageLogRepository.findById(logId);
    }

    public List<Hl7MessageLog> findByMessageControlId(String messageControlId) {
        return messageLogRepository.findByMessageControlIdOrderByReceivedAtDesc(messageControlId);
    }

    public Page<Hl7MessageLog> findByStatus(MessageLogStatus status, Pageable pageable) {
        return messageLogRepository.findByStatus(status, pageable);
    }
}
