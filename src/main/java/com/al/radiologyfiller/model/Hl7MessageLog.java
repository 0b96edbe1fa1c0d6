package com.al.radiologyfiller.model;

import com.al.radiologyfiller.model.enums.IngestionChannel;
import com.al.radiologyfiller.model.enums.MessageLogStatus;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@Data
@Document(collection = "hl7_message_logs")
@CompoundIndex(def = "{'status': 1, 'receivedAt': -1}", name = "status_received_idx")
public class Hl7MessageLog {
    @Id
    private String id;

    @Indexed
    private String messageControlId;

    private String messageType; // e.g. "ORM^O01"
    private IngestionChannel channel;
    private String rawMessage;
    private MessageLogStatus status;

    private String patientId;
    private String note;
    private String errorKind;
    private String error;

    private LocalDateTime receivedAt;
    private LocalDateTime completedAt;
}
