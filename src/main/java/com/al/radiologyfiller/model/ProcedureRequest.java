package com.al.radiologyfiller.model;

import com.al.radiologyfiller.model.enums.ProcedurePriority;
import com.al.radiologyfiller.model.enums.ProcedureRequestStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * One imaging order line. The (requestScope, externalRequestId) pair is unique; everything except the
 * status is fixed at creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "procedure_requests")
@CompoundIndex(def = "{'requestScope': 1, 'externalRequestId': 1}", name = "scope_rpid_idx", unique = true)
public class ProcedureRequest {

    /** Scope used when the sending system is unknown or RPIDs are configured as globally unique. */
    public static final String GLOBAL_SCOPE = "*";

    @Id
    private String id;

    private String externalRequestId; // RPID
    private String requestScope;
    private String sourceSystem;

    private String placerOrderNumber;
    private String fillerOrderNumber;
    private String serviceCode;
    private String serviceName;
    private String orderingProvider;
    private LocalDateTime requestedDateTime;
    private ProcedurePriority priority;
    private String notes;

    @Indexed
    private String patientId;

    @Indexed
    private String accessionNumber;

    private ProcedureRequestStatus status;

    private String messageControlId;
    private LocalDateTime createdAt;
    private LocalDateTime statusUpdatedAt;
}
