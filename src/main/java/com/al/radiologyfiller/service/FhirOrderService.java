package com.al.radiologyfiller.service;

import com.al.radiologyfiller.config.RadiologyProperties;
import com.al.radiologyfiller.exception.AccessionPatientConflictException;
import com.al.radiologyfiller.exception.FhirMappingException;
import com.al.radiologyfiller.exception.PatientNotFoundException;
import com.al.radiologyfiller.exception.RadiologyException;
import com.al.radiologyfiller.model.Accession;
import com.al.radiologyfiller.model.Patient;
import com.al.radiologyfiller.model.enums.AccessionStatus;
import com.al.radiologyfiller.model.enums.IngestionChannel;
import com.al.radiologyfiller.service.mapper.AccessionFhirMapper;
import com.al.radiologyfiller.service.mapper.ImagingStudyData;
import com.al.radiologyfiller.service.mapper.InboundServiceRequest;
import com.al.radiologyfiller.service.mapper.ProcedureRequestFhirMapper;
import com.al.radiologyfiller.util.MappingConstants;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.hl7.fhir.r4.model.ImagingStudy;
import org.hl7.fhir.r4.model.ServiceRequest;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * FHIR side of the order filler: reads requests and accessions as R4 resources, accepts orders as
 * ServiceRequest and study reports as ImagingStudy.
 */
@Slf4j
@Service
public class FhirOrderService {

    static final String SERVICE_REQUEST_TYPE = "ServiceRequest";

    private final ProcedureRequestService procedureRequestService;
    private final AccessionService accessionService;
    private final PatientRegistryService patientRegistryService;
    private final ReconciliationService reconciliationService;
    private final AuditService auditService;
    private final ProcedureRequestFhirMapper procedureRequestMapper;
    private final AccessionFhirMapper accessionMapper;
    private final RadiologyProperties properties;
    private final MeterRegistry meterRegistry;

    public FhirOrderService(ProcedureRequestService procedureRequestService,
            AccessionService accessionService,
            PatientRegistryService patientRegistryService,
            ReconciliationService reconciliationService,
            AuditService auditService,
            ProcedureRequestFhirMapper procedureRequestMapper,
            AccessionFhirMapper accessionMapper,
            RadiologyProperties properties,
            MeterRegistry meterRegistry) {
        this.procedureRequestService = procedureRequestService;
        this.accessionService = accessionService;
        this.patientRegistryService = patientRegistryService;
        this.reconciliationService = reconciliationService;
        this.auditService = auditService;
        this.procedureRequestMapper = procedureRequestMapper;
        this.accessionMapper = accessionMapper;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public ServiceRequest getServiceRequest(String id) {
        return procedureRequestMapper.toServiceRequest(procedureRequestService.getById(id));
    }

    public ImagingStudy getImagingStudy(String accessionNumber) {
        return accessionMapper.toImagingStudy(accessionService.getByAccessionNumber(accessionNumber));
    }

    /**
     * Reconciles an order received as a ServiceRequest, exactly like one order line of an HL7 ORM.
     * The submission is recorded in the message log with its outcome.
     *
     * @param rawJson the resource as received, kept in the message log
     */
    public ReconciliationResult submitServiceRequest(ServiceRequest serviceRequest, String rawJson) {
        String logId = auditService.recordReceived(rawJson, IngestionChannel.FHIR);
        String controlId = serviceRequest.getIdElement().getIdPart();
        try {
            InboundServiceRequest inbound = procedureRequestMapper.fromServiceRequest(serviceRequest);
            Patient patient = patientRegistryService.findById(inbound.getPatientId())
                    .orElseThrow(() -> new PatientNotFoundException(
                            MappingConstants.PATIENT_REFERENCE_PREFIX + inbound.getPatientId()));

            ReconciliationResult result = reconciliationService.reconcile(ReconciliationCommand.builder()
                    .requestScope(properties.requestScopeFor(inbound.getSourceSystem()))
                    .sourceSystem(inbound.getSourceSystem())
                    .patientId(patient.getId())
                    .messageControlId(controlId)
                    .line(inbound.getLine())
                    .build());

            String note = result.isReplayed()
                    ? "Order already received"
                    : "Procedure request " + result.getRequest().getId() + " stored";
            auditService.markProcessed(logId, controlId, SERVICE_REQUEST_TYPE, patient.getId(), note);
            count("success");
            log.info("FHIR ServiceRequest {} reconciled to accession {} (replayed: {})",
                    result.getRequest().getExternalRequestId(), result.getAccession().getAccessionNumber(),
                    result.isReplayed());
            return result;
        } catch (RadiologyException e) {
            log.warn("FHIR ServiceRequest rejected with {}: {}", e.getKind().getCode(), e.getMessage());
            auditService.markFailed(logId, controlId, SERVICE_REQUEST_TYPE, e.getKind().getCode(), e.getMessage());
            count(e.getKind().getCode());
            throw e;
        }
    }

    /**
     * Applies a study reported by the imaging side. The Study Instance UID goes through the write-once
     * slot; a reported status is applied when the accession lifecycle allows it.
     */
    public ImagingStudy applyImagingStudy(ImagingStudy imagingStudy) {
        ImagingStudyData data = accessionMapper.fromImagingStudy(imagingStudy);
        if (data.getStudyInstanceUid() == null) {
            throw new FhirMappingException("ImagingStudy " + data.getAccessionNumber()
                    + " carries no " + MappingConstants.SYSTEM_DICOM_UID + " identifier");
        }

        Accession accession = accessionService.getByAccessionNumber(data.getAccessionNumber());
        if (data.getPatientId() != null && !Objects.equals(data.getPatientId(), accession.getPatientId())) {
            throw new AccessionPatientConflictException(accession.getAccessionNumber(), accession.getPatientId(),
                    data.getPatientId());
        }

        accession = accessionService.assignStudyInstanceUid(data.getAccessionNumber(), data.getStudyInstanceUid());

        AccessionStatus reported = data.getStatus();
        if (reported != null && reported != accession.getStatus()) {
            if (accession.getStatus() != null && accession.getStatus().canTransitionTo(reported)) {
                accession = accessionService.updateStatus(accession.getAccessionNumber(), reported);
            } else {
                log.info("Ignoring reported status {} for accession {} in status {}", reported,
                        accession.getAccessionNumber(), accession.getStatus());
            }
        }
        return accessionMapper.toImagingStudy(accession);
    }

    private void count(String outcome) {
        meterRegistry.counter("radiology.hl7.messages", "channel", IngestionChannel.FHIR.name(), "outcome", outcome)
                .increment();
    }
}
