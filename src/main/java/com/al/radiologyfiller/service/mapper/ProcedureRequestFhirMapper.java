package com.al.radiologyfiller.service.mapper;

import com.al.radiologyfiller.exception.FhirMappingException;
import com.al.radiologyfiller.hl7.OrderLine;
import com.al.radiologyfiller.model.ProcedureRequest;
import com.al.radiologyfiller.model.enums.ProcedurePriority;
import com.al.radiologyfiller.model.enums.ProcedureRequestStatus;
import com.al.radiologyfiller.util.DateTimeUtil;
import org.hl7.fhir.r4.model.Annotation;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Identifier;
import org.hl7.fhir.r4.model.Reference;
import org.hl7.fhir.r4.model.ServiceRequest;
import org.hl7.fhir.r4.model.ServiceRequest.ServiceRequestIntent;
import org.hl7.fhir.r4.model.ServiceRequest.ServiceRequestPriority;
import org.hl7.fhir.r4.model.ServiceRequest.ServiceRequestStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.al.radiologyfiller.util.MappingConstants.*;

/**
 * Maps procedure requests to and from FHIR R4 ServiceRequest (the R4 successor of ProcedureRequest).
 * <p>
 * Identifiers: internal id, RPID (system = source system), PLAC, FILL and ACSN. Missing required data
 * fails the mapping; nothing is invented.
 */
@Component
public class ProcedureRequestFhirMapper {

    public ServiceRequest toServiceRequest(ProcedureRequest request) {
        require(request.getId(), "id");
        require(request.getExternalRequestId(), "external request id");
        require(request.getPatientId(), "patient");
        if (request.getStatus() == null) {
            throw new FhirMappingException("ProcedureRequest " + request.getId() + " has no status");
        }

        ServiceRequest serviceRequest = new ServiceRequest();
        serviceRequest.setId(request.getId());
        serviceRequest.addIdentifier().setSystem(SYSTEM_PROCEDURE_REQUEST).setValue(request.getId());

        Identifier rpid = typedIdentifier(ID_TYPE_RPID, "Requested Procedure ID", request.getExternalRequestId());
        if (request.getSourceSystem() != null) {
            rpid.setSystem(request.getSourceSystem());
        }
        serviceRequest.addIdentifier(rpid);
        if (request.getPlacerOrderNumber() != null) {
            serviceRequest.addIdentifier(typedIdentifier(ID_TYPE_PLACER, "Placer Order Number",
                    request.getPlacerOrderNumber()));
        }
        if (request.getFillerOrderNumber() != null) {
            serviceRequest.addIdentifier(typedIdentifier(ID_TYPE_FILLER, "Filler Order Number",
                    request.getFillerOrderNumber()));
        }
        if (request.getAccessionNumber() != null) {
            serviceRequest.addIdentifier(typedIdentifier(ID_TYPE_ACCESSION, "Accession Number",
                    request.getAccessionNumber()).setSystem(SYSTEM_ACCESSION));
        }

        serviceRequest.setStatus(toFhirStatus(request.getStatus()));
        serviceRequest.setIntent(ServiceRequestIntent.ORDER);
        serviceRequest.setSubject(new Reference(PATIENT_REFERENCE_PREFIX + request.getPatientId()));

        if (request.getServiceCode() != null || request.getServiceName() != null) {
            CodeableConcept code = new CodeableConcept();
            code.addCoding().setCode(request.getServiceCode()).setDisplay(request.getServiceName());
            code.setText(request.getServiceName());
            serviceRequest.setCode(code);
        }
        if (request.getRequestedDateTime() != null) {
            serviceRequest.setAuthoredOn(DateTimeUtil.toDate(request.getRequestedDateTime()));
        }
        if (request.getOrderingProvider() != null) {
            serviceRequest.setRequester(new Reference().setDisplay(request.getOrderingProvider()));
        }
        if (request.getPriority() != null) {
            serviceRequest.setPriority(toFhirPriority(request.getPriority()));
        }
        if (request.getNotes() != null) {
            serviceRequest.addNote(new Annotation().setText(request.getNotes()));
        }
        return serviceRequest;
    }

    /**
     * Reads an inbound order. The subject must be a Patient reference and an RPID must be present,
     * either as an RPID-typed identifier or, failing that, as the first identifier.
     */
    public InboundServiceRequest fromServiceRequest(ServiceRequest serviceRequest) {
        String patientId = patientIdOf(serviceRequest.getSubject());
        if (patientId == null) {
            throw new FhirMappingException("ServiceRequest.subject must reference a Patient");
        }

        Identifier rpid = null;
        String placer = null;
        String filler = null;
        String accession = null;
        for (Identifier identifier : serviceRequest.getIdentifier()) {
            if (!identifier.hasValue()) {
                continue;
            }
            String type = typeCode(identifier);
            if (ID_TYPE_RPID.equals(type)) {
                rpid = identifier;
            } else if (ID_TYPE_PLACER.equals(type)) {
                placer = identifier.getValue();
            } else if (ID_TYPE_FILLER.equals(type)) {
                filler = identifier.getValue();
            } else if (ID_TYPE_ACCESSION.equals(type)) {
                accession = identifier.getValue();
            }
        }
        if (rpid == null) {
            rpid = serviceRequest.getIdentifier().stream()
                    .filter(Identifier::hasValue)
                    .filter(i -> typeCode(i) == null)
                    .findFirst()
                    .orElseThrow(() -> new FhirMappingException("ServiceRequest has no Requested Procedure ID"));
        }

        String serviceCode = null;
        String serviceName = null;
        if (serviceRequest.hasCode()) {
            CodeableConcept code = serviceRequest.getCode();
            if (code.hasCoding()) {
                Coding coding = code.getCodingFirstRep();
                serviceCode = coding.getCode();
                serviceName = coding.getDisplay();
            }
            if (serviceName == null && code.hasText()) {
                serviceName = code.getText();
            }
        }

        List<String> notes = new ArrayList<>();
        for (Annotation note : serviceRequest.getNote()) {
            if (note.hasText()) {
                notes.add(note.getText());
            }
        }

        OrderLine line = OrderLine.builder()
                .sequence(1)
                .requestedProcedureId(rpid.getValue())
                .accessionNumber(accession)
                .placerOrderNumber(placer)
                .fillerOrderNumber(filler)
                .serviceCode(serviceCode)
                .serviceName(serviceName != null ? serviceName : serviceCode)
                .orderingProvider(serviceRequest.hasRequester() && serviceRequest.getRequester().hasDisplay()
                        ? serviceRequest.getRequester().getDisplay()
                        : null)
                .requestedDateTime(serviceRequest.hasAuthoredOn()
                        ? DateTimeUtil.toLocalDateTime(serviceRequest.getAuthoredOn())
                        : null)
                .priority(serviceRequest.hasPriority() ? fromFhirPriority(serviceRequest.getPriority())
                        : ProcedurePriority.ROUTINE)
                .notes(notes.isEmpty() ? null : String.join("\n", notes))
                .build();

        return InboundServiceRequest.builder()
                .patientId(patientId)
                .sourceSystem(rpid.hasSystem() ? rpid.getSystem() : null)
                .line(line)
                .build();
    }

    public static ServiceRequestStatus toFhirStatus(ProcedureRequestStatus status) {
        switch (status) {
            case PENDING:
                return ServiceRequestStatus.DRAFT;
            case SCHEDULED:
            case IN_PROGRESS:
                return ServiceRequestStatus.ACTIVE;
            case COMPLETED:
                return ServiceRequestStatus.COMPLETED;
            case CANCELLED:
                return ServiceRequestStatus.REVOKED;
            default:
                throw new FhirMappingException("No FHIR status for " + status);
        }
    }

    static ServiceRequestPriority toFhirPriority(ProcedurePriority priority) {
        switch (priority) {
            case STAT:
                return ServiceRequestPriority.STAT;
            case ASAP:
                return ServiceRequestPriority.ASAP;
            case URGENT:
                return ServiceRequestPriority.URGENT;
            default:
                return ServiceRequestPriority.ROUTINE;
        }
    }

    static ProcedurePriority fromFhirPriority(ServiceRequestPriority priority) {
        switch (priority) {
            case STAT:
                return ProcedurePriority.STAT;
            case ASAP:
                return ProcedurePriority.ASAP;
            case URGENT:
                return ProcedurePriority.URGENT;
            default:
                return ProcedurePriority.ROUTINE;
        }
    }

    static Identifier typedIdentifier(String typeCode, String display, String value) {
        Identifier identifier = new Identifier();
        identifier.setType(new CodeableConcept().addCoding(
                new Coding(SYSTEM_V2_IDENTIFIER_TYPE, typeCode, display)));
        identifier.setValue(value);
        return identifier;
    }

    static String typeCode(Identifier identifier) {
        if (!identifier.hasType() || !identifier.getType().hasCoding()) {
            return null;
        }
        return identifier.getType().getCodingFirstRep().getCode();
    }

    static String patientIdOf(Reference subject) {
        if (subject == null || !subject.hasReference()) {
            return null;
        }
        String reference = subject.getReference();
        if (!reference.startsWith(PATIENT_REFERENCE_PREFIX) || reference.length() == PATIENT_REFERENCE_PREFIX.length()) {
            return null;
        }
        return reference.substring(PATIENT_REFERENCE_PREFIX.length());
    }

    private static void require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new FhirMappingException("ProcedureRequest is missing its " + field);
        }
    }
}
