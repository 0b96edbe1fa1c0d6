package com.al.radiologyfiller.service.mapper;

import com.al.radiologyfiller.exception.FhirMappingException;
import com.al.radiologyfiller.model.Accession;
import com.al.radiologyfiller.model.AccessionRequestLink;
import com.al.radiologyfiller.model.enums.AccessionStatus;
import com.al.radiologyfiller.util.DateTimeUtil;
import org.hl7.fhir.r4.model.Annotation;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Identifier;
import org.hl7.fhir.r4.model.ImagingStudy;
import org.hl7.fhir.r4.model.ImagingStudy.ImagingStudyStatus;
import org.hl7.fhir.r4.model.Reference;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static com.al.radiologyfiller.util.MappingConstants.*;

/**
 * Maps accessions to and from FHIR R4 ImagingStudy. The accession number travels as an ACSN
 * identifier and the Study Instance UID as a {@code urn:dicom:uid} identifier.
 */
@Component
public class AccessionFhirMapper {

    public ImagingStudy toImagingStudy(Accession accession) {
        if (accession.getAccessionNumber() == null || accession.getAccessionNumber().isBlank()) {
            throw new FhirMappingException("Accession is missing its accession number");
        }
        if (accession.getPatientId() == null) {
            throw new FhirMappingException("Accession " + accession.getAccessionNumber() + " has no patient");
        }
        if (accession.getStatus() == null) {
            throw new FhirMappingException("Accession " + accession.getAccessionNumber() + " has no status");
        }

        ImagingStudy study = new ImagingStudy();
        study.setId(accession.getAccessionNumber());
        study.addIdentifier(ProcedureRequestFhirMapper.typedIdentifier(ID_TYPE_ACCESSION, "Accession Number",
                accession.getAccessionNumber()).setSystem(SYSTEM_ACCESSION));
        if (accession.getStudyInstanceUid() != null) {
            study.addIdentifier().setSystem(SYSTEM_DICOM_UID).setValue(OID_PREFIX + accession.getStudyInstanceUid());
        }

        study.setStatus(toFhirStatus(accession.getStatus()));
        study.setSubject(new Reference(PATIENT_REFERENCE_PREFIX + accession.getPatientId()));
        if (accession.getStudyDate() != null) {
            study.setStarted(DateTimeUtil.toDate(accession.getStudyDate(), accession.getStudyTime()));
        }
        if (accession.getModality() != null) {
            study.addModality(new Coding().setSystem(SYSTEM_DICOM_DCM).setCode(accession.getModality()));
        }
        if (accession.getPerformingFacility() != null) {
            study.setLocation(new Reference().setDisplay(accession.getPerformingFacility()));
        }
        if (accession.getNotes() != null) {
            study.addNote(new Annotation().setText(accession.getNotes()));
        }
        for (AccessionRequestLink link : accession.getRequests()) {
            study.addBasedOn(new Reference(SERVICE_REQUEST_REFERENCE_PREFIX + link.getRequestId())
                    .setDisplay(link.getServiceName() != null ? link.getServiceName() : link.getExternalRequestId()));
        }
        // series are not tracked here
        study.setNumberOfSeries(0);
        study.setNumberOfInstances(0);
        return study;
    }

    /**
     * Reads the accession-level data of a study reported by the imaging side. The ACSN identifier is
     * required.
     */
    public ImagingStudyData fromImagingStudy(ImagingStudy study) {
        String accessionNumber = null;
        String studyInstanceUid = null;
        for (Identifier identifier : study.getIdentifier()) {
            if (!identifier.hasValue()) {
                continue;
            }
            if (ID_TYPE_ACCESSION.equals(ProcedureRequestFhirMapper.typeCode(identifier))) {
                accessionNumber = identifier.getValue();
            } else if (SYSTEM_DICOM_UID.equals(identifier.getSystem())) {
                String value = identifier.getValue();
                studyInstanceUid = value.startsWith(OID_PREFIX) ? value.substring(OID_PREFIX.length()) : value;
            }
        }
        if (accessionNumber == null) {
            throw new FhirMappingException("ImagingStudy has no accession number (ACSN identifier)");
        }

        LocalDateTime started = study.hasStarted() ? DateTimeUtil.toLocalDateTime(study.getStarted()) : null;
        List<String> notes = new ArrayList<>();
        for (Annotation note : study.getNote()) {
            if (note.hasText()) {
                notes.add(note.getText());
            }
        }

        return ImagingStudyData.builder()
                .accessionNumber(accessionNumber)
                .studyInstanceUid(studyInstanceUid)
                .patientId(ProcedureRequestFhirMapper.patientIdOf(study.getSubject()))
                .status(study.hasStatus() ? fromFhirStatus(study.getStatus()) : null)
                .studyDate(started == null ? null : started.toLocalDate())
                .studyTime(started == null ? null : started.toLocalTime())
                .modality(study.hasModality() ? study.getModalityFirstRep().getCode() : null)
                .performingFacility(study.hasLocation() && study.getLocation().hasDisplay()
                        ? study.getLocation().getDisplay()
                        : null)
                .notes(notes.isEmpty() ? null : String.join("\n", notes))
                .build();
    }

    public static ImagingStudyStatus toFhirStatus(AccessionStatus status) {
        switch (status) {
            case SCHEDULED:
            case ARRIVED:
            case IN_PROGRESS:
                return ImagingStudyStatus.REGISTERED;
            case COMPLETED:
                return ImagingStudyStatus.AVAILABLE;
            case CANCELLED:
                return ImagingStudyStatus.CANCELLED;
            default:
                throw new FhirMappingException("No FHIR status for " + status);
        }
    }

    public static AccessionStatus fromFhirStatus(ImagingStudyStatus status) {
        switch (status) {
            case AVAILABLE:
                return AccessionStatus.COMPLETED;
            case CANCELLED:
                return AccessionStatus.CANCELLED;
            default:
                return AccessionStatus.SCHEDULED;
        }
    }
}
