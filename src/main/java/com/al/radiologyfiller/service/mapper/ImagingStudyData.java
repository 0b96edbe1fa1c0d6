package com.al.radiologyfiller.service.mapper;

import com.al.radiologyfiller.model.enums.AccessionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Accession fields read from a FHIR ImagingStudy.
 */
@Value
@Builder
public class ImagingStudyData {
    String accessionNumber;
    String studyInstanceUid;
    String patientId;
    AccessionStatus status;
    LocalDate studyDate;
    LocalTime studyTime;
    String modality;
    String performingFacility;
    String notes;
}
