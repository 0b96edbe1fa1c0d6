package com.al.radiologyfiller.exception;

import lombok.Getter;

/**
 * An accession number supplied by the placer already belongs to another patient. The order is
 * rejected rather than relinked.
 */
@Getter
public class AccessionPatientConflictException extends RadiologyException {

    private final String accessionNumber;
    private final String existingPatientId;
    private final String requestedPatientId;

    public AccessionPatientConflictException(String accessionNumber, String existingPatientId,
            String requestedPatientId) {
        super(ErrorKind.ACCESSION_PATIENT_CONFLICT, String.format(
                "Accession %s belongs to patient %s, not %s", accessionNumber, existingPatientId,
                requestedPatientId));
        this.accessionNumber = accessionNumber;
        this.existingPatientId = existingPatientId;
        this.requestedPatientId = requestedPatientId;
    }
}
