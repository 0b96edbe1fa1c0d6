package com.al.radiologyfiller.util;

import com.al.radiologyfiller.exception.ErrorKind;
import com.al.radiologyfiller.exception.RadiologyException;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.OperationOutcome;
import org.hl7.fhir.r4.model.OperationOutcome.IssueSeverity;
import org.hl7.fhir.r4.model.OperationOutcome.IssueType;
import org.hl7.fhir.r4.model.OperationOutcome.OperationOutcomeIssueComponent;

/**
 * Builds FHIR OperationOutcome resources for the FHIR endpoints.
 */
public class OperationOutcomeBuilder {

    /**
     * Build an OperationOutcome for a single message
     */
    public static OperationOutcome fromMessage(String message, IssueSeverity severity) {
        OperationOutcome outcome = new OperationOutcome();
        OperationOutcomeIssueComponent issue = outcome.addIssue();
        issue.setSeverity(severity);
        issue.setCode(severity == IssueSeverity.INFORMATION ? IssueType.INFORMATIONAL : IssueType.PROCESSING);
        issue.setDiagnostics(message);
        return outcome;
    }

    /**
     * Build an OperationOutcome for a failure; the error kind code goes into the issue details
     */
    public static OperationOutcome fromException(RadiologyException e) {
        OperationOutcome outcome = new OperationOutcome();
        OperationOutcomeIssueComponent issue = outcome.addIssue();
        issue.setSeverity(IssueSeverity.ERROR);
        issue.setCode(mapIssueType(e.getKind()));
        issue.setDiagnostics(e.getMessage());

        CodeableConcept details = new CodeableConcept();
        details.setText(e.getKind().getCode());
        issue.setDetails(details);
        return outcome;
    }

    /**
     * Map an error kind to the FHIR IssueType
     */
    static IssueType mapIssueType(ErrorKind kind) {
        switch (kind) {
            case PARSE_ERROR:
                return IssueType.STRUCTURE;
            case MISSING_IDENTIFIER:
            case ACCESSION_REQUIRED:
                return IssueType.REQUIRED;
            case MAPPING_ERROR:
                return IssueType.INVALID;
            case NOT_FOUND:
            case PATIENT_NOT_FOUND:
                return IssueType.NOTFOUND;
            case ACCESSION_PATIENT_CONFLICT:
            case STUDY_INSTANCE_UID_CONFLICT:
            case INVALID_STATUS_TRANSITION:
                return IssueType.CONFLICT;
            case CONCURRENCY_CONFLICT:
                return IssueType.TRANSIENT;
            case UNSUPPORTED_MESSAGE_TYPE:
                return IssueType.NOTSUPPORTED;
            default:
                return IssueType.EXCEPTION;
        }
    }
}
