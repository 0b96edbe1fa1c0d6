package com.al.radiologyfiller.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Error kinds surfaced to callers. The code is what appears in the {@code error} field of a structured
 * response; only {@link #CONCURRENCY_CONFLICT} may be retried blindly.
 */
@Getter
public enum ErrorKind {
    PARSE_ERROR("ParseError", HttpStatus.BAD_REQUEST, false),
    MISSING_IDENTIFIER("MissingIdentifierError", HttpStatus.UNPROCESSABLE_ENTITY, false),
    PATIENT_NOT_FOUND("PatientNotFoundError", HttpStatus.UNPROCESSABLE_ENTITY, false),
    INVALID_PATTERN("InvalidPatternError", HttpStatus.INTERNAL_SERVER_ERROR, false),
    ACCESSION_PATIENT_CONFLICT("AccessionPatientConflictError", HttpStatus.CONFLICT, false),
    ACCESSION_REQUIRED("AccessionRequiredError", HttpStatus.UNPROCESSABLE_ENTITY, false),
    CONCURRENCY_CONFLICT("ConcurrencyConflictError", HttpStatus.SERVICE_UNAVAILABLE, true),
    MAPPING_ERROR("MappingError", HttpStatus.UNPROCESSABLE_ENTITY, false),
    STUDY_INSTANCE_UID_CONFLICT("StudyInstanceUidConflictError", HttpStatus.CONFLICT, false),
    INVALID_STATUS_TRANSITION("InvalidStatusTransitionError", HttpStatus.CONFLICT, false),
    UNSUPPORTED_MESSAGE_TYPE("UnsupportedMessageTypeError", HttpStatus.UNPROCESSABLE_ENTITY, false),
    NOT_FOUND("NotFoundError", HttpStatus.NOT_FOUND, false),
    INTERNAL_ERROR("InternalError", HttpStatus.INTERNAL_SERVER_ERROR, false);

    private final String code;
    private final HttpStatus httpStatus;
    private final boolean retryable;

    ErrorKind(String code, HttpStatus httpStatus, boolean retryable) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }
}
