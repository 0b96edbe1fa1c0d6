package com.al.radiologyfiller.exception;

public class FhirMappingException extends RadiologyException {

    public FhirMappingException(String message) {
        super(ErrorKind.MAPPING_ERROR, message);
    }

    public FhirMappingException(String message, Throwable cause) {
        super(ErrorKind.MAPPING_ERROR, message, cause);
    }
}
