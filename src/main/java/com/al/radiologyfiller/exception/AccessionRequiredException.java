package com.al.radiologyfiller.exception;

public class AccessionRequiredException extends RadiologyException {

    public AccessionRequiredException(String externalRequestId) {
        super(ErrorKind.ACCESSION_REQUIRED, "No accession number supplied for request " + externalRequestId
                + " and automatic accession generation is disabled");
    }
}
