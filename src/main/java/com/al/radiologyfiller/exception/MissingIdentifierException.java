package com.al.radiologyfiller.exception;

public class MissingIdentifierException extends RadiologyException {

    public MissingIdentifierException(String message) {
        super(ErrorKind.MISSING_IDENTIFIER, message);
    }
}
