package com.al.radiologyfiller.exception;

public class InvalidAccessionPatternException extends RadiologyException {

    public InvalidAccessionPatternException(String pattern, String reason) {
        super(ErrorKind.INVALID_PATTERN, "Invalid accession pattern '" + pattern + "': " + reason);
    }
}
