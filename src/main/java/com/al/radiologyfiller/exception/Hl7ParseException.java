package com.al.radiologyfiller.exception;

import lombok.Getter;

/**
 * Thrown when an inbound HL7 v2 message cannot be tokenized. Carries the text of the segment that
 * failed so the operator can find it in the raw message.
 */
@Getter
public class Hl7ParseException extends RadiologyException {

    private final String segmentText;

    public Hl7ParseException(String message, String segmentText) {
        super(ErrorKind.PARSE_ERROR, segmentText == null ? message : message + " [" + segmentText + "]");
        this.segmentText = segmentText;
    }
}
