package com.al.radiologyfiller.exception;

public class UnsupportedMessageTypeException extends RadiologyException {

    public UnsupportedMessageTypeException(String messageType) {
        super(ErrorKind.UNSUPPORTED_MESSAGE_TYPE, "Unsupported message type: " + messageType);
    }
}
