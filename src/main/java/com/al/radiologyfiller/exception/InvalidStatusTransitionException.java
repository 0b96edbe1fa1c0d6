package com.al.radiologyfiller.exception;

public class InvalidStatusTransitionException extends RadiologyException {

    public InvalidStatusTransitionException(String entity, String id, Enum<?> from, Enum<?> to) {
        super(ErrorKind.INVALID_STATUS_TRANSITION,
                String.format("%s %s cannot move from %s to %s", entity, id, from, to));
    }
}
