package com.al.radiologyfiller.exception;

import lombok.Getter;

@Getter
public class PatientNotFoundException extends RadiologyException {

    private final String lookup;

    public PatientNotFoundException(String lookup) {
        super(ErrorKind.PATIENT_NOT_FOUND, "Could not identify patient from " + lookup);
        this.lookup = lookup;
    }
}
