package com.al.radiologyfiller.exception;

public class ResourceNotFoundException extends RadiologyException {

    public ResourceNotFoundException(String resource, String id) {
        super(ErrorKind.NOT_FOUND, resource + " not found: " + id);
    }
}
