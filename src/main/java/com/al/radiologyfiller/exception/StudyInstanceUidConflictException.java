package com.al.radiologyfiller.exception;

import lombok.Getter;

@Getter
public class StudyInstanceUidConflictException extends RadiologyException {

    private final String accessionNumber;
    private final String assignedUid;
    private final String rejectedUid;

    public StudyInstanceUidConflictException(String accessionNumber, String assignedUid, String rejectedUid) {
        super(ErrorKind.STUDY_INSTANCE_UID_CONFLICT, String.format(
                "Accession %s already has Study Instance UID %s; rejected %s", accessionNumber, assignedUid,
                rejectedUid));
        this.accessionNumber = accessionNumber;
        this.assignedUid = assignedUid;
        this.rejectedUid = rejectedUid;
    }
}
