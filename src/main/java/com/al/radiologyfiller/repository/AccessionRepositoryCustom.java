package com.al.radiologyfiller.repository;

import com.al.radiologyfiller.model.AccessionRequestLink;
import com.al.radiologyfiller.model.enums.AccessionStatus;

/**
 * Single-document atomic updates on accessions.
 */
public interface AccessionRepositoryCustom {

    /**
     * Appends the link unless a link for the same request is already present.
     *
     * @return true if the link was appended
     */
    boolean appendRequest(String accessionNumber, AccessionRequestLink link);

    /**
     * Removes the link for a request. Used to undo an order line whose message failed later on.
     */
    void removeRequest(String accessionNumber, String requestId);

    /**
     * Fills the Study Instance UID slot only while it is still empty.
     *
     * @return true if this call performed the write
     */
    boolean assignStudyInstanceUid(String accessionNumber, String studyInstanceUid);

    boolean compareAndSetStatus(String accessionNumber, AccessionStatus expected, AccessionStatus next);
}
