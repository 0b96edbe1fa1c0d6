package com.al.radiologyfiller.repository;

import com.al.radiologyfiller.model.enums.ProcedureRequestStatus;

public interface ProcedureRequestRepositoryCustom {

    /**
     * Sets the status only if the stored status still equals {@code expected}.
     *
     * @return true if the document was updated
     */
    boolean compareAndSetStatus(String id, ProcedureRequestStatus expected, ProcedureRequestStatus next);
}
