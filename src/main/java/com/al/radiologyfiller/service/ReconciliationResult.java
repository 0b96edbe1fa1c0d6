package com.al.radiologyfiller.service;

import com.al.radiologyfiller.model.Accession;
import com.al.radiologyfiller.model.ProcedureRequest;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReconciliationResult {
    ProcedureRequest request;
    Accession accession;
    /** The accession number was produced by the generator for this request. */
    boolean generated;
    /** The RPID was already known; nothing was written. */
    boolean replayed;
    /** A new accession was stored for this request. */
    boolean accessionCreated;
}
