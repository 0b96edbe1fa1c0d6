package com.al.radiologyfiller.repository;

import com.al.radiologyfiller.model.ProcedureRequest;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProcedureRequestRepository
        extends MongoRepository<ProcedureRequest, String>, ProcedureRequestRepositoryCustom {

    Optional<ProcedureRequest> findByRequestScopeAndExternalRequestId(String requestScope, String externalRequestId);

    List<ProcedureRequest> findByAccessionNumberOrderByCreatedAtAsc(String accessionNumber);
}
