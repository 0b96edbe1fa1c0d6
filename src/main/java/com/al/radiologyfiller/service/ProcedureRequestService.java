package com.al.radiologyfiller.service;

import com.al.radiologyfiller.config.RadiologyProperties;
import com.al.radiologyfiller.exception.ConcurrencyConflictException;
import com.al.radiologyfiller.exception.InvalidStatusTransitionException;
import com.al.radiologyfiller.exception.ResourceNotFoundException;
import com.al.radiologyfiller.model.ProcedureRequest;
import com.al.radiologyfiller.model.enums.ProcedureRequestStatus;
import com.al.radiologyfiller.repository.ProcedureRequestRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reads procedure requests and applies workflow status changes.
 */
@Slf4j
@Service
public class ProcedureRequestService {

    private final ProcedureRequestRepository procedureRequestRepository;
    private final RadiologyProperties properties;

    public ProcedureRequestService(ProcedureRequestRepository procedureRequestRepository,
            RadiologyProperties properties) {
        this.procedureRequestRepository = procedureRequestRepository;
        this.properties = properties;
    }

    public ProcedureRequest getById(String id) {
        return procedureRequestRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("ProcedureRequest", id));
    }

    /**
     * @param sourceSystem sending application the RPID was issued by, or null for globally scoped RPIDs
     */
    public ProcedureRequest getByExternalRequestId(String sourceSystem, String externalRequestId) {
        String scope = properties.requestScopeFor(sourceSystem);
        return procedureRequestRepository.findByRequestScopeAndExternalRequestId(scope, externalRequestId)
                .orElseThrow(() -> new ResourceNotFoundException("ProcedureRequest", scope + "/" + externalRequestId));
    }

    public List<ProcedureRequest> findByAccessionNumber(String accessionNumber) {
        return procedureRequestRepository.findByAccessionNumberOrderByCreatedAtAsc(accessionNumber);
    }

    /**
     * Moves a request forward in its lifecycle. Setting the current status again is a no-op.
     *
     * @throws InvalidStatusTransitionException if the lifecycle does not allow the change
     * @throws ConcurrencyConflictException     if the status changed concurrently
     */
    public ProcedureRequest updateStatus(String id, ProcedureRequestStatus next) {
        ProcedureRequest request = getById(id);
        ProcedureRequestStatus current = request.getStatus();
        if (current == next) {
            return request;
        }
        if (current == null || !current.canTransitionTo(next)) {
            throw new InvalidStatusTransitionException("ProcedureRequest", id, current, next);
        }
        if (!procedureRequestRepository.compareAndSetStatus(id, current, next)) {
            throw new ConcurrencyConflictException("Status of procedure request " + id + " changed concurrently");
        }
        log.info("Procedure request {} ({}) moved from {} to {}", id, request.getExternalRequestId(), current, next);
        return getById(id);
    }
}
