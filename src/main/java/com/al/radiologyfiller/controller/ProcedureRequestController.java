package com.al.radiologyfiller.controller;

import com.al.radiologyfiller.dto.StatusUpdateRequest;
import com.al.radiologyfiller.model.ProcedureRequest;
import com.al.radiologyfiller.model.enums.ProcedureRequestStatus;
import com.al.radiologyfiller.service.ProcedureRequestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/radiology/requests")
@Tag(name = "Procedure Requests", description = "Requested procedures and their workflow status")
public class ProcedureRequestController {

    private final ProcedureRequestService procedureRequestService;

    public ProcedureRequestController(ProcedureRequestService procedureRequestService) {
        this.procedureRequestService = procedureRequestService;
    }

    @Operation(summary = "Get a procedure request by id")
    @GetMapping("/{id}")
    public ResponseEntity<ProcedureRequest> getById(@PathVariable String id) {
        return ResponseEntity.ok(procedureRequestService.getById(id));
    }

    @Operation(summary = "Find a procedure request by its Requested Procedure ID", description = "source_system is the sending application (MSH-3); omit it for globally scoped RPIDs.")
    @GetMapping
    public ResponseEntity<ProcedureRequest> getByExternalRequestId(
            @RequestParam("external_request_id") String externalRequestId,
            @RequestParam(value = "source_system", required = false) String sourceSystem) {
        return ResponseEntity.ok(procedureRequestService.getByExternalRequestId(sourceSystem, externalRequestId));
    }

    @Operation(summary = "Change the workflow status of a procedure request")
    @PutMapping("/{id}/status")
    public ResponseEntity<ProcedureRequest> updateStatus(@PathVariable String id,
            @Valid @RequestBody StatusUpdateRequest request) {
        ProcedureRequestStatus next = ProcedureRequestStatus.fromValue(request.getStatus());
        return ResponseEntity.ok(procedureRequestService.updateStatus(id, next));
    }
}
