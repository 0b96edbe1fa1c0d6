package com.al.radiologyfiller.controller;

import com.al.radiologyfiller.dto.StatusUpdateRequest;
import com.al.radiologyfiller.dto.StudyInstanceUidRequest;
import com.al.radiologyfiller.model.Accession;
import com.al.radiologyfiller.model.ProcedureRequest;
import com.al.radiologyfiller.model.enums.AccessionStatus;
import com.al.radiologyfiller.service.AccessionService;
import com.al.radiologyfiller.service.ProcedureRequestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/radiology/accessions")
@Tag(name = "Accessions", description = "Accessions, workflow status and the DICOM study slot")
public class AccessionController {

    private final AccessionService accessionService;
    private final ProcedureRequestService procedureRequestService;

    public AccessionController(AccessionService accessionService, ProcedureRequestService procedureRequestService) {
        this.accessionService = accessionService;
        this.procedureRequestService = procedureRequestService;
    }

    @Operation(summary = "Get an accession by number")
    @GetMapping("/{accessionNumber}")
    public ResponseEntity<Accession> get(@PathVariable String accessionNumber) {
        return ResponseEntity.ok(accessionService.getByAccessionNumber(accessionNumber));
    }

    @Operation(summary = "List the procedure requests grouped under an accession")
    @GetMapping("/{accessionNumber}/requests")
    public ResponseEntity<List<ProcedureRequest>> getRequests(@PathVariable String accessionNumber) {
        accessionService.getByAccessionNumber(accessionNumber);
        return ResponseEntity.ok(procedureRequestService.findByAccessionNumber(accessionNumber));
    }

    @Operation(summary = "Change the workflow status of an accession")
    @PutMapping("/{accessionNumber}/status")
    public ResponseEntity<Accession> updateStatus(@PathVariable String accessionNumber,
            @Valid @RequestBody StatusUpdateRequest request) {
        AccessionStatus next = AccessionStatus.fromValue(request.getStatus());
        return ResponseEntity.ok(accessionService.updateStatus(accessionNumber, next));
    }

    @Operation(summary = "Record the DICOM Study Instance UID", description = "Write-once. Repeating the recorded UID is accepted; a different UID is rejected for operator review.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "UID recorded"),
            @ApiResponse(responseCode = "404", description = "Unknown accession"),
            @ApiResponse(responseCode = "409", description = "Another UID is already recorded")
    })
    @PutMapping("/{accessionNumber}/study-instance-uid")
    public ResponseEntity<Accession> assignStudyInstanceUid(@PathVariable String accessionNumber,
            @Valid @RequestBody StudyInstanceUidRequest request) {
        return ResponseEntity.ok(accessionService.assignStudyInstanceUid(accessionNumber,
                request.getStudyInstanceUid()));
    }
}
