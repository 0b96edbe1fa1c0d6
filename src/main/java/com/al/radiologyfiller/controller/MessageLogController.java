package com.al.radiologyfiller.controller;

import com.al.radiologyfiller.exception.ResourceNotFoundException;
import com.al.radiologyfiller.model.Hl7MessageLog;
import com.al.radiologyfiller.model.enums.MessageLogStatus;
import com.al.radiologyfiller.service.AuditService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/radiology/messages")
@Tag(name = "Message Log", description = "Audit trail of inbound messages")
public class MessageLogController {

    private final AuditService auditService;

    public MessageLogController(AuditService auditService) {
        this.auditService = auditService;
    }

    @Operation(summary = "Get a logged message by id")
    @GetMapping("/{id}")
    public ResponseEntity<Hl7MessageLog> getById(@PathVariable String id) {
        return ResponseEntity.ok(auditService.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Hl7MessageLog", id)));
    }

    @Operation(summary = "List logged messages", description = "Filter by MSH-10 control id, or page through one status, newest first.")
    @GetMapping
    public ResponseEntity<List<Hl7MessageLog>> list(
            @RequestParam(value = "message_control_id", required = false) String messageControlId,
            @RequestParam(defaultValue = "FAILED") MessageLogStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        if (messageControlId != null && !messageControlId.isBlank()) {
            return ResponseEntity.ok(auditService.findByMessageControlId(messageControlId));
        }
        Page<Hl7MessageLog> logs = auditService.findByStatus(status,
                PageRequest.of(page, size, Sort.by("receivedAt").descending()));
        return ResponseEntity.ok()
                .header("X-Total-Count", String.valueOf(logs.getTotalElements()))
                .body(logs.getContent());
    }
}
