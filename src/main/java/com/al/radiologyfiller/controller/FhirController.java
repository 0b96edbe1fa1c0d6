package com.al.radiologyfiller.controller;

import ca.uhn.fhir.context.FhirContext;
import ca.uhn.fhir.parser.DataFormatException;
import ca.uhn.fhir.parser.IParser;
import com.al.radiologyfiller.exception.RadiologyException;
import com.al.radiologyfiller.service.FhirOrderService;
import com.al.radiologyfiller.service.ReconciliationResult;
import com.al.radiologyfiller.util.OperationOutcomeBuilder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.hl7.fhir.instance.model.api.IBaseResource;
import org.hl7.fhir.r4.model.ImagingStudy;
import org.hl7.fhir.r4.model.OperationOutcome.IssueSeverity;
import org.hl7.fhir.r4.model.ServiceRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * FHIR R4 surface. Bodies are FHIR JSON; failures are answered with an OperationOutcome.
 */
@RestController
@RequestMapping("/api/radiology/fhir")
@Slf4j
@Tag(name = "FHIR", description = "FHIR R4 ServiceRequest and ImagingStudy")
public class FhirController {

    public static final String FHIR_JSON = "application/fhir+json";

    private final FhirOrderService fhirOrderService;
    private final FhirContext fhirContext;

    public FhirController(FhirOrderService fhirOrderService, FhirContext fhirContext) {
        this.fhirOrderService = fhirOrderService;
        this.fhirContext = fhirContext;
    }

    @Operation(summary = "Read a procedure request as a FHIR ServiceRequest")
    @GetMapping(value = "/ServiceRequest/{id}", produces = { FHIR_JSON, MediaType.APPLICATION_JSON_VALUE })
    public ResponseEntity<String> getServiceRequest(@PathVariable String id) {
        return fhirResponse(HttpStatus.OK, fhirOrderService.getServiceRequest(id));
    }

    @Operation(summary = "Read an accession as a FHIR ImagingStudy")
    @GetMapping(value = "/ImagingStudy/{accessionNumber}", produces = { FHIR_JSON, MediaType.APPLICATION_JSON_VALUE })
    public ResponseEntity<String> getImagingStudy(@PathVariable String accessionNumber) {
        return fhirResponse(HttpStatus.OK, fhirOrderService.getImagingStudy(accessionNumber));
    }

    @Operation(summary = "Submit an order as a FHIR ServiceRequest", description = "Reconciled like one HL7 order line. 201 when stored, 200 when the RPID was already known.")
    @PostMapping(value = "/ServiceRequest", consumes = { FHIR_JSON, MediaType.APPLICATION_JSON_VALUE }, produces = {
            FHIR_JSON, MediaType.APPLICATION_JSON_VALUE })
    public ResponseEntity<String> submitServiceRequest(
            @Parameter(description = "FHIR R4 ServiceRequest in JSON format") @RequestBody String body) {
        ServiceRequest serviceRequest = parser().parseResource(ServiceRequest.class, body);
        ReconciliationResult result = fhirOrderService.submitServiceRequest(serviceRequest, body);
        ServiceRequest stored = fhirOrderService.getServiceRequest(result.getRequest().getId());
        return fhirResponse(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED, stored);
    }

    @Operation(summary = "Report an imaging study", description = "Records the Study Instance UID of the urn:dicom:uid identifier on the accession named by the ACSN identifier.")
    @PostMapping(value = "/ImagingStudy", consumes = { FHIR_JSON, MediaType.APPLICATION_JSON_VALUE }, produces = {
            FHIR_JSON, MediaType.APPLICATION_JSON_VALUE })
    public ResponseEntity<String> reportImagingStudy(
            @Parameter(description = "FHIR R4 ImagingStudy in JSON format") @RequestBody String body) {
        ImagingStudy imagingStudy = parser().parseResource(ImagingStudy.class, body);
        return fhirResponse(HttpStatus.OK, fhirOrderService.applyImagingStudy(imagingStudy));
    }

    @ExceptionHandler(RadiologyException.class)
    public ResponseEntity<String> handleRadiologyError(RadiologyException e) {
        log.warn("FHIR request failed with {}: {}", e.getKind().getCode(), e.getMessage());
        return fhirResponse(e.getKind().getHttpStatus(), OperationOutcomeBuilder.fromException(e));
    }

    @ExceptionHandler(DataFormatException.class)
    public ResponseEntity<String> handleFhirParseError(DataFormatException e) {
        log.warn("FHIR Parsing Error: {}", e.getMessage());
        return fhirResponse(HttpStatus.BAD_REQUEST,
                OperationOutcomeBuilder.fromMessage("Invalid FHIR resource: " + e.getMessage(), IssueSeverity.ERROR));
    }

    private ResponseEntity<String> fhirResponse(HttpStatus status, IBaseResource resource) {
        return ResponseEntity.status(status)
                .contentType(MediaType.parseMediaType(FHIR_JSON))
                .body(parser().encodeResourceToString(resource));
    }

    private IParser parser() {
        return fhirContext.newJsonParser().setPrettyPrint(true);
    }
}
