package com.al.radiologyfiller.controller;

import com.al.radiologyfiller.dto.Hl7IngestRequest;
import com.al.radiologyfiller.dto.IngestionResponse;
import com.al.radiologyfiller.model.enums.IngestionChannel;
import com.al.radiologyfiller.service.Hl7IngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

@RestController
@RequestMapping("/api/radiology")
@Slf4j
@Tag(name = "HL7 Intake", description = "Inbound HL7 v2 order messages")
public class Hl7ReceiverController {

    public static final String ACK_HEADER = "X-HL7-ACK";

    private final Hl7IngestionService ingestionService;

    public Hl7ReceiverController(Hl7IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @Operation(summary = "Receive HL7 order message", description = "Parses an ORM^O01 message, reconciles each order line to an accession and answers with the stored identifiers. The HL7 ACK is returned base64-encoded in the X-HL7-ACK header.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Message processed"),
            @ApiResponse(responseCode = "400", description = "Message could not be parsed"),
            @ApiResponse(responseCode = "409", description = "Accession belongs to another patient"),
            @ApiResponse(responseCode = "422", description = "Required identifier, patient or accession missing"),
            @ApiResponse(responseCode = "503", description = "Concurrent update, retry the message")
    })
    @PostMapping(value = "/hl7", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<IngestionResponse> receive(@RequestBody Hl7IngestRequest request) {
        return respond(ingestionService.ingest(request.getMessage(), request.getMessageType(), IngestionChannel.HTTP));
    }

    @Operation(summary = "Receive raw HL7 order message", description = "Same as the JSON variant, with the pipe-delimited message as the request body.")
    @PostMapping(value = "/hl7", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<IngestionResponse> receiveRaw(
            @Parameter(description = "HL7 v2.x message in pipe-delimited format") @RequestBody String hl7Message,
            @Parameter(description = "Message type hint, overrides MSH-9") @RequestParam(value = "message_type", required = false) String messageType) {
        return respond(ingestionService.ingest(hl7Message, messageType, IngestionChannel.HTTP));
    }

    private ResponseEntity<IngestionResponse> respond(IngestionResponse response) {
        HttpStatus status = response.isSuccess() ? HttpStatus.OK : response.getErrorKind().getHttpStatus();
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (response.getAck() != null) {
            builder.header(ACK_HEADER,
                    Base64.getEncoder().encodeToString(response.getAck().getBytes(StandardCharsets.UTF_8)));
        }
        return builder.body(response);
    }
}
