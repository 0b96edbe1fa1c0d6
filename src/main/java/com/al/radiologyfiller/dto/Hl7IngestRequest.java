package com.al.radiologyfiller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Hl7IngestRequest {

    /**
     * Not validated here: an empty message is rejected by the parser and still recorded in the message log.
     */
    @Schema(description = "Pipe-delimited HL7 v2 message")
    private String message;

    /**
     * Overrides MSH-9 when present, e.g. "ORM^O01".
     */
    @JsonProperty("message_type")
    @Schema(description = "Message type hint, overrides MSH-9", example = "ORM^O01")
    private String messageType;
}
