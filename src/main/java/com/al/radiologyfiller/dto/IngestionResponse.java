package com.al.radiologyfiller.dto;

import com.al.radiologyfiller.exception.ErrorKind;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Structured answer to an inbound HL7 message. {@code status} is "success" or "error"; on error,
 * {@code error} carries the error kind code.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IngestionResponse {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    private String status;
    private String message;
    private String patient;
    private String requestId;
    private String externalRequestId;
    private String accessionNumber;
    private Boolean accessionGenerated;
    private String error;
    private Boolean retryable;
    private String messageControlId;
    private List<OrderOutcome> orders;

    /** HL7 ACK for the message, handed to the transport rather than serialized. */
    @JsonIgnore
    private String ack;

    @JsonIgnore
    private ErrorKind errorKind;

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
