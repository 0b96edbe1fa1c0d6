package com.al.radiologyfiller.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result for one OBR of an order message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OrderOutcome {
    private int sequence;
    private String requestId;
    private String externalRequestId;
    private String accessionNumber;
    private boolean accessionGenerated;
    private boolean replayed;
}
