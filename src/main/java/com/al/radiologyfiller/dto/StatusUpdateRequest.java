package com.al.radiologyfiller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusUpdateRequest {

    /**
     * Target status name, e.g. "SCHEDULED" or "IN_PROGRESS".
     */
    @NotBlank(message = "status is required")
    private String status;
}
