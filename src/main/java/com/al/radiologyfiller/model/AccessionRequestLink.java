package com.al.radiologyfiller.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessionRequestLink {
    private String requestId;
    private String externalRequestId;
    private String serviceName;
    private LocalDateTime linkedAt;
}
