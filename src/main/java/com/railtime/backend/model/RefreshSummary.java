package com.railtime.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RefreshSummary {
    private LocalDateTime timestamp;
    private String status;
    private Integer recordsReceived;
    private Integer upstreamStatus;
    private Long processingTimeMs;
    private String message;
}
