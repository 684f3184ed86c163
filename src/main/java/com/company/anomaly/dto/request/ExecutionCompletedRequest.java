package com.company.anomaly.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionCompletedRequest {
    @NotBlank
    private String executionId;

    @NotBlank
    private String templateId;

    @NotNull
    @PositiveOrZero
    private Long durationMs;

    /** SUCCESS, FAILED, TIMEOUT or CANCELLED */
    @NotBlank
    private String outcome;

    @NotNull
    private Instant completedAt;
}
