package com.whereq.pacer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.pacer.model.JobRecord;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for a plan status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Status of a training plan generation")
public class PlanStatusResponse {

    public static final String NOT_FOUND_MESSAGE = "no plan requested";

    @Schema(description = "processing, completed, failed or not_found", example = "completed")
    private PlanStatus status;

    @Schema(description = "Progress note, plan summary or failure reason")
    private String message;

    @Schema(description = "Whether the spreadsheet can be downloaded")
    private boolean artifactAvailable;

    /**
     * Athlete name as first submitted
     */
    private String athleteName;

    private Instant createdAt;

    private Instant updatedAt;

    public static PlanStatusResponse notFound() {
        return PlanStatusResponse.builder()
            .status(PlanStatus.NOT_FOUND)
            .message(NOT_FOUND_MESSAGE)
            .artifactAvailable(false)
            .build();
    }

    public static PlanStatusResponse from(JobRecord record) {
        return PlanStatusResponse.builder()
            .status(PlanStatus.of(record.getStatus()))
            .message(record.getMessage())
            .artifactAvailable(record.isArtifactAvailable())
            .athleteName(record.getAthleteName())
            .createdAt(record.getCreatedAt())
            .updatedAt(record.getUpdatedAt())
            .build();
    }
}
