package com.whereq.pacer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response for a training plan submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Outcome of a training plan submission")
public class PlanSubmitResponse {

    public static final String STARTED_MESSAGE =
        "Training plan generation started. Please check the status endpoint for updates.";

    @Schema(description = "Whether a new generation was started")
    private boolean accepted;

    /**
     * Rejection reason (if not accepted)
     */
    @Schema(description = "Why the submission was rejected", example = "already in progress")
    private String reason;

    private String athleteName;

    private String message;

    @Schema(description = "Relative URL to poll", example = "/api/v1/training-plans/Jane%20Doe/status")
    private String statusUrl;

    @Schema(description = "Relative URL of the spreadsheet once completed")
    private String downloadUrl;

    /**
     * Create rejection response
     */
    public static PlanSubmitResponse rejected(String reason) {
        return PlanSubmitResponse.builder()
            .accepted(false)
            .reason(reason)
            .build();
    }
}
