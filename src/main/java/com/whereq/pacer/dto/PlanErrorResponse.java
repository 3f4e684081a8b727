package com.whereq.pacer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body of a failed download, echoing the plan status
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanErrorResponse {

    public static final String NOT_FOUND = "not_found";
    public static final String NOT_READY = "not_ready";
    public static final String ARTIFACT_MISSING = "artifact_missing";
    public static final String INVALID_REQUEST = "invalid_request";
    public static final String INTERNAL = "internal_error";

    /**
     * Machine-readable error code
     */
    private String error;

    private String message;

    private PlanStatusResponse status;
}
