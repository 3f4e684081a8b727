package com.whereq.pacer.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a training plan generation.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to generate a training plan")
public class PlanSubmitRequest {

    @NotBlank(message = "Athlete name is required")
    @Size(max = 200, message = "Athlete name must be at most 200 characters")
    @Schema(description = "Name of the athlete", example = "Jane Doe")
    private String athleteName;

    @Size(max = 2000, message = "Goals must be at most 2000 characters")
    @Schema(description = "Training goals of the athlete", example = "Improve 10k running time and build endurance")
    private String goals;
}
