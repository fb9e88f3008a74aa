package com.aigreentick.services.setupwizard.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

/**
 * Response DTO for a saved step
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Result of a successful step submission")
public class StepSubmissionResponse {

    @Schema(description = "Saved step identifier", example = "organization_info")
    private String stepId;

    @Schema(description = "Step to continue with, absent after the last step", example = "admin_account")
    private String nextStepId;

    @Schema(description = "Percentage of required steps completed", example = "14")
    private Integer completionPercentage;
}
