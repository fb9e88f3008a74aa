package com.aigreentick.services.setupwizard.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.util.Map;

/**
 * Response DTO for one wizard step and its state
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Setup wizard step with completion and access state")
public class StepResponse {

    @Schema(description = "Step identifier", example = "organization_info")
    private String id;

    @Schema(description = "Display name", example = "Organization Information")
    private String name;

    @Schema(description = "Zero-based position in the sequence", example = "0")
    private Integer order;

    @Schema(description = "Whether the wizard cannot complete without this step", example = "true")
    private Boolean required;

    @Schema(description = "Whether the step's completion marker is set", example = "false")
    private Boolean completed;

    @Schema(description = "Whether every earlier required step is completed", example = "true")
    private Boolean canAccess;

    @Schema(description = "Previous step identifier")
    private String previousStepId;

    @Schema(description = "Next step identifier", example = "admin_account")
    private String nextStepId;

    @Schema(description = "Last saved payload of this step")
    private Map<String, Object> data;
}
