package com.aigreentick.services.setupwizard.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Response DTO for the installation and wizard status
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Installation lifecycle and wizard progress snapshot")
public class WizardStatusResponse {

    @Schema(description = "Whether this is a fresh installation", example = "true")
    private Boolean freshInstallation;

    @Schema(description = "Whether the wizard has been completed", example = "false")
    private Boolean wizardCompleted;

    @Schema(description = "Whether the wizard is enabled", example = "true")
    private Boolean wizardEnabled;

    @Schema(description = "Whether the wizard should be shown", example = "true")
    private Boolean shouldShowWizard;

    @Schema(description = "Whether organization data exists", example = "false")
    private Boolean hasOrganizationData;

    @Schema(description = "Whether an administrator exists", example = "false")
    private Boolean hasAdminUsers;

    @Schema(description = "Percentage of required steps completed", example = "43")
    private Integer completionPercentage;

    @Schema(description = "Completed step identifiers, in sequence order")
    private List<String> completedSteps;

    @Schema(description = "Step the user should resume at", example = "groups_rooms")
    private String currentStepId;

    @Schema(description = "Most recently saved step", example = "operating_hours")
    private String lastSavedStepId;

    @Schema(description = "Last time progress was saved")
    private LocalDateTime lastSavedAt;
}
