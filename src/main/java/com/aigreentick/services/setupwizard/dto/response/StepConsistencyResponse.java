package com.aigreentick.services.setupwizard.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Step whose completion marker disagrees with its stored data")
public class StepConsistencyResponse {

    @Schema(description = "Step identifier", example = "admin_account")
    private String stepId;

    @Schema(description = "Completion marker value", example = "true")
    private Boolean markerCompleted;

    @Schema(description = "Completion judged from the step's own data", example = "false")
    private Boolean dataCompleted;
}
