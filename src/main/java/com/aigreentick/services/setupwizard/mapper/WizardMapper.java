package com.aigreentick.services.setupwizard.mapper;

import com.aigreentick.services.setupwizard.constants.SetupStep;
import com.aigreentick.services.setupwizard.dto.response.StepConsistencyResponse;
import com.aigreentick.services.setupwizard.dto.response.StepResponse;
import com.aigreentick.services.setupwizard.dto.response.StepSubmissionResponse;
import com.aigreentick.services.setupwizard.dto.response.WizardStatusResponse;
import com.aigreentick.services.setupwizard.service.model.InstallationStatus;
import com.aigreentick.services.setupwizard.service.model.StepInconsistency;
import com.aigreentick.services.setupwizard.service.model.StepState;
import com.aigreentick.services.setupwizard.service.model.StepSubmissionResult;
import com.aigreentick.services.setupwizard.service.model.WizardProgressRecord;
import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Mapper utility for converting wizard engine models to response DTOs
 */
@UtilityClass
public class WizardMapper {

    /**
     * Map a step state; data is left out when empty
     */
    public StepResponse toStepResponse(StepState state) {
        if (state == null) return null;

        SetupStep step = state.step();
        return StepResponse.builder()
                .id(step.getId())
                .name(step.getDisplayName())
                .order(step.getOrder())
                .required(step.isRequired())
                .completed(state.completed())
                .canAccess(state.canAccess())
                .previousStepId(step.previous().map(SetupStep::getId).orElse(null))
                .nextStepId(step.next().map(SetupStep::getId).orElse(null))
                .data(state.data() == null || state.data().isEmpty() ? null : state.data())
                .build();
    }

    public WizardStatusResponse toStatusResponse(InstallationStatus status,
                                                 boolean shouldShowWizard,
                                                 int completionPercentage,
                                                 List<String> completedSteps,
                                                 String currentStepId) {
        WizardProgressRecord progress = status.progress();
        return WizardStatusResponse.builder()
                .freshInstallation(status.fresh())
                .wizardCompleted(status.wizardCompleted())
                .wizardEnabled(status.wizardEnabled())
                .shouldShowWizard(shouldShowWizard)
                .hasOrganizationData(status.hasOrganizationData())
                .hasAdminUsers(status.hasAdminUsers())
                .completionPercentage(completionPercentage)
                .completedSteps(completedSteps)
                .currentStepId(currentStepId)
                .lastSavedStepId(progress != null ? progress.stepCompleted() : null)
                .lastSavedAt(progress != null ? progress.updatedAt() : null)
                .build();
    }

    public StepSubmissionResponse toSubmissionResponse(StepSubmissionResult result, int completionPercentage) {
        return StepSubmissionResponse.builder()
                .stepId(result.step().getId())
                .nextStepId(result.next().map(SetupStep::getId).orElse(null))
                .completionPercentage(completionPercentage)
                .build();
    }

    public StepConsistencyResponse toConsistencyResponse(StepInconsistency inconsistency) {
        return StepConsistencyResponse.builder()
                .stepId(inconsistency.step().getId())
                .markerCompleted(inconsistency.markerCompleted())
                .dataCompleted(inconsistency.dataCompleted())
                .build();
    }
}
