package com.aigreentick.services.setupwizard.service;

import com.aigreentick.services.setupwizard.constants.SetupStep;
import com.aigreentick.services.setupwizard.constants.SetupWizardConstants;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Per-step completion markers: {@code SetupWizard/{stepId}_completed = Y|N}.
 * These are the gating and resume signal; the progress record is only a payload cache.
 */
@Component
@RequiredArgsConstructor
public class StepCompletionMarkers {

    private final SettingsPort settings;

    public boolean isCompleted(SetupStep step) {
        return settings.getBool(SetupWizardConstants.SCOPE_SETUP_WIZARD, step.getCompletionMarkerName(), false);
    }

    public void markCompleted(SetupStep step) {
        settings.setBool(SetupWizardConstants.SCOPE_SETUP_WIZARD, step.getCompletionMarkerName(), true);
    }

    public void clear(SetupStep step) {
        settings.delete(SetupWizardConstants.SCOPE_SETUP_WIZARD, step.getCompletionMarkerName());
    }

    /** Required steps whose marker is not Y, in sequence order. */
    public List<SetupStep> incompleteRequiredSteps() {
        return SetupStep.requiredSteps().stream()
                .filter(step -> !isCompleted(step))
                .toList();
    }

    /**
     * round(100 * completed required / all required). Optional steps count in neither.
     */
    public int completionPercentage() {
        List<SetupStep> required = SetupStep.requiredSteps();
        long completed = required.stream().filter(this::isCompleted).count();
        return (int) Math.round(100.0 * completed / required.size());
    }

    /** Steps whose marker is Y, in sequence order. */
    public List<SetupStep> completedSteps() {
        return Arrays.stream(SetupStep.values())
                .filter(this::isCompleted)
                .toList();
    }
}
