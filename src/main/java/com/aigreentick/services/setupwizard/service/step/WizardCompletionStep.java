package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.constants.SetupStep;
import com.aigreentick.services.setupwizard.exception.WizardStorageException;
import com.aigreentick.services.setupwizard.service.InstallationDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.aigreentick.services.setupwizard.constants.SetupWizardConstants.SCOPE_SYSTEM;
import static com.aigreentick.services.setupwizard.constants.SetupWizardConstants.SETTING_WIZARD_COMPLETED_DATE;

/**
 * Final step: checks every other required step is done, then marks the
 * whole wizard completed.
 */
@Component
@Slf4j
public class WizardCompletionStep extends AbstractWizardStep {

    private final InstallationDetector installationDetector;

    public WizardCompletionStep(WizardStepContext context, InstallationDetector installationDetector) {
        super(context);
        this.installationDetector = installationDetector;
    }

    @Override
    public SetupStep getStep() {
        return SetupStep.COMPLETION;
    }

    @Override
    public Map<String, String> validate(Map<String, Object> payload) {
        FieldErrors errors = new FieldErrors();

        if (installationDetector.isWizardCompleted()) {
            errors.add("wizard_completed", "The setup wizard has already been completed");
            return errors.toMap();
        }

        if (installationDetector.getWizardProgress().isEmpty()) {
            errors.add("no_progress", "No wizard progress found. Please complete the previous steps first.");
        }

        List<String> incomplete = context.markers().incompleteRequiredSteps().stream()
                .filter(step -> step != SetupStep.COMPLETION)
                .map(SetupStep::getDisplayName)
                .toList();
        if (!incomplete.isEmpty()) {
            errors.add("incomplete_steps",
                    "The following required steps are incomplete: " + String.join(", ", incomplete));
        }
        return errors.toMap();
    }

    @Override
    protected Map<String, Object> beforeCommit(Map<String, Object> payload) {
        Map<String, Object> prepared = new LinkedHashMap<>(payload);
        prepared.put("completedAt", LocalDateTime.now().toString());
        return prepared;
    }

    @Override
    protected void persist(Map<String, Object> payload) {
        if (!installationDetector.markWizardCompleted()) {
            throw new WizardStorageException("Could not mark the setup wizard completed");
        }
    }

    @Override
    public boolean isCompleted() {
        return installationDetector.isWizardCompleted();
    }

    @Override
    protected Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("wizardCompleted", false);
        defaults.put("completedAt", "");
        return defaults;
    }

    /** Completion flag and date plus a live per-step summary. */
    @Override
    protected Map<String, Object> committedData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("wizardCompleted", installationDetector.isWizardCompleted());
        context.settings().getString(SCOPE_SYSTEM, SETTING_WIZARD_COMPLETED_DATE)
                .ifPresent(date -> data.put("completedAt", date));

        List<Map<String, Object>> steps = new ArrayList<>();
        for (SetupStep step : SetupStep.values()) {
            if (step == SetupStep.COMPLETION) {
                continue;
            }
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("id", step.getId());
            summary.put("name", step.getDisplayName());
            summary.put("required", step.isRequired());
            summary.put("completed", context.markers().isCompleted(step));
            steps.add(summary);
        }
        data.put("steps", steps);
        data.put("completionPercentage", context.markers().completionPercentage());
        return data;
    }

    @Override
    protected void deleteDomainData() {
        if (!installationDetector.resetWizard()) {
            throw new WizardStorageException("Could not reset the setup wizard completion flags");
        }
    }
}
