package com.aigreentick.services.setupwizard.service;

import com.aigreentick.services.setupwizard.constants.SetupStep;
import com.aigreentick.services.setupwizard.constants.SetupWizardConstants;
import com.aigreentick.services.setupwizard.service.model.StepInconsistency;
import com.aigreentick.services.setupwizard.service.model.StepState;
import com.aigreentick.services.setupwizard.service.model.StepSubmissionResult;
import com.aigreentick.services.setupwizard.service.step.PayloadReader;
import com.aigreentick.services.setupwizard.service.step.StepRegistry;
import com.aigreentick.services.setupwizard.service.step.WizardStep;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sequencing, gating and completion over the fixed step sequence.
 *
 * Holds no state: every answer is rebuilt from the completion markers and
 * the progress record, so the wizard resumes correctly after any restart
 * and on any instance.
 *
 * Flow:
 *   getCurrentStep()  → first step whose marker is not Y
 *   submitStep(id, p) → canAccessStep → validate → save
 *   completeWizard()  → only when every required marker is Y
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SetupWizardManager {

    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final InstallationDetector installationDetector;
    private final StepCompletionMarkers markers;
    private final StepRegistry stepRegistry;
    private final SettingsPort settings;

    // ════════════════════════════════════════════════════════════
    // SEQUENCE
    // ════════════════════════════════════════════════════════════

    public List<SetupStep> getSteps() {
        return List.of(SetupStep.values());
    }

    public Optional<SetupStep> getStep(String stepId) {
        return SetupStep.fromId(stepId);
    }

    public Optional<SetupStep> getNextStep(String stepId) {
        return SetupStep.fromId(stepId).flatMap(SetupStep::next);
    }

    public Optional<SetupStep> getPreviousStep(String stepId) {
        return SetupStep.fromId(stepId).flatMap(SetupStep::previous);
    }

    // ════════════════════════════════════════════════════════════
    // COMPLETION STATE
    // ════════════════════════════════════════════════════════════

    public boolean isStepCompleted(String stepId) {
        return SetupStep.fromId(stepId)
                .map(markers::isCompleted)
                .orElse(false);
    }

    public List<String> getCompletedSteps() {
        return markers.completedSteps().stream()
                .map(SetupStep::getId)
                .toList();
    }

    public List<SetupStep> getIncompleteRequiredSteps() {
        return markers.incompleteRequiredSteps();
    }

    public boolean areAllRequiredStepsCompleted() {
        return markers.incompleteRequiredSteps().isEmpty();
    }

    public int getCompletionPercentage() {
        return markers.completionPercentage();
    }

    /**
     * First step is always accessible; any other step only once every
     * required step before it is completed. Optional steps never block.
     */
    public boolean canAccessStep(String stepId) {
        Optional<SetupStep> step = SetupStep.fromId(stepId);
        if (step.isEmpty()) {
            return false;
        }
        if (step.get().isFirst()) {
            return true;
        }
        Set<SetupStep> completed = Set.copyOf(markers.completedSteps());
        return canAccess(step.get(), completed);
    }

    private boolean canAccess(SetupStep step, Set<SetupStep> completed) {
        return step.predecessors().stream()
                .filter(SetupStep::isRequired)
                .allMatch(completed::contains);
    }

    // ════════════════════════════════════════════════════════════
    // RESUME
    // ════════════════════════════════════════════════════════════

    /**
     * The first step whose marker is not Y. When every marker is Y but the
     * wizard is not yet marked completed, the completion step.
     *
     * @return empty once the wizard is completed
     */
    public Optional<StepState> getCurrentStep() {
        if (installationDetector.isWizardCompleted()) {
            return Optional.empty();
        }
        Set<SetupStep> completed = Set.copyOf(markers.completedSteps());
        for (SetupStep step : SetupStep.values()) {
            if (!completed.contains(step)) {
                return Optional.of(new StepState(step, false, canAccess(step, completed), getStepData(step.getId())));
            }
        }
        return Optional.of(new StepState(SetupStep.COMPLETION, false, true, Map.of()));
    }

    public Optional<StepState> getStepState(String stepId) {
        return SetupStep.fromId(stepId).map(step -> {
            Set<SetupStep> completed = Set.copyOf(markers.completedSteps());
            return new StepState(step, completed.contains(step), canAccess(step, completed), getStepData(stepId));
        });
    }

    public List<StepState> getStepStates() {
        Set<SetupStep> completed = Set.copyOf(markers.completedSteps());
        return Arrays.stream(SetupStep.values())
                .map(step -> new StepState(step, completed.contains(step), canAccess(step, completed), Map.of()))
                .toList();
    }

    // ════════════════════════════════════════════════════════════
    // STEP DATA
    // ════════════════════════════════════════════════════════════

    /**
     * The progress record's entry for the step, else the settings-derived
     * payload {@code SetupWizard/{stepId}}, else an empty payload.
     * Secrets are removed by the step before anything is returned.
     */
    public Map<String, Object> getStepData(String stepId) {
        Optional<SetupStep> step = SetupStep.fromId(stepId);
        if (step.isEmpty()) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> data = storedStepData(stepId);
        return data.isEmpty() ? data : stepRegistry.get(step.get()).sanitize(data);
    }

    private Map<String, Object> storedStepData(String stepId) {
        try {
            Optional<Object> inProgress = installationDetector.getWizardProgress()
                    .filter(progress -> progress.hasStepData(stepId))
                    .map(progress -> progress.stepData().get(stepId));
            if (inProgress.isPresent()) {
                return PayloadReader.object(inProgress.get());
            }
            Optional<LinkedHashMap<String, Object>> fromSettings =
                    settings.getJson(SetupWizardConstants.SCOPE_SETUP_WIZARD, stepId, PAYLOAD_TYPE);
            return fromSettings.isPresent() ? fromSettings.get() : new LinkedHashMap<>();
        } catch (DataAccessException ex) {
            log.warn("Step data for {} unreadable: {}", stepId, ex.getMessage());
            return new LinkedHashMap<>();
        }
    }

    /**
     * Merge {stepId: payload} into the progress record, keeping every other entry.
     * The step strips secrets first. Does not touch completion markers.
     */
    public boolean saveStepData(String stepId, Map<String, Object> payload) {
        Optional<SetupStep> step = SetupStep.fromId(stepId);
        if (step.isEmpty()) {
            log.warn("Refusing to save data for unknown step {}", stepId);
            return false;
        }
        Map<String, Object> sanitized = stepRegistry.get(step.get()).sanitize(payload == null ? Map.of() : payload);
        return installationDetector.saveWizardProgress(stepId, sanitized);
    }

    public Map<String, Object> prepareStep(String stepId) {
        return stepRegistry.find(stepId)
                .map(WizardStep::prepareData)
                .orElseGet(LinkedHashMap::new);
    }

    /**
     * Gate, validate, save. Nothing is written when the step is gated or the payload is invalid.
     */
    public StepSubmissionResult submitStep(SetupStep step, Map<String, Object> payload) {
        Map<String, Object> input = payload == null ? Map.of() : payload;

        if (!canAccessStep(step.getId())) {
            log.warn("Submission for step {} refused: earlier required steps incomplete", step.getId());
            return StepSubmissionResult.accessDenied(step);
        }

        WizardStep implementation = stepRegistry.get(step);
        Map<String, String> errors = implementation.validate(input);
        if (!errors.isEmpty()) {
            log.warn("Submission for step {} has {} validation error(s)", step.getId(), errors.size());
            return StepSubmissionResult.invalid(step, errors);
        }

        if (!implementation.save(input)) {
            return StepSubmissionResult.storageFailed(step);
        }
        return StepSubmissionResult.saved(step);
    }

    // ════════════════════════════════════════════════════════════
    // WIZARD LIFECYCLE
    // ════════════════════════════════════════════════════════════

    /**
     * @return false without writing anything while a required step is incomplete
     */
    public boolean completeWizard() {
        List<SetupStep> incomplete = getIncompleteRequiredSteps();
        if (!incomplete.isEmpty()) {
            log.warn("Wizard completion refused, incomplete required steps: {}",
                    incomplete.stream().map(SetupStep::getId).collect(Collectors.joining(", ")));
            return false;
        }
        return installationDetector.markWizardCompleted();
    }

    /** Clears the lifecycle flags only. See {@link #resetAll()} for a full reset. */
    public boolean resetWizard() {
        return installationDetector.resetWizard();
    }

    /**
     * Full reset: every step's clear() from last to first, the progress record,
     * then the lifecycle flags. Keeps going after a failure.
     */
    public boolean resetAll() {
        boolean success = true;
        List<SetupStep> reversed = new ArrayList<>(getSteps());
        Collections.reverse(reversed);

        for (SetupStep step : reversed) {
            if (!stepRegistry.get(step).clear()) {
                log.error("Full reset: step {} could not be cleared", step.getId());
                success = false;
            }
        }

        if (!installationDetector.deleteWizardProgress()) {
            log.error("Full reset: progress record could not be deleted");
            success = false;
        }

        success &= installationDetector.resetWizard();
        log.info("Setup wizard full reset finished (success={})", success);
        return success;
    }

    // ════════════════════════════════════════════════════════════
    // CONSISTENCY
    // ════════════════════════════════════════════════════════════

    /**
     * Steps whose completion marker disagrees with their own data.
     * Each disagreement is logged.
     */
    public List<StepInconsistency> findInconsistentSteps() {
        List<StepInconsistency> inconsistencies = new ArrayList<>();
        for (SetupStep step : SetupStep.values()) {
            boolean marker = markers.isCompleted(step);
            boolean data = stepRegistry.get(step).isCompleted();
            if (marker != data) {
                log.warn("Step {} is inconsistent: marker={} data={}", step.getId(), marker, data);
                inconsistencies.add(new StepInconsistency(step, marker, data));
            }
        }
        return inconsistencies;
    }
}
