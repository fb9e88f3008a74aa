package com.aigreentick.services.setupwizard.controller;

import com.aigreentick.services.setupwizard.constants.SetupStep;
import com.aigreentick.services.setupwizard.constants.SetupWizardConstants;
import com.aigreentick.services.setupwizard.dto.response.ApiResponse;
import com.aigreentick.services.setupwizard.dto.response.StepConsistencyResponse;
import com.aigreentick.services.setupwizard.dto.response.StepResponse;
import com.aigreentick.services.setupwizard.dto.response.StepSubmissionResponse;
import com.aigreentick.services.setupwizard.dto.response.WizardStatusResponse;
import com.aigreentick.services.setupwizard.exception.IncompleteWizardException;
import com.aigreentick.services.setupwizard.exception.StepAccessDeniedException;
import com.aigreentick.services.setupwizard.exception.StepNotFoundException;
import com.aigreentick.services.setupwizard.exception.StepValidationException;
import com.aigreentick.services.setupwizard.exception.WizardStorageException;
import com.aigreentick.services.setupwizard.mapper.WizardMapper;
import com.aigreentick.services.setupwizard.service.InstallationDetector;
import com.aigreentick.services.setupwizard.service.SetupWizardManager;
import com.aigreentick.services.setupwizard.service.model.InstallationStatus;
import com.aigreentick.services.setupwizard.service.model.StepState;
import com.aigreentick.services.setupwizard.service.model.StepSubmissionResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST Controller over the setup wizard engine.
 * Turns false/empty engine results into the matching error responses.
 */
@RestController
@RequestMapping(SetupWizardConstants.API_V1 + "/setup-wizard")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Setup Wizard", description = "First-run installation wizard")
public class SetupWizardController {

    private final SetupWizardManager wizardManager;
    private final InstallationDetector installationDetector;

    // ════════════════════════════════════════════════════════════
    // STATUS
    // ════════════════════════════════════════════════════════════

    @GetMapping("/status")
    @Operation(summary = "Installation status", description = "Lifecycle flags, completion percentage and resume point")
    public ResponseEntity<ApiResponse<WizardStatusResponse>> getStatus() {
        log.debug("GET /setup-wizard/status");
        InstallationStatus status = installationDetector.getInstallationStatus();
        String currentStepId = wizardManager.getCurrentStep()
                .map(state -> state.step().getId())
                .orElse(null);

        WizardStatusResponse response = WizardMapper.toStatusResponse(
                status,
                installationDetector.shouldShowWizard(),
                wizardManager.getCompletionPercentage(),
                wizardManager.getCompletedSteps(),
                currentStepId);
        return ResponseEntity.ok(ApiResponse.success(response, "Setup wizard status fetched"));
    }

    // ════════════════════════════════════════════════════════════
    // STEPS
    // ════════════════════════════════════════════════════════════

    @GetMapping("/steps")
    @Operation(summary = "All steps with completion and access state")
    public ResponseEntity<ApiResponse<List<StepResponse>>> getSteps() {
        log.debug("GET /setup-wizard/steps");
        List<StepResponse> response = wizardManager.getStepStates().stream()
                .map(WizardMapper::toStepResponse)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(response, "Setup wizard steps fetched"));
    }

    @GetMapping("/steps/current")
    @Operation(summary = "Step to resume at", description = "Data is null once the wizard is completed")
    public ResponseEntity<ApiResponse<StepResponse>> getCurrentStep() {
        log.debug("GET /setup-wizard/steps/current");
        StepResponse response = wizardManager.getCurrentStep()
                .map(WizardMapper::toStepResponse)
                .orElse(null);
        String message = response == null ? "Setup wizard already completed" : "Current step fetched";
        return ResponseEntity.ok(ApiResponse.success(response, message));
    }

    @GetMapping("/steps/{stepId}")
    @Operation(summary = "Step state and last saved payload")
    public ResponseEntity<ApiResponse<StepResponse>> getStep(
            @Parameter(description = "Step identifier", example = "groups_rooms") @PathVariable String stepId
    ) {
        log.debug("GET /setup-wizard/steps/{}", stepId);
        StepState state = wizardManager.getStepState(stepId)
                .orElseThrow(() -> StepNotFoundException.withId(stepId));
        return ResponseEntity.ok(ApiResponse.success(WizardMapper.toStepResponse(state), "Step fetched"));
    }

    @GetMapping("/steps/{stepId}/form")
    @Operation(summary = "Pre-filled form data", description = "Defaults, overlaid by committed data, overlaid by the last saved payload")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getStepForm(@PathVariable String stepId) {
        log.debug("GET /setup-wizard/steps/{}/form", stepId);
        SetupStep step = requireAccessibleStep(stepId);
        return ResponseEntity.ok(ApiResponse.success(wizardManager.prepareStep(step.getId()), "Form data fetched"));
    }

    @PutMapping("/steps/{stepId}/draft")
    @Operation(summary = "Save in-progress payload", description = "Stored in the progress record only; the step is not completed")
    public ResponseEntity<ApiResponse<Void>> saveDraft(
            @PathVariable String stepId,
            @RequestBody Map<String, Object> payload
    ) {
        log.info("PUT /setup-wizard/steps/{}/draft", stepId);
        SetupStep step = requireAccessibleStep(stepId);
        if (!wizardManager.saveStepData(step.getId(), payload)) {
            throw WizardStorageException.saveFailed(step.getId());
        }
        return ResponseEntity.ok(ApiResponse.success(SetupWizardConstants.SUCCESS_DRAFT_SAVED));
    }

    @PostMapping("/steps/{stepId}")
    @Operation(summary = "Submit a step", description = "Validates and saves; 400 with field errors when invalid")
    public ResponseEntity<ApiResponse<StepSubmissionResponse>> submitStep(
            @PathVariable String stepId,
            @RequestBody Map<String, Object> payload
    ) {
        log.info("POST /setup-wizard/steps/{}", stepId);
        SetupStep step = wizardManager.getStep(stepId)
                .orElseThrow(() -> StepNotFoundException.withId(stepId));

        StepSubmissionResult result = wizardManager.submitStep(step, payload);
        switch (result.outcome()) {
            case ACCESS_DENIED -> throw StepAccessDeniedException.forStep(step);
            case INVALID -> throw new StepValidationException(step.getId(), result.fieldErrors());
            case STORAGE_FAILED -> throw WizardStorageException.saveFailed(step.getId());
            default -> {
                // saved
            }
        }

        StepSubmissionResponse response = WizardMapper.toSubmissionResponse(
                result, wizardManager.getCompletionPercentage());
        return ResponseEntity.ok(ApiResponse.success(response, SetupWizardConstants.SUCCESS_STEP_SAVED));
    }

    // ════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ════════════════════════════════════════════════════════════

    @PostMapping("/complete")
    @Operation(summary = "Complete the wizard", description = "409 listing the incomplete required steps")
    public ResponseEntity<ApiResponse<Void>> completeWizard() {
        log.info("POST /setup-wizard/complete");
        List<String> incomplete = wizardManager.getIncompleteRequiredSteps().stream()
                .map(SetupStep::getDisplayName)
                .toList();
        if (!incomplete.isEmpty()) {
            throw new IncompleteWizardException(incomplete);
        }
        if (!wizardManager.completeWizard()) {
            throw new WizardStorageException(SetupWizardConstants.ERROR_STORAGE_FAILED);
        }
        return ResponseEntity.ok(ApiResponse.success(SetupWizardConstants.SUCCESS_WIZARD_COMPLETED));
    }

    @PostMapping("/reset")
    @Operation(summary = "Reset the wizard", description = "full=true also clears every step's data and the progress record")
    public ResponseEntity<ApiResponse<Void>> resetWizard(
            @RequestParam(name = "full", defaultValue = "false") boolean full
    ) {
        log.info("POST /setup-wizard/reset (full={})", full);
        boolean reset = full ? wizardManager.resetAll() : wizardManager.resetWizard();
        if (!reset) {
            throw new WizardStorageException(SetupWizardConstants.ERROR_STORAGE_FAILED);
        }
        return ResponseEntity.ok(ApiResponse.success(SetupWizardConstants.SUCCESS_WIZARD_RESET));
    }

    @GetMapping("/consistency")
    @Operation(summary = "Steps whose completion marker disagrees with their data")
    public ResponseEntity<ApiResponse<List<StepConsistencyResponse>>> checkConsistency() {
        log.debug("GET /setup-wizard/consistency");
        List<StepConsistencyResponse> response = wizardManager.findInconsistentSteps().stream()
                .map(WizardMapper::toConsistencyResponse)
                .toList();
        String message = response.isEmpty() ? "All steps consistent" : response.size() + " inconsistent step(s)";
        return ResponseEntity.ok(ApiResponse.success(response, message));
    }

    // ── Helpers ────────────────────────────────────────────────────────

    private SetupStep requireAccessibleStep(String stepId) {
        SetupStep step = wizardManager.getStep(stepId)
                .orElseThrow(() -> StepNotFoundException.withId(stepId));
        if (!wizardManager.canAccessStep(stepId)) {
            throw StepAccessDeniedException.forStep(step);
        }
        return step;
    }
}
