package com.aigreentick.services.setupwizard.service.model;

import com.aigreentick.services.setupwizard.constants.SetupStep;

import java.util.Map;
import java.util.Optional;

/**
 * Outcome of submitting one step. Field errors are only present for {@link Outcome#INVALID}.
 */
public record StepSubmissionResult(SetupStep step,
                                   Outcome outcome,
                                   Map<String, String> fieldErrors,
                                   SetupStep nextStep) {

    public enum Outcome {
        SAVED,
        INVALID,
        ACCESS_DENIED,
        STORAGE_FAILED
    }

    public static StepSubmissionResult saved(SetupStep step) {
        return new StepSubmissionResult(step, Outcome.SAVED, Map.of(), step.next().orElse(null));
    }

    public static StepSubmissionResult invalid(SetupStep step, Map<String, String> fieldErrors) {
        return new StepSubmissionResult(step, Outcome.INVALID, Map.copyOf(fieldErrors), null);
    }

    public static StepSubmissionResult accessDenied(SetupStep step) {
        return new StepSubmissionResult(step, Outcome.ACCESS_DENIED, Map.of(), null);
    }

    public static StepSubmissionResult storageFailed(SetupStep step) {
        return new StepSubmissionResult(step, Outcome.STORAGE_FAILED, Map.of(), null);
    }

    public boolean isSaved() {
        return outcome == Outcome.SAVED;
    }

    public Optional<SetupStep> next() {
        return Optional.ofNullable(nextStep);
    }
}
