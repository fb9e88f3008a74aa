package com.aigreentick.services.setupwizard.exception;

import lombok.Getter;

import java.util.Map;

/**
 * Carries the field-level validation errors of a rejected step submission.
 * Keys are dotted field paths such as "groups.0.name".
 */
@Getter
public class StepValidationException extends SetupWizardException {

    private final Map<String, String> fieldErrors;

    public StepValidationException(String stepId, Map<String, String> fieldErrors) {
        super("Validation failed for step " + stepId, "VALIDATION_ERROR");
        this.fieldErrors = Map.copyOf(fieldErrors);
    }
}
