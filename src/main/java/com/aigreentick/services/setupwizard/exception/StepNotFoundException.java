package com.aigreentick.services.setupwizard.exception;

/**
 * Thrown when a request names a step id that is not part of the wizard
 */
public class StepNotFoundException extends SetupWizardException {

    public StepNotFoundException(String message) {
        super(message, "STEP_NOT_FOUND");
    }

    public static StepNotFoundException withId(String stepId) {
        return new StepNotFoundException("Setup wizard step not found: " + stepId);
    }
}
