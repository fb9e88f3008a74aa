package com.aigreentick.services.setupwizard.exception;

import com.aigreentick.services.setupwizard.constants.SetupStep;

/**
 * Thrown when a step is requested before every required step preceding it is completed
 */
public class StepAccessDeniedException extends SetupWizardException {

    public StepAccessDeniedException(String message) {
        super(message, "STEP_ACCESS_DENIED");
    }

    public static StepAccessDeniedException forStep(SetupStep step) {
        return new StepAccessDeniedException(
                "Step '" + step.getDisplayName() + "' cannot be accessed until the previous required steps are completed");
    }
}
