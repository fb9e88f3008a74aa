package com.aigreentick.services.setupwizard.exception;

import com.aigreentick.services.setupwizard.constants.SetupWizardConstants;

/**
 * Storage failure inside a wizard transaction.
 * Thrown to force a rollback; engine methods convert it to a false/empty result.
 */
public class WizardStorageException extends SetupWizardException {

    public WizardStorageException(String message) {
        super(message, "STORAGE_ERROR");
    }

    public WizardStorageException(String message, Throwable cause) {
        super(message, "STORAGE_ERROR", cause);
    }

    public static WizardStorageException saveFailed(String stepId) {
        return new WizardStorageException(SetupWizardConstants.ERROR_STORAGE_FAILED + " (step " + stepId + ")");
    }
}
