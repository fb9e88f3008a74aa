package com.aigreentick.services.setupwizard.exception;

import lombok.Getter;

/**
 * Base exception for all setup wizard exceptions
 */
@Getter
public class SetupWizardException extends RuntimeException {

    private final String errorCode;

    public SetupWizardException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public SetupWizardException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
