package com.aigreentick.services.setupwizard.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when the wizard is asked to complete while required steps are outstanding.
 * The step names are human-readable and in sequence order.
 */
@Getter
public class IncompleteWizardException extends SetupWizardException {

    private final List<String> incompleteSteps;

    public IncompleteWizardException(List<String> incompleteSteps) {
        super("The following required steps are incomplete: " + String.join(", ", incompleteSteps),
                "WIZARD_INCOMPLETE");
        this.incompleteSteps = List.copyOf(incompleteSteps);
    }
}
