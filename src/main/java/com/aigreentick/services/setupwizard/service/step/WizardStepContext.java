package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.service.SettingsPort;
import com.aigreentick.services.setupwizard.service.StepCompletionMarkers;
import com.aigreentick.services.setupwizard.service.WizardProgressStore;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Collaborators shared by every step.
 */
@Component
public record WizardStepContext(SettingsPort settings,
                                StepCompletionMarkers markers,
                                WizardProgressStore progressStore,
                                TransactionTemplate transactionTemplate) {
}
