package com.aigreentick.services.setupwizard.service.model;

/**
 * Read-only snapshot of where this installation is in its lifecycle.
 * Built fresh on every call.
 *
 * @param progress the progress record, or null when none exists
 */
public record InstallationStatus(boolean fresh,
                                 boolean wizardCompleted,
                                 boolean wizardEnabled,
                                 boolean hasOrganizationData,
                                 boolean hasAdminUsers,
                                 WizardProgressRecord progress) {
}
