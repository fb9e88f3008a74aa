package com.aigreentick.services.setupwizard.service;

import com.aigreentick.services.setupwizard.config.SetupWizardProperties;
import com.aigreentick.services.setupwizard.service.model.InstallationStatus;
import com.aigreentick.services.setupwizard.service.model.WizardProgressRecord;
import com.aigreentick.services.setupwizard.service.step.AdminAccountStep;
import com.aigreentick.services.setupwizard.service.step.OrganizationInfoStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.function.BooleanSupplier;

import static com.aigreentick.services.setupwizard.constants.SetupWizardConstants.*;

/**
 * Single source of truth for where this installation is in its lifecycle.
 *
 * Every answer is read from storage on each call. Organization and
 * administrator presence are asked of the owning steps; this class never
 * reads their tables itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InstallationDetector {

    private final SettingsPort settings;
    private final WizardProgressStore progressStore;
    private final OrganizationInfoStep organizationInfoStep;
    private final AdminAccountStep adminAccountStep;
    private final SetupWizardProperties properties;
    private final TransactionTemplate transactionTemplate;

    // ════════════════════════════════════════════════════════════
    // LIFECYCLE QUERIES
    // ════════════════════════════════════════════════════════════

    /**
     * Fresh when forced by the freshInstallation flag, or when the wizard is not
     * completed and neither organization data nor an administrator exists.
     * A storage error (typically tables not created yet) counts as fresh.
     */
    public boolean isFreshInstallation() {
        try {
            if (settings.getBool(SCOPE_SYSTEM, SETTING_FRESH_INSTALLATION, false)) {
                return true;
            }
            if (isWizardCompleted()) {
                return false;
            }
            return !organizationInfoStep.isCompleted() && !adminAccountStep.isCompleted();
        } catch (DataAccessException ex) {
            log.warn("Installation state unreadable, assuming fresh installation: {}", ex.getMessage());
            return true;
        }
    }

    public boolean isWizardCompleted() {
        try {
            return settings.getBool(SCOPE_SYSTEM, SETTING_WIZARD_COMPLETED, false);
        } catch (DataAccessException ex) {
            log.warn("Wizard completion flag unreadable, assuming not completed: {}", ex.getMessage());
            return false;
        }
    }

    public boolean isWizardEnabled() {
        try {
            return settings.getBool(SCOPE_SYSTEM, SETTING_WIZARD_ENABLED, properties.isEnabledByDefault());
        } catch (DataAccessException ex) {
            log.warn("Wizard enabled flag unreadable, using default {}: {}",
                    properties.isEnabledByDefault(), ex.getMessage());
            return properties.isEnabledByDefault();
        }
    }

    public boolean shouldShowWizard() {
        return isFreshInstallation() && isWizardEnabled() && !isWizardCompleted();
    }

    // ════════════════════════════════════════════════════════════
    // LIFECYCLE TRANSITIONS
    // ════════════════════════════════════════════════════════════

    /**
     * Set the completed flag, its date and the progress record's flag as one unit.
     * Joins an open transaction; on failure that transaction is marked rollback-only.
     *
     * @return false, with nothing written, on any storage failure
     */
    public boolean markWizardCompleted() {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                settings.setBool(SCOPE_SYSTEM, SETTING_WIZARD_COMPLETED, true);
                settings.set(SCOPE_SYSTEM, SETTING_WIZARD_COMPLETED_DATE, LocalDateTime.now().toString());
                settings.delete(SCOPE_SYSTEM, SETTING_FRESH_INSTALLATION);
                progressStore.setWizardCompleted(true);
            });
            log.info("Setup wizard marked completed");
            return true;
        } catch (RuntimeException ex) {
            log.error("Failed to mark setup wizard completed", ex);
            return false;
        }
    }

    /**
     * Clear the completed and fresh flags. Step data and markers are left alone;
     * removing those is each step's clear().
     */
    public boolean resetWizard() {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                settings.delete(SCOPE_SYSTEM, SETTING_WIZARD_COMPLETED);
                settings.delete(SCOPE_SYSTEM, SETTING_WIZARD_COMPLETED_DATE);
                settings.delete(SCOPE_SYSTEM, SETTING_FRESH_INSTALLATION);
                progressStore.clearWizardCompleted();
            });
            log.info("Setup wizard flags reset");
            return true;
        } catch (RuntimeException ex) {
            log.error("Failed to reset setup wizard", ex);
            return false;
        }
    }

    // ════════════════════════════════════════════════════════════
    // PROGRESS RECORD
    // ════════════════════════════════════════════════════════════

    /**
     * @return empty when no record exists, it cannot be decoded, or storage fails
     */
    public Optional<WizardProgressRecord> getWizardProgress() {
        try {
            return progressStore.find();
        } catch (DataAccessException ex) {
            log.warn("Wizard progress unreadable: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Merge one step's payload into the progress record, creating it if needed.
     *
     * @return false, with nothing written, on any storage failure
     */
    public boolean saveWizardProgress(String stepId, Object payload) {
        try {
            transactionTemplate.executeWithoutResult(status -> progressStore.merge(stepId, payload));
            return true;
        } catch (RuntimeException ex) {
            log.error("Failed to save wizard progress for step {}", stepId, ex);
            return false;
        }
    }

    /** Remove the progress record. Used by the full reset only. */
    public boolean deleteWizardProgress() {
        try {
            transactionTemplate.executeWithoutResult(status -> progressStore.deleteProgress());
            return true;
        } catch (RuntimeException ex) {
            log.error("Failed to delete wizard progress", ex);
            return false;
        }
    }

    public InstallationStatus getInstallationStatus() {
        boolean hasOrganizationData = safeCheck(organizationInfoStep::isCompleted);
        boolean hasAdminUsers = safeCheck(adminAccountStep::isCompleted);
        return new InstallationStatus(
                isFreshInstallation(),
                isWizardCompleted(),
                isWizardEnabled(),
                hasOrganizationData,
                hasAdminUsers,
                getWizardProgress().orElse(null));
    }

    private boolean safeCheck(BooleanSupplier check) {
        try {
            return check.getAsBoolean();
        } catch (DataAccessException ex) {
            log.warn("Installation status check failed: {}", ex.getMessage());
            return false;
        }
    }
}
