package com.aigreentick.services.setupwizard.constants;

/**
 * Application-wide constants for the setup wizard service
 */
public final class SetupWizardConstants {

    private SetupWizardConstants() {
        throw new IllegalStateException("Constants class cannot be instantiated");
    }

    // API Versioning
    public static final String API_V1 = "/api/v1";

    // Setting scopes
    public static final String SCOPE_SYSTEM = "System";
    public static final String SCOPE_SETUP_WIZARD = "SetupWizard";
    public static final String SCOPE_DAYCARE = "Daycare";
    public static final String SCOPE_FINANCE = "Finance";

    // Lifecycle flags (scope System)
    public static final String SETTING_FRESH_INSTALLATION = "freshInstallation";
    public static final String SETTING_WIZARD_COMPLETED = "setupWizardCompleted";
    public static final String SETTING_WIZARD_ENABLED = "setupWizardEnabled";
    public static final String SETTING_WIZARD_COMPLETED_DATE = "setupWizardCompletedDate";

    // Step-owned settings
    public static final String SETTING_TIMEZONE = "timezone";
    public static final String SETTING_OPERATING_HOURS_SCHEDULE = "operatingHoursSchedule";
    public static final String SETTING_CONNECTIVITY_CHECK = "serviceConnectivityCheck";
    public static final String SETTING_CONNECTIVITY_CHECK_TIME = "serviceConnectivityCheckTime";
    public static final String SETTING_SAMPLE_DATA_IMPORTED = "sampleDataImported";
    public static final String SETTING_SAMPLE_DATA_CATEGORIES = "sampleDataCategories";

    // Boolean setting values
    public static final String YES = "Y";
    public static final String NO = "N";

    // Progress record
    public static final long PROGRESS_RECORD_ID = 1L;

    // Messages
    public static final String ERROR_STORAGE_FAILED = "Could not save your changes. Please try again.";
    public static final String SUCCESS_STEP_SAVED = "Step saved successfully";
    public static final String SUCCESS_DRAFT_SAVED = "Progress saved";
    public static final String SUCCESS_WIZARD_COMPLETED = "Setup wizard completed";
    public static final String SUCCESS_WIZARD_RESET = "Setup wizard reset";
}
