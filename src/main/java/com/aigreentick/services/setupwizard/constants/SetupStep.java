package com.aigreentick.services.setupwizard.constants;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Fixed, ordered registry of setup wizard steps.
 * Order matters: the declaration order is the sequence the user walks through,
 * and access to a step is gated on every required step declared before it.
 */
public enum SetupStep {
    ORGANIZATION_INFO("organization_info", "Organization Information", true),
    ADMIN_ACCOUNT("admin_account", "Administrator Account", true),
    OPERATING_HOURS("operating_hours", "Operating Hours", true),
    GROUPS_ROOMS("groups_rooms", "Groups and Rooms", true),
    FINANCE_SETTINGS("finance_settings", "Finance Settings", true),
    SERVICE_CONNECTIVITY("service_connectivity", "Service Connectivity", true),
    SAMPLE_DATA("sample_data", "Sample Data Import", false),
    COMPLETION("completion", "Wizard Completion", true);

    private final String id;
    private final String displayName;
    private final boolean required;

    SetupStep(String id, String displayName, boolean required) {
        this.id = id;
        this.displayName = displayName;
        this.required = required;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isRequired() {
        return required;
    }

    /** Zero-based position in the sequence. */
    public int getOrder() {
        return ordinal();
    }

    /** Name of the SetupWizard-scoped completion marker setting. */
    public String getCompletionMarkerName() {
        return id + "_completed";
    }

    public boolean isFirst() {
        return ordinal() == 0;
    }

    public Optional<SetupStep> next() {
        SetupStep[] all = values();
        return ordinal() + 1 < all.length ? Optional.of(all[ordinal() + 1]) : Optional.empty();
    }

    public Optional<SetupStep> previous() {
        return ordinal() > 0 ? Optional.of(values()[ordinal() - 1]) : Optional.empty();
    }

    /** Steps declared before this one, in sequence order. */
    public List<SetupStep> predecessors() {
        return Arrays.asList(values()).subList(0, ordinal());
    }

    public static Optional<SetupStep> fromId(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(step -> step.id.equals(id))
                .findFirst();
    }

    public static List<SetupStep> requiredSteps() {
        return Arrays.stream(values())
                .filter(SetupStep::isRequired)
                .toList();
    }
}
