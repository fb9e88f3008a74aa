package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.constants.SetupStep;

import java.util.Map;

/**
 * Contract every wizard page implements.
 *
 * Payloads are JSON objects decoded into maps. Validation errors are keyed
 * by dotted field path ("groups.0.name"); an empty map means valid.
 */
public interface WizardStep {

    SetupStep getStep();

    /**
     * Check a payload. Read-only: may look things up, never writes.
     */
    Map<String, String> validate(Map<String, Object> payload);

    /**
     * Validate, then persist domain data, completion marker and progress entry
     * in one transaction.
     *
     * @return false with no side effects when invalid or when storage fails
     */
    boolean save(Map<String, Object> payload);

    /**
     * Completion judged from the step's own data where possible,
     * falling back to its completion marker.
     */
    boolean isCompleted();

    /**
     * Form data: defaults, overlaid by committed data, overlaid by the
     * payload last saved to the progress record.
     */
    Map<String, Object> prepareData();

    /**
     * Copy of the payload safe to keep in the progress record and to hand
     * back to clients. Secrets such as passwords and API keys are removed.
     */
    Map<String, Object> sanitize(Map<String, Object> payload);

    /**
     * Remove exactly what this step created, including its completion marker.
     */
    boolean clear();
}
