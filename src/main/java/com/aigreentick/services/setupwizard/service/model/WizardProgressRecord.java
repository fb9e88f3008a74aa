package com.aigreentick.services.setupwizard.service.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decoded view of the singleton progress row.
 *
 * @param stepCompleted id of the most recently saved step, display only
 * @param stepData      last saved payload per step id
 */
public record WizardProgressRecord(Long id,
                                   String stepCompleted,
                                   Map<String, Object> stepData,
                                   boolean wizardCompleted,
                                   LocalDateTime updatedAt) {

    public WizardProgressRecord {
        stepData = stepData == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(stepData));
    }

    public boolean hasStepData(String stepId) {
        return stepData.containsKey(stepId);
    }
}
