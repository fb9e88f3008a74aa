package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.constants.SetupStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps each {@link SetupStep} to its implementation.
 * Fails at startup unless every step has exactly one.
 */
@Component
@Slf4j
public class StepRegistry {

    private final Map<SetupStep, WizardStep> steps;

    public StepRegistry(List<WizardStep> implementations) {
        Map<SetupStep, WizardStep> byStep = new EnumMap<>(SetupStep.class);
        for (WizardStep implementation : implementations) {
            WizardStep previous = byStep.put(implementation.getStep(), implementation);
            if (previous != null) {
                throw new IllegalStateException("Setup step " + implementation.getStep().getId()
                        + " has two implementations: " + previous.getClass().getSimpleName()
                        + " and " + implementation.getClass().getSimpleName());
            }
        }

        List<String> missing = Arrays.stream(SetupStep.values())
                .filter(step -> !byStep.containsKey(step))
                .map(SetupStep::getId)
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Setup steps without implementation: " + missing);
        }

        this.steps = Collections.unmodifiableMap(byStep);
        log.info("Setup wizard step registry ready with {} steps", steps.size());
    }

    public WizardStep get(SetupStep step) {
        return steps.get(step);
    }

    public Optional<WizardStep> find(String stepId) {
        return SetupStep.fromId(stepId).map(steps::get);
    }
}
