package com.aigreentick.services.setupwizard.service.model;

import com.aigreentick.services.setupwizard.constants.SetupStep;

import java.util.Map;

public record StepState(SetupStep step,
                        boolean completed,
                        boolean canAccess,
                        Map<String, Object> data) {
}
