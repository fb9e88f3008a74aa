package com.aigreentick.services.setupwizard.service.model;

import com.aigreentick.services.setupwizard.constants.SetupStep;

/**
 * A step whose completion marker disagrees with what its own data says.
 */
public record StepInconsistency(SetupStep step, boolean markerCompleted, boolean dataCompleted) {
}
