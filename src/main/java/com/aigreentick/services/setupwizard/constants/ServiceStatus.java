package com.aigreentick.services.setupwizard.constants;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a single connectivity probe.
 * Serialized lower-case ("ok", "warning", "error").
 */
public enum ServiceStatus {
    OK("ok"),
    WARNING("warning"),
    ERROR("error");

    private final String value;

    ServiceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ServiceStatus fromValue(String value) {
        for (ServiceStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown service status: " + value);
    }
}
