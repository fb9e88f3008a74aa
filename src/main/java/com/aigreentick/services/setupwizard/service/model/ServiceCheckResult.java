package com.aigreentick.services.setupwizard.service.model;

import com.aigreentick.services.setupwizard.constants.ServiceStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of probing one external service.
 *
 * @param version reported server version, null when unknown
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServiceCheckResult(ServiceStatus status, String message, String version) {

    public static ServiceCheckResult ok(String message, String version) {
        return new ServiceCheckResult(ServiceStatus.OK, message, version);
    }

    public static ServiceCheckResult warning(String message) {
        return new ServiceCheckResult(ServiceStatus.WARNING, message, null);
    }

    public static ServiceCheckResult error(String message) {
        return new ServiceCheckResult(ServiceStatus.ERROR, message, null);
    }
}
