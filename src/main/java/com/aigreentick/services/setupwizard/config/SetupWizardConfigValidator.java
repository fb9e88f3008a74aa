package com.aigreentick.services.setupwizard.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.net.URI;

/**
 * Fail-fast validation of the connectivity defaults.
 *
 * An optional service that is switched on without a host or URL would make
 * every connectivity check fail, so the context refuses to start with an
 * actionable message instead. Services left switched off only produce a warning.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class SetupWizardConfigValidator {

    private final SetupWizardProperties properties;

    @PostConstruct
    public void validateConnectivityConfig() {
        log.info("Validating setup wizard configuration...");

        SetupWizardProperties.Connectivity connectivity = properties.getConnectivity();

        if (connectivity.getPostgresql().isEnabled()) {
            validateRequired("POSTGRESQL_HOST", "setup-wizard.connectivity.postgresql.host",
                    connectivity.getPostgresql().getHost());
        }
        if (connectivity.getRedis().isEnabled()) {
            validateRequired("REDIS_HOST", "setup-wizard.connectivity.redis.host",
                    connectivity.getRedis().getHost());
        }
        if (connectivity.getAiService().isEnabled()) {
            validateRequired("AI_SERVICE_URL", "setup-wizard.connectivity.ai-service.url",
                    connectivity.getAiService().getUrl());
            validateUrl("setup-wizard.connectivity.ai-service.url", connectivity.getAiService().getUrl());
        } else {
            log.warn("AI service connectivity is not configured. " +
                    "The service connectivity step will report it as an optional warning.");
        }

        log.info("Setup wizard configuration validated successfully (wizard enabled by default: {})",
                properties.isEnabledByDefault());
    }

    private void validateRequired(String envVar, String configKey, String value) {
        if (value == null || value.isBlank()) {
            String message = String.format(
                    "%n%n" +
                            "╔══════════════════════════════════════════════════════════════╗%n" +
                            "║  STARTUP FAILED - Missing Required Configuration             ║%n" +
                            "╠══════════════════════════════════════════════════════════════╣%n" +
                            "║  Config key : %-48s ║%n" +
                            "║  Env var    : %-48s ║%n" +
                            "║                                                              ║%n" +
                            "║  The service is enabled but has no address. Either set       ║%n" +
                            "║  export %s=<your-value>%n" +
                            "║  or disable the service.                                     ║%n" +
                            "╚══════════════════════════════════════════════════════════════╝%n",
                    configKey, envVar, envVar
            );
            throw new IllegalStateException(message);
        }
    }

    private void validateUrl(String configKey, String value) {
        try {
            URI uri = URI.create(value.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalStateException(configKey + " must be an absolute http(s) URL: " + value);
            }
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException(configKey + " is not a valid URL: " + value, ex);
        }
    }
}
