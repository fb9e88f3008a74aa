package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.client.ServiceProbeClient;
import com.aigreentick.services.setupwizard.client.ServiceProbeClient.AiServiceTarget;
import com.aigreentick.services.setupwizard.client.ServiceProbeClient.PostgresqlTarget;
import com.aigreentick.services.setupwizard.client.ServiceProbeClient.RedisTarget;
import com.aigreentick.services.setupwizard.config.SetupWizardProperties;
import com.aigreentick.services.setupwizard.constants.ServiceStatus;
import com.aigreentick.services.setupwizard.constants.SetupStep;
import com.aigreentick.services.setupwizard.service.model.ServiceCheckResult;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.aigreentick.services.setupwizard.constants.SetupWizardConstants.*;
import static com.aigreentick.services.setupwizard.service.step.PayloadReader.*;

/**
 * Connectivity checks against the primary database and the optional
 * PostgreSQL, Redis and AI services.
 *
 * Payload sections ("postgresql", "redis", "ai_service") override the
 * configured defaults. The probes run before the save transaction opens;
 * their results are what gets stored.
 */
@Component
@Slf4j
public class ServiceConnectivityStep extends AbstractWizardStep {

    static final String DATABASE = "database";
    static final String POSTGRESQL = "postgresql";
    static final String REDIS = "redis";
    static final String AI_SERVICE = "ai_service";

    private static final TypeReference<LinkedHashMap<String, Object>> RESULTS_TYPE = new TypeReference<>() {};

    private final ServiceProbeClient probeClient;
    private final SetupWizardProperties properties;

    public ServiceConnectivityStep(WizardStepContext context,
                                   ServiceProbeClient probeClient,
                                   SetupWizardProperties properties) {
        super(context);
        this.probeClient = probeClient;
        this.properties = properties;
    }

    @Override
    public SetupStep getStep() {
        return SetupStep.SERVICE_CONNECTIVITY;
    }

    // ════════════════════════════════════════════════════════════
    // VALIDATION
    // ════════════════════════════════════════════════════════════

    @Override
    public Map<String, String> validate(Map<String, Object> payload) {
        FieldErrors errors = new FieldErrors();

        Map<String, Object> postgresql = object(payload.get(POSTGRESQL));
        if (toBoolean(postgresql.get("enabled")) && text(postgresql, "host").isEmpty()) {
            errors.add("postgresql_host", "PostgreSQL host is required when enabled");
        }

        Map<String, Object> redis = object(payload.get(REDIS));
        if (toBoolean(redis.get("enabled")) && text(redis, "host").isEmpty()) {
            errors.add("redis_host", "Redis host is required when enabled");
        }

        Map<String, Object> ai = object(payload.get(AI_SERVICE));
        if (toBoolean(ai.get("enabled"))) {
            String url = text(ai, "url");
            if (url.isEmpty()) {
                errors.add("ai_service_url", "AI service URL is required when enabled");
            } else if (!isHttpUrl(url)) {
                errors.add("ai_service_url", "AI service URL must be a valid URL");
            }
        }

        return errors.toMap();
    }

    // ════════════════════════════════════════════════════════════
    // CHECKS
    // ════════════════════════════════════════════════════════════

    /**
     * Probe every service independently; one failure never skips the others.
     * Disabled or unconfigured optional services are reported as warnings.
     */
    public Map<String, ServiceCheckResult> checkServices(Map<String, Object> payload) {
        Map<String, ServiceCheckResult> results = new LinkedHashMap<>();
        results.put(DATABASE, probeClient.checkPrimaryDatabase());
        results.put(POSTGRESQL, checkPostgresql(object(payload.get(POSTGRESQL))));
        results.put(REDIS, checkRedis(object(payload.get(REDIS))));
        results.put(AI_SERVICE, checkAiService(object(payload.get(AI_SERVICE))));
        return results;
    }

    private ServiceCheckResult checkPostgresql(Map<String, Object> section) {
        SetupWizardProperties.Postgresql defaults = properties.getConnectivity().getPostgresql();
        boolean enabled = section.containsKey("enabled") ? toBoolean(section.get("enabled")) : defaults.isEnabled();
        String host = firstNonBlank(textOrNull(section, "host"), defaults.getHost());
        if (!enabled || host == null) {
            return ServiceCheckResult.warning("PostgreSQL not configured (optional)");
        }
        return probeClient.checkPostgresql(new PostgresqlTarget(
                host,
                toInteger(section.get("port")).orElse(defaults.getPort()),
                firstNonBlank(textOrNull(section, "database"), defaults.getDatabase()),
                firstNonBlank(textOrNull(section, "user"), defaults.getUser()),
                firstNonBlank(textOrNull(section, "password"), defaults.getPassword()),
                defaults.getTimeoutSeconds()));
    }

    private ServiceCheckResult checkRedis(Map<String, Object> section) {
        SetupWizardProperties.Redis defaults = properties.getConnectivity().getRedis();
        boolean enabled = section.containsKey("enabled") ? toBoolean(section.get("enabled")) : defaults.isEnabled();
        String host = firstNonBlank(textOrNull(section, "host"), defaults.getHost());
        if (!enabled || host == null) {
            return ServiceCheckResult.warning("Redis not configured (optional)");
        }
        return probeClient.checkRedis(new RedisTarget(
                host,
                toInteger(section.get("port")).orElse(defaults.getPort()),
                firstNonBlank(textOrNull(section, "password"), defaults.getPassword()),
                defaults.getTimeoutMillis()));
    }

    private ServiceCheckResult checkAiService(Map<String, Object> section) {
        SetupWizardProperties.AiService defaults = properties.getConnectivity().getAiService();
        boolean enabled = section.containsKey("enabled") ? toBoolean(section.get("enabled")) : defaults.isEnabled();
        String url = firstNonBlank(textOrNull(section, "url"), defaults.getUrl());
        if (!enabled || url == null) {
            return ServiceCheckResult.warning("AI service not configured (optional)");
        }
        return probeClient.checkAiService(new AiServiceTarget(
                url,
                firstNonBlank(textOrNull(section, "api_key"), defaults.getApiKey()),
                defaults.getTimeoutSeconds()));
    }

    /**
     * A primary database error is decisive; otherwise any error, then any warning.
     */
    public static ServiceStatus getOverallStatus(Map<String, ServiceCheckResult> results) {
        boolean hasError = false;
        boolean hasWarning = false;
        for (Map.Entry<String, ServiceCheckResult> entry : results.entrySet()) {
            ServiceStatus status = entry.getValue().status();
            if (status == ServiceStatus.ERROR) {
                if (DATABASE.equals(entry.getKey())) {
                    return ServiceStatus.ERROR;
                }
                hasError = true;
            } else if (status == ServiceStatus.WARNING) {
                hasWarning = true;
            }
        }
        if (hasError) return ServiceStatus.ERROR;
        if (hasWarning) return ServiceStatus.WARNING;
        return ServiceStatus.OK;
    }

    // ════════════════════════════════════════════════════════════
    // PERSISTENCE
    // ════════════════════════════════════════════════════════════

    @Override
    protected Map<String, Object> beforeCommit(Map<String, Object> payload) {
        Map<String, ServiceCheckResult> results = checkServices(payload);
        ServiceStatus overall = getOverallStatus(results);
        log.info("Service connectivity checked: overall={}", overall.getValue());

        Map<String, Object> prepared = new LinkedHashMap<>(payload);
        prepared.put("results", results);
        prepared.put("overallStatus", overall.getValue());
        prepared.put("checkedAt", LocalDateTime.now().toString());
        return prepared;
    }

    @Override
    protected void persist(Map<String, Object> payload) {
        context.settings().setJson(SCOPE_SYSTEM, SETTING_CONNECTIVITY_CHECK, payload.get("results"));
        context.settings().set(SCOPE_SYSTEM, SETTING_CONNECTIVITY_CHECK_TIME, text(payload, "checkedAt"));
    }

    /** Connection secrets stay out of the progress record. */
    @Override
    protected Map<String, Object> progressPayload(Map<String, Object> payload) {
        Map<String, Object> stripped = new LinkedHashMap<>(payload);
        stripSecret(stripped, POSTGRESQL, "password");
        stripSecret(stripped, REDIS, "password");
        stripSecret(stripped, AI_SERVICE, "api_key");
        return stripped;
    }

    @Override
    public boolean isCompleted() {
        return context.settings().exists(SCOPE_SYSTEM, SETTING_CONNECTIVITY_CHECK);
    }

    @Override
    protected Map<String, Object> defaults() {
        SetupWizardProperties.Connectivity connectivity = properties.getConnectivity();

        Map<String, Object> postgresql = new LinkedHashMap<>();
        postgresql.put("enabled", connectivity.getPostgresql().isEnabled());
        postgresql.put("host", nullToEmpty(connectivity.getPostgresql().getHost()));
        postgresql.put("port", connectivity.getPostgresql().getPort());
        postgresql.put("database", nullToEmpty(connectivity.getPostgresql().getDatabase()));
        postgresql.put("user", nullToEmpty(connectivity.getPostgresql().getUser()));

        Map<String, Object> redis = new LinkedHashMap<>();
        redis.put("enabled", connectivity.getRedis().isEnabled());
        redis.put("host", nullToEmpty(connectivity.getRedis().getHost()));
        redis.put("port", connectivity.getRedis().getPort());

        Map<String, Object> ai = new LinkedHashMap<>();
        ai.put("enabled", connectivity.getAiService().isEnabled());
        ai.put("url", nullToEmpty(connectivity.getAiService().getUrl()));

        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put(POSTGRESQL, postgresql);
        defaults.put(REDIS, redis);
        defaults.put(AI_SERVICE, ai);
        defaults.put("results", new LinkedHashMap<>());
        return defaults;
    }

    @Override
    protected Map<String, Object> committedData() {
        Map<String, Object> data = new LinkedHashMap<>();
        context.settings().getJson(SCOPE_SYSTEM, SETTING_CONNECTIVITY_CHECK, RESULTS_TYPE)
                .ifPresent(results -> data.put("results", results));
        context.settings().getString(SCOPE_SYSTEM, SETTING_CONNECTIVITY_CHECK_TIME)
                .ifPresent(time -> data.put("checkedAt", time));
        return data;
    }

    @Override
    protected void deleteDomainData() {
        context.settings().delete(SCOPE_SYSTEM, SETTING_CONNECTIVITY_CHECK);
        context.settings().delete(SCOPE_SYSTEM, SETTING_CONNECTIVITY_CHECK_TIME);
    }

    // ── Helpers ────────────────────────────────────────────────────────

    private static void stripSecret(Map<String, Object> payload, String section, String key) {
        if (payload.get(section) instanceof Map<?, ?>) {
            Map<String, Object> copy = object(payload.get(section));
            copy.remove(key);
            payload.put(section, copy);
        }
    }

    private static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value);
            return uri.getScheme() != null
                    && (uri.getScheme().equalsIgnoreCase("http") || uri.getScheme().equalsIgnoreCase("https"))
                    && uri.getHost() != null;
        } catch (URISyntaxException ex) {
            return false;
        }
    }

    private static String firstNonBlank(String value, String fallback) {
        if (value != null && !value.isBlank()) return value;
        return fallback == null || fallback.isBlank() ? null : fallback;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
