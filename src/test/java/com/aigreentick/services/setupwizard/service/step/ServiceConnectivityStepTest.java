package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.client.ServiceProbeClient;
import com.aigreentick.services.setupwizard.client.ServiceProbeClient.AiServiceTarget;
import com.aigreentick.services.setupwizard.client.ServiceProbeClient.PostgresqlTarget;
import com.aigreentick.services.setupwizard.config.SetupWizardProperties;
import com.aigreentick.services.setupwizard.constants.ServiceStatus;
import com.aigreentick.services.setupwizard.service.StepCompletionMarkers;
import com.aigreentick.services.setupwizard.service.WizardProgressStore;
import com.aigreentick.services.setupwizard.service.model.ServiceCheckResult;
import com.aigreentick.services.setupwizard.support.InMemorySettingsPort;
import com.aigreentick.services.setupwizard.support.TestTransactions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.aigreentick.services.setupwizard.constants.SetupWizardConstants.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ServiceConnectivityStep")
class ServiceConnectivityStepTest {

    @Mock
    private ServiceProbeClient probeClient;

    @Mock
    private WizardProgressStore progressStore;

    private InMemorySettingsPort settings;
    private SetupWizardProperties properties;
    private ServiceConnectivityStep step;

    @BeforeEach
    void setUp() {
        settings = new InMemorySettingsPort();
        properties = new SetupWizardProperties();
        WizardStepContext context = new WizardStepContext(settings, new StepCompletionMarkers(settings),
                progressStore, TestTransactions.template());
        step = new ServiceConnectivityStep(context, probeClient, properties);
    }

    @Nested
    @DisplayName("getOverallStatus()")
    class OverallStatusTests {

        private Map<String, ServiceCheckResult> results(ServiceCheckResult database, ServiceCheckResult redis) {
            Map<String, ServiceCheckResult> results = new LinkedHashMap<>();
            results.put("database", database);
            results.put("redis", redis);
            return results;
        }

        @Test
        @DisplayName("should be ok when every service is ok")
        void shouldBeOk() {
            assertThat(ServiceConnectivityStep.getOverallStatus(
                    results(ServiceCheckResult.ok("up", null), ServiceCheckResult.ok("up", "7.2"))))
                    .isEqualTo(ServiceStatus.OK);
        }

        @Test
        @DisplayName("should be a warning when only optional services warn")
        void shouldBeWarning() {
            assertThat(ServiceConnectivityStep.getOverallStatus(
                    results(ServiceCheckResult.ok("up", null), ServiceCheckResult.warning("not configured"))))
                    .isEqualTo(ServiceStatus.WARNING);
        }

        @Test
        @DisplayName("should be an error when the primary database fails")
        void shouldBeErrorOnDatabaseFailure() {
            assertThat(ServiceConnectivityStep.getOverallStatus(
                    results(ServiceCheckResult.error("down"), ServiceCheckResult.warning("not configured"))))
                    .isEqualTo(ServiceStatus.ERROR);
        }

        @Test
        @DisplayName("should be an error when an optional service fails")
        void shouldBeErrorOnOptionalFailure() {
            assertThat(ServiceConnectivityStep.getOverallStatus(
                    results(ServiceCheckResult.warning("no tables"), ServiceCheckResult.error("refused"))))
                    .isEqualTo(ServiceStatus.ERROR);
        }
    }

    @Nested
    @DisplayName("validate()")
    class ValidateTests {

        @Test
        @DisplayName("should require hosts and a URL for enabled services")
        void shouldRequireEnabledTargets() {
            Map<String, Object> payload = Map.of(
                    "postgresql", Map.of("enabled", true),
                    "redis", Map.of("enabled", "Y", "host", " "),
                    "ai_service", Map.of("enabled", true, "url", "not a url"));

            assertThat(step.validate(payload))
                    .containsEntry("postgresql_host", "PostgreSQL host is required when enabled")
                    .containsEntry("redis_host", "Redis host is required when enabled")
                    .containsEntry("ai_service_url", "AI service URL must be a valid URL");
        }

        @Test
        @DisplayName("should accept an empty payload")
        void shouldAcceptEmptyPayload() {
            assertThat(step.validate(Map.of())).isEmpty();
        }
    }

    @Test
    @DisplayName("should report unconfigured optional services as warnings without probing them")
    void shouldWarnForUnconfiguredServices() {
        when(probeClient.checkPrimaryDatabase()).thenReturn(ServiceCheckResult.ok("Database connection successful", "H2"));

        Map<String, ServiceCheckResult> results = step.checkServices(Map.of());

        assertThat(results).containsOnlyKeys("database", "postgresql", "redis", "ai_service");
        assertThat(results.get("redis")).isEqualTo(ServiceCheckResult.warning("Redis not configured (optional)"));
        verify(probeClient, never()).checkRedis(any());
        verify(probeClient, never()).checkPostgresql(any());
    }

    @Test
    @DisplayName("should let payload sections override configured defaults")
    void shouldOverrideDefaults() {
        properties.getConnectivity().getPostgresql().setPassword("from-config");
        when(probeClient.checkPrimaryDatabase()).thenReturn(ServiceCheckResult.ok("up", null));
        when(probeClient.checkPostgresql(any())).thenReturn(ServiceCheckResult.ok("PostgreSQL connection successful", "16.2"));

        step.checkServices(Map.of("postgresql", Map.of("enabled", true, "host", "pg.internal", "port", "6543")));

        ArgumentCaptor<PostgresqlTarget> target = ArgumentCaptor.forClass(PostgresqlTarget.class);
        verify(probeClient).checkPostgresql(target.capture());
        assertThat(target.getValue().host()).isEqualTo("pg.internal");
        assertThat(target.getValue().port()).isEqualTo(6543);
        assertThat(target.getValue().database()).isEqualTo("postgres");
        assertThat(target.getValue().password()).isEqualTo("from-config");
    }

    @Test
    @DisplayName("should store the probe results and keep secrets out of the progress record")
    @SuppressWarnings("unchecked")
    void shouldSaveResultsWithoutSecrets() {
        when(probeClient.checkPrimaryDatabase()).thenReturn(ServiceCheckResult.ok("up", null));
        when(probeClient.checkAiService(any(AiServiceTarget.class))).thenReturn(ServiceCheckResult.ok("up", "1.0"));
        Map<String, Object> payload = Map.of(
                "ai_service", Map.of("enabled", true, "url", "http://ai.internal:8000", "api_key", "sk-secret"));

        assertThat(step.save(payload)).isTrue();

        assertThat(step.isCompleted()).isTrue();
        assertThat(settings.exists(SCOPE_SYSTEM, SETTING_CONNECTIVITY_CHECK_TIME)).isTrue();

        ArgumentCaptor<Map<String, Object>> progress = ArgumentCaptor.forClass(Map.class);
        verify(progressStore).merge(eq("service_connectivity"), progress.capture());
        assertThat((Map<String, Object>) progress.getValue().get("ai_service"))
                .doesNotContainKey("api_key")
                .containsEntry("url", "http://ai.internal:8000");
        assertThat(progress.getValue()).containsEntry("overallStatus", "warning").containsKey("results");
    }

    @Test
    @DisplayName("should remove passwords and the API key from a draft")
    @SuppressWarnings("unchecked")
    void shouldSanitizeDraft() {
        Map<String, Object> draft = Map.of(
                "postgresql", Map.of("enabled", true, "host", "pg.internal", "password", "pg-secret"),
                "redis", Map.of("enabled", true, "host", "cache.internal", "password", "redis-secret"),
                "ai_service", Map.of("enabled", true, "url", "http://ai.internal:8000", "api_key", "sk-secret"));

        Map<String, Object> sanitized = step.sanitize(draft);

        assertThat((Map<String, Object>) sanitized.get("postgresql"))
                .doesNotContainKey("password").containsEntry("host", "pg.internal");
        assertThat((Map<String, Object>) sanitized.get("redis"))
                .doesNotContainKey("password").containsEntry("host", "cache.internal");
        assertThat((Map<String, Object>) sanitized.get("ai_service"))
                .doesNotContainKey("api_key").containsEntry("url", "http://ai.internal:8000");
        verifyNoInteractions(probeClient, progressStore);
    }
}
