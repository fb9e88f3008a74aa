package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.constants.SetupStep;
import com.aigreentick.services.setupwizard.service.StepCompletionMarkers;
import com.aigreentick.services.setupwizard.service.WizardProgressStore;
import com.aigreentick.services.setupwizard.support.InMemorySettingsPort;
import com.aigreentick.services.setupwizard.support.TestTransactions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.aigreentick.services.setupwizard.constants.SetupWizardConstants.SCOPE_FINANCE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FinanceSettingsStep")
class FinanceSettingsStepTest {

    @Mock
    private WizardProgressStore progressStore;

    private InMemorySettingsPort settings;
    private StepCompletionMarkers markers;
    private FinanceSettingsStep step;

    @BeforeEach
    void setUp() {
        settings = new InMemorySettingsPort();
        markers = new StepCompletionMarkers(settings);
        step = new FinanceSettingsStep(new WizardStepContext(settings, markers, progressStore, TestTransactions.template()));
    }

    private static Map<String, Object> validPayload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("currency", "EUR");
        payload.put("dailyRate", new BigDecimal("45.50"));
        payload.put("paymentTerms", "net15");
        payload.put("invoicePrefix", "KITA-");
        payload.put("taxRate", 19);
        return payload;
    }

    @Test
    @DisplayName("should accept a complete payload")
    void shouldAcceptValidPayload() {
        assertThat(step.validate(validPayload())).isEmpty();
    }

    @Test
    @DisplayName("should name the allowed currencies")
    void shouldListAllowedCurrencies() {
        Map<String, Object> payload = validPayload();
        payload.put("currency", "XYZ");

        assertThat(step.validate(payload)).containsEntry("currency",
                "Currency must be one of: USD, EUR, GBP, CAD, AUD, JPY, CNY, INR");
    }

    @Test
    @DisplayName("should require custom days only for custom payment terms")
    void shouldRequireCustomDays() {
        Map<String, Object> payload = validPayload();
        payload.put("paymentTerms", "custom");

        assertThat(step.validate(payload)).containsEntry("customPaymentDays",
                "Custom payment days are required when payment terms is custom");

        payload.put("customPaymentDays", 400);
        assertThat(step.validate(payload)).containsEntry("customPaymentDays",
                "Custom payment days must not exceed 365");
    }

    @Test
    @DisplayName("should check numeric bounds")
    void shouldCheckNumericBounds() {
        Map<String, Object> payload = validPayload();
        payload.put("dailyRate", "-1");
        payload.put("lateFeePercentage", "abc");
        payload.put("invoicePrefix", "INV 01");

        assertThat(step.validate(payload))
                .containsEntry("dailyRate", "Daily rate must be 0 or greater")
                .containsEntry("lateFeePercentage", "Late fee percentage must be a number")
                .containsEntry("invoicePrefix", "Invoice prefix must contain only letters, numbers, and hyphens");
    }

    @Test
    @DisplayName("should store one setting per field and drop blanks")
    void shouldStoreSettings() {
        settings.set(SCOPE_FINANCE, "customPaymentDays", "45");
        settings.set(SCOPE_FINANCE, "vatNumber", "DE123456");
        Map<String, Object> payload = validPayload();
        payload.put("customPaymentDays", 45);

        assertThat(step.save(payload)).isTrue();

        assertThat(settings.getString(SCOPE_FINANCE, "currency")).contains("EUR");
        assertThat(settings.getString(SCOPE_FINANCE, "dailyRate")).contains("45.50");
        assertThat(settings.getString(SCOPE_FINANCE, "taxRate")).contains("19");
        assertThat(settings.exists(SCOPE_FINANCE, "customPaymentDays")).isFalse();
        assertThat(settings.exists(SCOPE_FINANCE, "vatNumber")).isFalse();
        assertThat(step.isCompleted()).isTrue();
        assertThat(markers.isCompleted(SetupStep.FINANCE_SETTINGS)).isTrue();
    }

    @Test
    @DisplayName("should pre-fill from stored settings over the defaults")
    void shouldPrefillFromSettings() {
        settings.set(SCOPE_FINANCE, "currency", "GBP");
        when(progressStore.findStepPayload("finance_settings")).thenReturn(Optional.empty());

        assertThat(step.prepareData())
                .containsEntry("currency", "GBP")
                .containsEntry("paymentTerms", "net30")
                .containsEntry("invoicePrefix", "INV");
    }
}
