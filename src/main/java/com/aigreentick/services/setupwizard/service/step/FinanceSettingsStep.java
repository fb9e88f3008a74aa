package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.constants.SetupStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static com.aigreentick.services.setupwizard.constants.SetupWizardConstants.SCOPE_FINANCE;
import static com.aigreentick.services.setupwizard.service.step.PayloadReader.isAbsent;
import static com.aigreentick.services.setupwizard.service.step.PayloadReader.text;
import static com.aigreentick.services.setupwizard.service.step.PayloadReader.toNumber;

/**
 * Billing defaults, stored as settings in the Finance scope, one per field.
 */
@Component
@Slf4j
public class FinanceSettingsStep extends AbstractWizardStep {

    static final List<String> CURRENCIES = List.of("USD", "EUR", "GBP", "CAD", "AUD", "JPY", "CNY", "INR");
    static final List<String> PAYMENT_TERMS = List.of("immediate", "net7", "net15", "net30", "net60", "net90", "custom");

    static final List<String> FIELDS = List.of(
            "currency", "dailyRate", "paymentTerms", "customPaymentDays", "taxNumber", "vatNumber",
            "lateFeePercentage", "invoicePrefix", "invoiceStartNumber", "taxRate");

    private static final Pattern INVOICE_PREFIX = Pattern.compile("^[A-Za-z0-9-]+$");
    private static final BigDecimal MAX_DAILY_RATE = new BigDecimal("9999.99");

    public FinanceSettingsStep(WizardStepContext context) {
        super(context);
    }

    @Override
    public SetupStep getStep() {
        return SetupStep.FINANCE_SETTINGS;
    }

    // ════════════════════════════════════════════════════════════
    // VALIDATION
    // ════════════════════════════════════════════════════════════

    @Override
    public Map<String, String> validate(Map<String, Object> payload) {
        FieldErrors errors = new FieldErrors();

        String currency = text(payload, "currency");
        if (currency.isEmpty()) {
            errors.add("currency", "Currency is required");
        } else if (!CURRENCIES.contains(currency)) {
            errors.add("currency", "Currency must be one of: " + String.join(", ", CURRENCIES));
        }

        Object dailyRate = payload.get("dailyRate");
        if (isAbsent(dailyRate)) {
            errors.add("dailyRate", "Daily rate is required");
        } else {
            errors.number("dailyRate", dailyRate, "Daily rate", BigDecimal.ZERO, MAX_DAILY_RATE, null);
        }

        String paymentTerms = text(payload, "paymentTerms");
        if (paymentTerms.isEmpty()) {
            errors.add("paymentTerms", "Payment terms are required");
        } else if (!PAYMENT_TERMS.contains(paymentTerms)) {
            errors.add("paymentTerms", "Payment terms must be one of: " + String.join(", ", PAYMENT_TERMS));
        } else if ("custom".equals(paymentTerms)) {
            Object customDays = payload.get("customPaymentDays");
            if (isAbsent(customDays)) {
                errors.add("customPaymentDays", "Custom payment days are required when payment terms is custom");
            } else {
                errors.number("customPaymentDays", customDays, "Custom payment days", 1, 365);
            }
        }

        errors.optionalText("taxNumber", text(payload, "taxNumber"), "Tax number", 5, 50);
        errors.optionalText("vatNumber", text(payload, "vatNumber"), "VAT number", 5, 50);
        errors.optionalNumber("lateFeePercentage", payload.get("lateFeePercentage"), "Late fee percentage", 0, 100);

        String prefix = text(payload, "invoicePrefix");
        if (!prefix.isEmpty()) {
            if (prefix.length() > 20) {
                errors.add("invoicePrefix", "Invoice prefix must not exceed 20 characters");
            } else if (!INVOICE_PREFIX.matcher(prefix).matches()) {
                errors.add("invoicePrefix", "Invoice prefix must contain only letters, numbers, and hyphens");
            }
        }

        errors.optionalNumber("invoiceStartNumber", payload.get("invoiceStartNumber"), "Invoice start number", 1, 999999);
        errors.optionalNumber("taxRate", payload.get("taxRate"), "Tax rate", 0, 100);

        return errors.toMap();
    }

    // ════════════════════════════════════════════════════════════
    // PERSISTENCE
    // ════════════════════════════════════════════════════════════

    @Override
    protected void persist(Map<String, Object> payload) {
        boolean custom = "custom".equals(text(payload, "paymentTerms"));
        for (String field : FIELDS) {
            String value = normalize(payload.get(field));
            if (value.isEmpty() || ("customPaymentDays".equals(field) && !custom)) {
                context.settings().delete(SCOPE_FINANCE, field);
            } else {
                context.settings().set(SCOPE_FINANCE, field, value);
            }
        }
        log.debug("Finance settings stored (currency={})", text(payload, "currency"));
    }

    @Override
    public boolean isCompleted() {
        return context.settings().exists(SCOPE_FINANCE, "currency");
    }

    @Override
    protected Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("currency", "USD");
        defaults.put("dailyRate", "0");
        defaults.put("paymentTerms", "net30");
        defaults.put("customPaymentDays", "");
        defaults.put("taxNumber", "");
        defaults.put("vatNumber", "");
        defaults.put("lateFeePercentage", "");
        defaults.put("invoicePrefix", "INV");
        defaults.put("invoiceStartNumber", "1");
        defaults.put("taxRate", "");
        return defaults;
    }

    @Override
    protected Map<String, Object> committedData() {
        Map<String, Object> data = new LinkedHashMap<>();
        for (String field : FIELDS) {
            context.settings().getString(SCOPE_FINANCE, field)
                    .ifPresent(value -> data.put(field, value));
        }
        return data;
    }

    @Override
    protected void deleteDomainData() {
        for (String field : FIELDS) {
            context.settings().delete(SCOPE_FINANCE, field);
        }
    }

    private static String normalize(Object value) {
        if (isAbsent(value)) {
            return "";
        }
        if (value instanceof Number) {
            return toNumber(value).map(BigDecimal::toPlainString).orElse(value.toString());
        }
        return value.toString().trim();
    }
}
