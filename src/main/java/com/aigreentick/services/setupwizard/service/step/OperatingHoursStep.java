package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.constants.SetupStep;
import com.aigreentick.services.setupwizard.entity.ClosureDate;
import com.aigreentick.services.setupwizard.repository.ClosureDateRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static com.aigreentick.services.setupwizard.constants.SetupWizardConstants.*;
import static com.aigreentick.services.setupwizard.service.step.PayloadReader.*;

/**
 * Weekly opening schedule, timezone and closure dates.
 */
@Component
@Slf4j
public class OperatingHoursStep extends AbstractWizardStep {

    static final List<String> DAYS = List.of(
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday");

    private static final Pattern TIME = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d$");
    private static final Pattern DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final DateTimeFormatter STRICT_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final String DEFAULT_OPEN = "08:00";
    private static final String DEFAULT_CLOSE = "18:00";
    private static final String DEFAULT_TIMEZONE = "UTC";

    private static final TypeReference<LinkedHashMap<String, Object>> SCHEDULE_TYPE = new TypeReference<>() {};

    private final ClosureDateRepository closureDateRepository;

    public OperatingHoursStep(WizardStepContext context, ClosureDateRepository closureDateRepository) {
        super(context);
        this.closureDateRepository = closureDateRepository;
    }

    @Override
    public SetupStep getStep() {
        return SetupStep.OPERATING_HOURS;
    }

    // ════════════════════════════════════════════════════════════
    // VALIDATION
    // ════════════════════════════════════════════════════════════

    @Override
    public Map<String, String> validate(Map<String, Object> payload) {
        FieldErrors errors = new FieldErrors();

        if (!(payload.get("schedule") instanceof Map<?, ?>)) {
            errors.add("schedule", "Schedule data is required");
        } else {
            validateSchedule(object(payload.get("schedule")), errors);
        }

        List<Map<String, Object>> closures = records(payload.get("closureDays"));
        for (int i = 0; i < closures.size(); i++) {
            validateClosure(i, closures.get(i), errors);
        }

        String timezone = text(payload, "timezone");
        if (!timezone.isEmpty() && !isZoneId(timezone)) {
            errors.add("timezone", "Invalid timezone");
        }

        return errors.toMap();
    }

    private void validateSchedule(Map<String, Object> schedule, FieldErrors errors) {
        boolean anyOpen = false;
        for (String day : DAYS) {
            Map<String, Object> hours = object(schedule.get(day));
            if (!toBoolean(hours.get("isOpen"))) {
                continue;
            }
            anyOpen = true;
            String label = capitalize(day);
            String prefix = "schedule." + day;

            String open = text(hours, "openTime");
            String close = text(hours, "closeTime");
            boolean openValid = checkTime(prefix + ".openTime", open, label + " open time", errors);
            boolean closeValid = checkTime(prefix + ".closeTime", close, label + " close time", errors);

            if (openValid && closeValid && !LocalTime.parse(open).isBefore(LocalTime.parse(close))) {
                errors.add(prefix + ".time", label + " open time must be before close time");
            }
        }
        if (!anyOpen) {
            errors.add("schedule", "At least one day must be marked as open");
        }
    }

    private boolean checkTime(String field, String value, String label, FieldErrors errors) {
        if (value.isEmpty()) {
            errors.add(field, label + " is required");
            return false;
        }
        if (!TIME.matcher(value).matches()) {
            errors.add(field, label + " must be in HH:MM format");
            return false;
        }
        return true;
    }

    private void validateClosure(int index, Map<String, Object> closure, FieldErrors errors) {
        String prefix = "closureDays." + index;

        String date = text(closure, "date");
        if (date.isEmpty()) {
            errors.add(prefix + ".date", "Closure date is required");
        } else if (!DATE.matcher(date).matches() || parseDate(date) == null) {
            errors.add(prefix + ".date", "Closure date must be in YYYY-MM-DD format");
        }

        String reason = text(closure, "reason");
        if (reason.isEmpty()) {
            errors.add(prefix + ".reason", "Closure reason is required");
        } else if (reason.length() > 255) {
            errors.add(prefix + ".reason", "Closure reason must not exceed 255 characters");
        }
    }

    // ════════════════════════════════════════════════════════════
    // PERSISTENCE
    // ════════════════════════════════════════════════════════════

    @Override
    protected void persist(Map<String, Object> payload) {
        context.settings().setJson(SCOPE_DAYCARE, SETTING_OPERATING_HOURS_SCHEDULE,
                normalizeSchedule(object(payload.get("schedule"))));

        String timezone = text(payload, "timezone");
        if (!timezone.isEmpty()) {
            context.settings().set(SCOPE_SYSTEM, SETTING_TIMEZONE, timezone);
        }

        closureDateRepository.deleteAllInBatch();
        List<ClosureDate> closures = new ArrayList<>();
        for (Map<String, Object> closure : records(payload.get("closureDays"))) {
            closures.add(ClosureDate.builder()
                    .date(parseDate(text(closure, "date")))
                    .reason(text(closure, "reason"))
                    .build());
        }
        closureDateRepository.saveAll(closures);
        log.debug("Operating hours stored with {} closure date(s)", closures.size());
    }

    @Override
    public boolean isCompleted() {
        return context.settings().exists(SCOPE_DAYCARE, SETTING_OPERATING_HOURS_SCHEDULE);
    }

    @Override
    protected Map<String, Object> defaults() {
        Map<String, Object> schedule = new LinkedHashMap<>();
        for (String day : DAYS) {
            schedule.put(day, dayHours(false, DEFAULT_OPEN, DEFAULT_CLOSE));
        }
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("schedule", schedule);
        defaults.put("timezone", DEFAULT_TIMEZONE);
        defaults.put("closureDays", List.of());
        return defaults;
    }

    @Override
    protected Map<String, Object> committedData() {
        Map<String, Object> data = new LinkedHashMap<>();
        context.settings().getJson(SCOPE_DAYCARE, SETTING_OPERATING_HOURS_SCHEDULE, SCHEDULE_TYPE)
                .ifPresent(schedule -> data.put("schedule", schedule));
        context.settings().getString(SCOPE_SYSTEM, SETTING_TIMEZONE)
                .filter(tz -> !tz.isBlank())
                .ifPresent(tz -> data.put("timezone", tz));

        List<Map<String, Object>> closures = new ArrayList<>();
        for (ClosureDate closure : closureDateRepository.findAllByOrderByDateAsc()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("date", closure.getDate().toString());
            entry.put("reason", closure.getReason());
            closures.add(entry);
        }
        if (!closures.isEmpty()) {
            data.put("closureDays", closures);
        }
        return data;
    }

    @Override
    protected void deleteDomainData() {
        closureDateRepository.deleteAllInBatch();
        context.settings().delete(SCOPE_DAYCARE, SETTING_OPERATING_HOURS_SCHEDULE);
        context.settings().delete(SCOPE_SYSTEM, SETTING_TIMEZONE);
    }

    // ── Helpers ────────────────────────────────────────────────────────

    private Map<String, Object> normalizeSchedule(Map<String, Object> schedule) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (String day : DAYS) {
            Map<String, Object> hours = object(schedule.get(day));
            boolean open = toBoolean(hours.get("isOpen"));
            normalized.put(day, dayHours(open,
                    open ? text(hours, "openTime") : "",
                    open ? text(hours, "closeTime") : ""));
        }
        return normalized;
    }

    private static Map<String, Object> dayHours(boolean open, String openTime, String closeTime) {
        Map<String, Object> hours = new LinkedHashMap<>();
        hours.put("isOpen", open);
        hours.put("openTime", openTime);
        hours.put("closeTime", closeTime);
        return hours;
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value, STRICT_DATE);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static boolean isZoneId(String value) {
        try {
            ZoneId.of(value);
            return true;
        } catch (DateTimeException ex) {
            return false;
        }
    }

    private static String capitalize(String day) {
        return Character.toUpperCase(day.charAt(0)) + day.substring(1);
    }
}
