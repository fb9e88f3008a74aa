package com.aigreentick.services.setupwizard.service;

import com.aigreentick.services.setupwizard.constants.SetupWizardConstants;
import com.aigreentick.services.setupwizard.entity.Setting;
import com.aigreentick.services.setupwizard.exception.WizardStorageException;
import com.aigreentick.services.setupwizard.repository.SettingRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * {@link SettingsPort} over the {@code settings} table.
 * Writes join the caller's transaction so a step's settings commit or roll back with its domain rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaSettingsStore implements SettingsPort {

    private static final String AUTO_DESCRIPTION = "Auto-generated by setup wizard";

    private final SettingRepository settingRepository;
    private final ObjectMapper objectMapper;

    // ════════════════════════════════════════════════════════════
    // READ
    // ════════════════════════════════════════════════════════════

    @Override
    @Transactional(readOnly = true)
    public Optional<String> getString(String scope, String name) {
        return settingRepository.findByScopeAndName(scope, name)
                .map(Setting::getValue);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean getBool(String scope, String name, boolean defaultValue) {
        return getString(scope, name)
                .map(value -> {
                    if (SetupWizardConstants.YES.equals(value)) return true;
                    if (SetupWizardConstants.NO.equals(value)) return false;
                    return defaultValue;
                })
                .orElse(defaultValue);
    }

    @Override
    @Transactional(readOnly = true)
    public <T> Optional<T> getJson(String scope, String name, TypeReference<T> type) {
        Optional<String> raw = getString(scope, name);
        if (raw.isEmpty() || raw.get().isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(raw.get(), type));
        } catch (JsonProcessingException ex) {
            log.warn("Setting {}/{} holds undecodable JSON, treating as absent: {}",
                    scope, name, ex.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(String scope, String name) {
        return settingRepository.existsByScopeAndName(scope, name);
    }

    // ════════════════════════════════════════════════════════════
    // WRITE
    // ════════════════════════════════════════════════════════════

    @Override
    @Transactional
    public void set(String scope, String name, String value) {
        Setting setting = settingRepository.findByScopeAndName(scope, name)
                .orElseGet(() -> Setting.builder()
                        .scope(scope)
                        .name(name)
                        .nameDisplay(name)
                        .description(AUTO_DESCRIPTION)
                        .build());
        setting.setValue(value);
        settingRepository.save(setting);
        log.debug("Setting {}/{} saved", scope, name);
    }

    @Override
    @Transactional
    public void setBool(String scope, String name, boolean value) {
        set(scope, name, value ? SetupWizardConstants.YES : SetupWizardConstants.NO);
    }

    @Override
    @Transactional
    public void setJson(String scope, String name, Object value) {
        try {
            set(scope, name, objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException ex) {
            throw new WizardStorageException("Could not serialize setting " + scope + "/" + name, ex);
        }
    }

    @Override
    @Transactional
    public void delete(String scope, String name) {
        int deleted = settingRepository.deleteByScopeAndName(scope, name);
        if (deleted > 0) {
            log.debug("Setting {}/{} deleted", scope, name);
        }
    }
}
