package com.aigreentick.services.setupwizard.service;

import com.aigreentick.services.setupwizard.constants.SetupWizardConstants;
import com.aigreentick.services.setupwizard.entity.WizardProgress;
import com.aigreentick.services.setupwizard.exception.WizardStorageException;
import com.aigreentick.services.setupwizard.repository.WizardProgressRepository;
import com.aigreentick.services.setupwizard.service.model.WizardProgressRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the singleton progress row: JSON encode/decode of stepData and the
 * read-merge-write upsert.
 *
 * Write methods throw on failure and join the caller's transaction, so a
 * failed merge rolls back everything the caller wrote alongside it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WizardProgressStore {

    private static final TypeReference<LinkedHashMap<String, Object>> STEP_DATA_TYPE = new TypeReference<>() {};

    private final WizardProgressRepository progressRepository;
    private final ObjectMapper objectMapper;

    // ════════════════════════════════════════════════════════════
    // READ
    // ════════════════════════════════════════════════════════════

    /**
     * @return the decoded record; empty when no row exists or stepData does not decode
     */
    @Transactional(readOnly = true)
    public Optional<WizardProgressRecord> find() {
        Optional<WizardProgress> row = progressRepository.findById(SetupWizardConstants.PROGRESS_RECORD_ID);
        if (row.isEmpty()) {
            return Optional.empty();
        }
        WizardProgress progress = row.get();
        try {
            return Optional.of(new WizardProgressRecord(
                    progress.getId(),
                    progress.getStepCompleted(),
                    decode(progress.getStepData()),
                    progress.isWizardCompleted(),
                    progress.getUpdatedAt()));
        } catch (JsonProcessingException ex) {
            log.warn("Wizard progress stepData could not be decoded: {}", ex.getOriginalMessage());
            return Optional.empty();
        }
    }

    /** Last saved payload of one step, if any. */
    @Transactional(readOnly = true)
    public Optional<Object> findStepPayload(String stepId) {
        return find().map(WizardProgressRecord::stepData)
                .map(stepData -> stepData.get(stepId));
    }

    // ════════════════════════════════════════════════════════════
    // WRITE
    // ════════════════════════════════════════════════════════════

    /**
     * Put {@code payload} under {@code stepId} and set stepCompleted, leaving
     * every other key of stepData untouched. Creates the row on first use.
     *
     * The row is read with a write lock, so concurrent merges of different
     * steps are applied one after the other.
     */
    @Transactional
    public void merge(String stepId, Object payload) {
        WizardProgress progress = progressRepository
                .findByIdForUpdate(SetupWizardConstants.PROGRESS_RECORD_ID)
                .orElseGet(this::newRecord);

        Map<String, Object> stepData;
        try {
            stepData = decode(progress.getStepData());
        } catch (JsonProcessingException ex) {
            // Overwriting would drop every other step's payload
            throw new WizardStorageException("Existing wizard progress is unreadable, refusing to overwrite", ex);
        }

        stepData.put(stepId, payload);
        progress.setStepData(encode(stepData));
        progress.setStepCompleted(stepId);
        progressRepository.save(progress);

        log.debug("Wizard progress merged for step {} ({} step entries)", stepId, stepData.size());
    }

    @Transactional
    public void setWizardCompleted(boolean completed) {
        WizardProgress progress = progressRepository
                .findByIdForUpdate(SetupWizardConstants.PROGRESS_RECORD_ID)
                .orElseGet(this::newRecord);
        progress.setWizardCompleted(completed);
        progressRepository.save(progress);
    }

    /** Flag the existing row as not completed. No row is created. */
    @Transactional
    public void clearWizardCompleted() {
        progressRepository.findByIdForUpdate(SetupWizardConstants.PROGRESS_RECORD_ID)
                .ifPresent(progress -> {
                    progress.setWizardCompleted(false);
                    progressRepository.save(progress);
                });
    }

    @Transactional
    public void deleteProgress() {
        if (progressRepository.existsById(SetupWizardConstants.PROGRESS_RECORD_ID)) {
            progressRepository.deleteById(SetupWizardConstants.PROGRESS_RECORD_ID);
            log.info("Wizard progress record deleted");
        }
    }

    // ════════════════════════════════════════════════════════════
    // HELPERS
    // ════════════════════════════════════════════════════════════

    private WizardProgress newRecord() {
        return WizardProgress.builder()
                .id(SetupWizardConstants.PROGRESS_RECORD_ID)
                .stepData("{}")
                .wizardCompleted(false)
                .build();
    }

    private LinkedHashMap<String, Object> decode(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        LinkedHashMap<String, Object> decoded = objectMapper.readValue(json, STEP_DATA_TYPE);
        return decoded == null ? new LinkedHashMap<>() : decoded;
    }

    private String encode(Map<String, Object> stepData) {
        try {
            return objectMapper.writeValueAsString(stepData);
        } catch (JsonProcessingException ex) {
            throw new WizardStorageException("Could not serialize wizard progress", ex);
        }
    }
}
