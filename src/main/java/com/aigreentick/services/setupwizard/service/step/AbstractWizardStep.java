package com.aigreentick.services.setupwizard.service.step;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Skeleton shared by all steps: the transactional save, the three-layer
 * prepareData overlay and the transactional clear.
 *
 * Subclasses supply validation, domain persistence and the layers.
 */
@Slf4j
public abstract class AbstractWizardStep implements WizardStep {

    protected final WizardStepContext context;

    protected AbstractWizardStep(WizardStepContext context) {
        this.context = context;
    }

    // ════════════════════════════════════════════════════════════
    // HOOKS
    // ════════════════════════════════════════════════════════════

    /** Write the step's own tables/settings. Runs inside the save transaction. */
    protected abstract void persist(Map<String, Object> payload);

    /** Delete what persist() created. Runs inside the clear transaction. */
    protected abstract void deleteDomainData();

    protected abstract Map<String, Object> defaults();

    /** Data already committed to the step's tables/settings, empty if none. */
    protected abstract Map<String, Object> committedData();

    /**
     * Runs after validation and outside the transaction. Returns the payload
     * handed to persist() and progressPayload(). Defaults to the input.
     */
    protected Map<String, Object> beforeCommit(Map<String, Object> payload) {
        return payload;
    }

    /** What goes into the progress record. Defaults to the payload as given. */
    protected Map<String, Object> progressPayload(Map<String, Object> payload) {
        return payload;
    }

    // ════════════════════════════════════════════════════════════
    // CONTRACT
    // ════════════════════════════════════════════════════════════

    @Override
    public boolean save(Map<String, Object> payload) {
        Map<String, Object> input = payload == null ? Map.of() : payload;
        String stepId = getStep().getId();

        Map<String, String> errors = validate(input);
        if (!errors.isEmpty()) {
            log.warn("Step {} rejected with {} validation error(s): {}", stepId, errors.size(), errors.keySet());
            return false;
        }

        try {
            Map<String, Object> prepared = beforeCommit(input);
            context.transactionTemplate().executeWithoutResult(status -> {
                persist(prepared);
                context.markers().markCompleted(getStep());
                context.progressStore().merge(stepId, progressPayload(prepared));
            });
        } catch (RuntimeException ex) {
            log.error("Step {} save failed, changes rolled back", stepId, ex);
            return false;
        }

        log.info("Step {} saved", stepId);
        return true;
    }

    @Override
    public Map<String, Object> prepareData() {
        Map<String, Object> data = new LinkedHashMap<>(defaults());
        try {
            PayloadMerger.overlay(data, committedData());
            context.progressStore().findStepPayload(getStep().getId())
                    .filter(Map.class::isInstance)
                    .map(PayloadReader::object)
                    .ifPresent(draft -> PayloadMerger.overlay(data, progressPayload(draft)));
        } catch (DataAccessException ex) {
            log.warn("Step {} stored data unreadable, showing defaults: {}", getStep().getId(), ex.getMessage());
        }
        return data;
    }

    @Override
    public final Map<String, Object> sanitize(Map<String, Object> payload) {
        return progressPayload(payload == null ? Map.of() : payload);
    }

    @Override
    public boolean clear() {
        String stepId = getStep().getId();
        try {
            context.transactionTemplate().executeWithoutResult(status -> {
                deleteDomainData();
                context.markers().clear(getStep());
            });
        } catch (RuntimeException ex) {
            log.error("Step {} clear failed, changes rolled back", stepId, ex);
            return false;
        }
        log.info("Step {} cleared", stepId);
        return true;
    }

    // ════════════════════════════════════════════════════════════
    // HELPERS
    // ════════════════════════════════════════════════════════════

    protected boolean markerCompleted() {
        return context.markers().isCompleted(getStep());
    }
}
