package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.constants.SetupStep;
import com.aigreentick.services.setupwizard.entity.CareGroup;
import com.aigreentick.services.setupwizard.repository.CareGroupRepository;
import com.aigreentick.services.setupwizard.repository.PersonRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.aigreentick.services.setupwizard.service.step.PayloadReader.*;

/**
 * Groups/rooms with capacity and age range in years.
 */
@Component
@Slf4j
public class GroupsRoomsStep extends AbstractWizardStep {

    private static final BigDecimal MAX_AGE = BigDecimal.valueOf(18);

    private final CareGroupRepository careGroupRepository;
    private final PersonRepository personRepository;

    public GroupsRoomsStep(WizardStepContext context,
                           CareGroupRepository careGroupRepository,
                           PersonRepository personRepository) {
        super(context);
        this.careGroupRepository = careGroupRepository;
        this.personRepository = personRepository;
    }

    @Override
    public SetupStep getStep() {
        return SetupStep.GROUPS_ROOMS;
    }

    // ════════════════════════════════════════════════════════════
    // VALIDATION
    // ════════════════════════════════════════════════════════════

    @Override
    public Map<String, String> validate(Map<String, Object> payload) {
        FieldErrors errors = new FieldErrors();

        List<Map<String, Object>> groups = records(payload.get("groups"));
        if (groups.isEmpty()) {
            errors.add("groups", "At least one group/room is required");
            return errors.toMap();
        }

        Set<String> seenNames = new HashSet<>();
        for (int i = 0; i < groups.size(); i++) {
            validateGroup(i, groups.get(i), seenNames, errors);
        }
        return errors.toMap();
    }

    private void validateGroup(int index, Map<String, Object> group, Set<String> seenNames, FieldErrors errors) {
        String prefix = "groups." + index + ".";

        String name = text(group, "name");
        if (errors.requireText(prefix + "name", name, "Group name", 2, 100)
                && !seenNames.add(name.toLowerCase(Locale.ROOT))) {
            errors.add(prefix + "name", "Group name must be unique");
        }

        Object capacity = group.get("capacity");
        if (isAbsent(capacity)) {
            errors.add(prefix + "capacity", "Capacity is required");
        } else {
            errors.number(prefix + "capacity", capacity, "Capacity", 1, 999);
        }

        Optional<BigDecimal> minAge = optionalAge(prefix + "minAge", group.get("minAge"), "Minimum age", errors);
        Optional<BigDecimal> maxAge = optionalAge(prefix + "maxAge", group.get("maxAge"), "Maximum age", errors);
        if (minAge.isPresent() && maxAge.isPresent() && minAge.get().compareTo(maxAge.get()) > 0) {
            errors.add(prefix + "ageRange", "Minimum age must be less than or equal to maximum age");
        }

        errors.optionalText(prefix + "description", text(group, "description"), "Description", 0, 500);
    }

    private Optional<BigDecimal> optionalAge(String field, Object raw, String label, FieldErrors errors) {
        if (isAbsent(raw)) {
            return Optional.empty();
        }
        return errors.number(field, raw, label, BigDecimal.ZERO, MAX_AGE, "years");
    }

    // ════════════════════════════════════════════════════════════
    // PERSISTENCE
    // ════════════════════════════════════════════════════════════

    @Override
    protected void persist(Map<String, Object> payload) {
        deleteGroups();

        List<CareGroup> groups = new ArrayList<>();
        for (Map<String, Object> group : records(payload.get("groups"))) {
            groups.add(CareGroup.builder()
                    .name(text(group, "name"))
                    .description(textOrNull(group, "description"))
                    .minAge(toInteger(group.get("minAge")).orElse(null))
                    .maxAge(toInteger(group.get("maxAge")).orElse(null))
                    .capacity(toInteger(group.get("capacity")).orElseThrow())
                    .active(!group.containsKey("isActive") || toBoolean(group.get("isActive")))
                    .build());
        }
        careGroupRepository.saveAll(groups);
        log.debug("Stored {} group(s)", groups.size());
    }

    @Override
    public boolean isCompleted() {
        return careGroupRepository.count() > 0;
    }

    @Override
    protected Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("groups", List.of(
                group("Infants", "0-12 months", 0, 1, 8),
                group("Toddlers", "1-3 years", 1, 3, 12),
                group("Preschool", "3-5 years", 3, 5, 16)));
        return defaults;
    }

    @Override
    protected Map<String, Object> committedData() {
        List<CareGroup> stored = careGroupRepository.findAllByOrderByIdAsc();
        if (stored.isEmpty()) {
            return Map.of();
        }
        List<Map<String, Object>> groups = new ArrayList<>();
        for (CareGroup careGroup : stored) {
            Map<String, Object> group = group(careGroup.getName(), careGroup.getDescription(),
                    careGroup.getMinAge(), careGroup.getMaxAge(), careGroup.getCapacity());
            group.put("isActive", careGroup.isActive());
            groups.add(group);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("groups", groups);
        return data;
    }

    @Override
    protected void deleteDomainData() {
        deleteGroups();
    }

    /** People must not keep pointing at group ids that are about to disappear. */
    private void deleteGroups() {
        int detached = personRepository.clearCareGroupAssignments();
        if (detached > 0) {
            log.info("Detached {} people from groups being replaced", detached);
        }
        careGroupRepository.deleteAllInBatch();
    }

    private static Map<String, Object> group(String name, String description,
                                             Integer minAge, Integer maxAge, Integer capacity) {
        Map<String, Object> group = new LinkedHashMap<>();
        group.put("name", name);
        group.put("description", description == null ? "" : description);
        group.put("minAge", minAge);
        group.put("maxAge", maxAge);
        group.put("capacity", capacity);
        group.put("isActive", true);
        return group;
    }
}
