package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.config.SetupWizardProperties;
import com.aigreentick.services.setupwizard.constants.PersonRole;
import com.aigreentick.services.setupwizard.constants.RecordOrigin;
import com.aigreentick.services.setupwizard.constants.SetupStep;
import com.aigreentick.services.setupwizard.entity.CareGroup;
import com.aigreentick.services.setupwizard.entity.Person;
import com.aigreentick.services.setupwizard.repository.CareGroupRepository;
import com.aigreentick.services.setupwizard.repository.PersonRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static com.aigreentick.services.setupwizard.constants.SetupWizardConstants.*;
import static com.aigreentick.services.setupwizard.service.step.PayloadReader.*;

/**
 * Optional demo data: students, parents and staff tagged with origin
 * SAMPLE_DATA so clear() removes exactly those rows.
 */
@Component
@Slf4j
public class SampleDataImportStep extends AbstractWizardStep {

    static final List<String> CATEGORIES = List.of("students", "parents", "staff");

    static final int DEFAULT_STUDENTS = 10;
    static final int DEFAULT_PARENTS = 10;
    static final int DEFAULT_STAFF = 5;

    private static final List<String> STUDENT_FIRST_NAMES = List.of(
            "Emma", "Liam", "Olivia", "Noah", "Ava", "Ethan", "Sophia", "Mason", "Isabella", "William");
    private static final List<String> FAMILY_NAMES = List.of(
            "Smith", "Johnson", "Williams", "Brown", "Jones", "Garcia", "Miller", "Davis", "Rodriguez", "Martinez");
    private static final List<String> PARENT_FIRST_NAMES = List.of(
            "John", "Jane", "Michael", "Sarah", "David", "Emily", "Robert", "Jessica", "James", "Ashley");
    private static final List<String> STAFF_FIRST_NAMES = List.of(
            "Alice", "Bob", "Carol", "Daniel", "Eve", "Frank", "Grace", "Henry", "Ivy", "Jack");
    private static final List<String> STAFF_SURNAMES = List.of(
            "Anderson", "Thomas", "Taylor", "Moore", "Jackson", "Martin", "Lee", "White", "Harris", "Clark");
    private static final List<String> JOB_TITLES = List.of(
            "Teacher", "Aide", "Administrator", "Caregiver", "Supervisor");

    private static final TypeReference<List<String>> CATEGORY_LIST = new TypeReference<>() {};

    private final PersonRepository personRepository;
    private final CareGroupRepository careGroupRepository;
    private final SetupWizardProperties properties;
    private final Random random = new Random();

    public SampleDataImportStep(WizardStepContext context,
                                PersonRepository personRepository,
                                CareGroupRepository careGroupRepository,
                                SetupWizardProperties properties) {
        super(context);
        this.personRepository = personRepository;
        this.careGroupRepository = careGroupRepository;
        this.properties = properties;
    }

    @Override
    public SetupStep getStep() {
        return SetupStep.SAMPLE_DATA;
    }

    // ════════════════════════════════════════════════════════════
    // VALIDATION
    // ════════════════════════════════════════════════════════════

    @Override
    public Map<String, String> validate(Map<String, Object> payload) {
        FieldErrors errors = new FieldErrors();
        if (!toBoolean(payload.get("importSampleData"))) {
            return errors.toMap();
        }

        for (String category : strings(payload.get("categories"))) {
            if (!CATEGORIES.contains(category)) {
                errors.add("categories", "Invalid category: " + category);
                break;
            }
        }

        errors.optionalNumber("studentCount", payload.get("studentCount"), "Student count", 0, 1000);
        errors.optionalNumber("parentCount", payload.get("parentCount"), "Parent count", 0, 1000);
        errors.optionalNumber("staffCount", payload.get("staffCount"), "Staff count", 0, 100);
        return errors.toMap();
    }

    // ════════════════════════════════════════════════════════════
    // PERSISTENCE
    // ════════════════════════════════════════════════════════════

    @Override
    protected void persist(Map<String, Object> payload) {
        boolean importRequested = toBoolean(payload.get("importSampleData"));

        // A re-save replaces the previous import
        personRepository.deleteByOrigin(RecordOrigin.SAMPLE_DATA);
        context.settings().setBool(SCOPE_SYSTEM, SETTING_SAMPLE_DATA_IMPORTED, importRequested);

        if (!importRequested) {
            context.settings().delete(SCOPE_SYSTEM, SETTING_SAMPLE_DATA_CATEGORIES);
            log.info("Sample data import declined");
            return;
        }

        List<String> categories = strings(payload.get("categories"));
        if (categories.isEmpty()) {
            categories = CATEGORIES;
        }

        SetupWizardProperties.SampleData limits = properties.getSampleData();
        Set<String> usernames = new HashSet<>();
        List<Person> people = new ArrayList<>();
        if (categories.contains("students")) {
            people.addAll(students(count(payload, "studentCount", DEFAULT_STUDENTS, limits.getMaxStudents()), usernames));
        }
        if (categories.contains("parents")) {
            people.addAll(parents(count(payload, "parentCount", DEFAULT_PARENTS, limits.getMaxParents()), usernames));
        }
        if (categories.contains("staff")) {
            people.addAll(staff(count(payload, "staffCount", DEFAULT_STAFF, limits.getMaxStaff()), usernames));
        }
        personRepository.saveAll(people);
        context.settings().setJson(SCOPE_SYSTEM, SETTING_SAMPLE_DATA_CATEGORIES, categories);

        log.info("Sample data imported: {} people across {}", people.size(), categories);
    }

    static int count(Map<String, Object> payload, String key, int defaultCount, int max) {
        int requested = toInteger(payload.get(key)).orElse(defaultCount);
        return Math.max(0, Math.min(requested, max));
    }

    private List<Person> students(int count, Set<String> usernames) {
        List<CareGroup> groups = careGroupRepository.findByActiveTrueOrderByMinAgeAsc();
        List<Person> students = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String firstName = pick(STUDENT_FIRST_NAMES);
            String surname = pick(FAMILY_NAMES);
            CareGroup group = groups.isEmpty() ? null : groups.get(random.nextInt(groups.size()));
            students.add(samplePerson(firstName, surname, PersonRole.STUDENT, usernames)
                    .careGroupId(group == null ? null : group.getId())
                    .dateOfBirth(birthDateFor(group))
                    .build());
        }
        return students;
    }

    private List<Person> parents(int count, Set<String> usernames) {
        List<Person> parents = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String firstName = pick(PARENT_FIRST_NAMES);
            String surname = pick(FAMILY_NAMES);
            parents.add(samplePerson(firstName, surname, PersonRole.PARENT, usernames)
                    .email((firstName + "." + surname + "@example.com").toLowerCase(Locale.ROOT))
                    .build());
        }
        return parents;
    }

    private List<Person> staff(int count, Set<String> usernames) {
        List<Person> staff = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String firstName = pick(STAFF_FIRST_NAMES);
            String surname = pick(STAFF_SURNAMES);
            staff.add(samplePerson(firstName, surname, PersonRole.STAFF, usernames)
                    .email((firstName + "." + surname + "@daycare.example.com").toLowerCase(Locale.ROOT))
                    .jobTitle(pick(JOB_TITLES))
                    .build());
        }
        return staff;
    }

    private Person.PersonBuilder samplePerson(String firstName, String surname, PersonRole role, Set<String> usernames) {
        return Person.builder()
                .firstName(firstName)
                .surname(surname)
                .username(uniqueUsername(firstName, surname, usernames))
                .role(role)
                .origin(RecordOrigin.SAMPLE_DATA)
                .canLogin(false);
    }

    /** Initial + surname + four digits, unique in this batch and in storage. */
    private String uniqueUsername(String firstName, String surname, Set<String> usernames) {
        String base = (firstName.charAt(0) + surname).toLowerCase(Locale.ROOT);
        String candidate;
        do {
            candidate = base + (1000 + random.nextInt(9000));
        } while (!usernames.add(candidate) || personRepository.existsByUsernameIgnoreCase(candidate));
        return candidate;
    }

    private LocalDate birthDateFor(CareGroup group) {
        int minAge = group == null || group.getMinAge() == null ? 0 : group.getMinAge();
        int maxAge = group == null || group.getMaxAge() == null ? Math.max(minAge, 5) : Math.max(minAge, group.getMaxAge());
        int ageDays = minAge * 365 + random.nextInt(Math.max(1, (maxAge - minAge) * 365));
        return LocalDate.now().minusDays(ageDays);
    }

    private String pick(List<String> values) {
        return values.get(random.nextInt(values.size()));
    }

    @Override
    public boolean isCompleted() {
        return context.settings().exists(SCOPE_SYSTEM, SETTING_SAMPLE_DATA_IMPORTED);
    }

    @Override
    protected Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("importSampleData", false);
        defaults.put("categories", List.of());
        defaults.put("studentCount", DEFAULT_STUDENTS);
        defaults.put("parentCount", DEFAULT_PARENTS);
        defaults.put("staffCount", DEFAULT_STAFF);
        return defaults;
    }

    @Override
    protected Map<String, Object> committedData() {
        Map<String, Object> data = new LinkedHashMap<>();
        if (!context.settings().exists(SCOPE_SYSTEM, SETTING_SAMPLE_DATA_IMPORTED)) {
            return data;
        }
        boolean imported = context.settings().getBool(SCOPE_SYSTEM, SETTING_SAMPLE_DATA_IMPORTED, false);
        data.put("importSampleData", imported);
        if (imported) {
            context.settings().getJson(SCOPE_SYSTEM, SETTING_SAMPLE_DATA_CATEGORIES, CATEGORY_LIST)
                    .ifPresent(categories -> data.put("categories", categories));
            data.put("studentCount", personRepository.countByRoleAndOrigin(PersonRole.STUDENT, RecordOrigin.SAMPLE_DATA));
            data.put("parentCount", personRepository.countByRoleAndOrigin(PersonRole.PARENT, RecordOrigin.SAMPLE_DATA));
            data.put("staffCount", personRepository.countByRoleAndOrigin(PersonRole.STAFF, RecordOrigin.SAMPLE_DATA));
        }
        return data;
    }

    @Override
    protected void deleteDomainData() {
        int deleted = personRepository.deleteByOrigin(RecordOrigin.SAMPLE_DATA);
        context.settings().delete(SCOPE_SYSTEM, SETTING_SAMPLE_DATA_IMPORTED);
        context.settings().delete(SCOPE_SYSTEM, SETTING_SAMPLE_DATA_CATEGORIES);
        log.debug("Deleted {} sample people", deleted);
    }
}
