package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.config.SetupWizardProperties;
import com.aigreentick.services.setupwizard.constants.PersonRole;
import com.aigreentick.services.setupwizard.constants.RecordOrigin;
import com.aigreentick.services.setupwizard.entity.CareGroup;
import com.aigreentick.services.setupwizard.entity.Person;
import com.aigreentick.services.setupwizard.repository.CareGroupRepository;
import com.aigreentick.services.setupwizard.repository.PersonRepository;
import com.aigreentick.services.setupwizard.service.StepCompletionMarkers;
import com.aigreentick.services.setupwizard.service.WizardProgressStore;
import com.aigreentick.services.setupwizard.support.InMemorySettingsPort;
import com.aigreentick.services.setupwizard.support.TestTransactions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.aigreentick.services.setupwizard.constants.SetupWizardConstants.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SampleDataImportStep")
class SampleDataImportStepTest {

    @Mock
    private PersonRepository personRepository;

    @Mock
    private CareGroupRepository careGroupRepository;

    @Mock
    private WizardProgressStore progressStore;

    private InMemorySettingsPort settings;
    private SampleDataImportStep step;

    @BeforeEach
    void setUp() {
        settings = new InMemorySettingsPort();
        WizardStepContext context = new WizardStepContext(settings, new StepCompletionMarkers(settings),
                progressStore, TestTransactions.template());
        step = new SampleDataImportStep(context, personRepository, careGroupRepository, new SetupWizardProperties());
    }

    @Test
    @DisplayName("should skip validation when the import is declined")
    void shouldSkipValidationWhenDeclined() {
        assertThat(step.validate(Map.of("importSampleData", false, "categories", List.of("aliens")))).isEmpty();
    }

    @Test
    @DisplayName("should reject unknown categories and out-of-range counts")
    void shouldRejectInvalidInput() {
        Map<String, String> errors = step.validate(Map.of(
                "importSampleData", true,
                "categories", List.of("students", "aliens"),
                "staffCount", 101));

        assertThat(errors)
                .containsEntry("categories", "Invalid category: aliens")
                .containsEntry("staffCount", "Staff count must not exceed 100");
    }

    @Test
    @DisplayName("should record a declined import as completed without creating people")
    void shouldRecordDeclinedImport() {
        assertThat(step.save(Map.of("importSampleData", false))).isTrue();

        verify(personRepository).deleteByOrigin(RecordOrigin.SAMPLE_DATA);
        verify(personRepository, never()).saveAll(anyList());
        assertThat(settings.getBool(SCOPE_SYSTEM, SETTING_SAMPLE_DATA_IMPORTED, true)).isFalse();
        assertThat(step.isCompleted()).isTrue();
    }

    @Test
    @DisplayName("should create tagged people for the selected categories")
    @SuppressWarnings("unchecked")
    void shouldImportSelectedCategories() {
        CareGroup toddlers = CareGroup.builder().id(4L).name("Toddlers").minAge(1).maxAge(3).capacity(12).build();
        when(careGroupRepository.findByActiveTrueOrderByMinAgeAsc()).thenReturn(List.of(toddlers));
        when(personRepository.existsByUsernameIgnoreCase(anyString())).thenReturn(false);

        assertThat(step.save(Map.of(
                "importSampleData", true,
                "categories", List.of("students", "staff"),
                "studentCount", 4,
                "staffCount", 2))).isTrue();

        ArgumentCaptor<List<Person>> saved = ArgumentCaptor.forClass(List.class);
        verify(personRepository).saveAll(saved.capture());
        List<Person> people = saved.getValue();
        assertThat(people).hasSize(6);
        assertThat(people).allMatch(person -> person.getOrigin() == RecordOrigin.SAMPLE_DATA);
        assertThat(people).extracting(Person::getUsername).doesNotHaveDuplicates();
        assertThat(people).filteredOn(person -> person.getRole() == PersonRole.STUDENT)
                .hasSize(4)
                .allSatisfy(student -> {
                    assertThat(student.getCareGroupId()).isEqualTo(4L);
                    assertThat(student.getDateOfBirth()).isBetween(LocalDate.now().minusYears(4), LocalDate.now().minusYears(1).plusDays(1));
                });
        assertThat(people).noneMatch(person -> person.getRole() == PersonRole.PARENT);
        assertThat(settings.getString(SCOPE_SYSTEM, SETTING_SAMPLE_DATA_CATEGORIES)).contains("[\"students\",\"staff\"]");
    }

    @Test
    @DisplayName("should clamp requested counts to the configured maximum")
    void shouldClampCounts() {
        assertThat(SampleDataImportStep.count(Map.of("staffCount", 5000), "staffCount", 5, 100)).isEqualTo(100);
        assertThat(SampleDataImportStep.count(Map.of("staffCount", -3), "staffCount", 5, 100)).isZero();
        assertThat(SampleDataImportStep.count(Map.of(), "staffCount", 5, 100)).isEqualTo(5);
    }

    @Test
    @DisplayName("should remove only sample people on clear")
    void shouldClearSamplePeople() {
        settings.setBool(SCOPE_SYSTEM, SETTING_SAMPLE_DATA_IMPORTED, true);

        assertThat(step.clear()).isTrue();

        verify(personRepository).deleteByOrigin(RecordOrigin.SAMPLE_DATA);
        verifyNoMoreInteractions(personRepository);
        assertThat(step.isCompleted()).isFalse();
    }
}
