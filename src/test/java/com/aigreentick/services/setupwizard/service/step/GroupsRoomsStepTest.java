package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.entity.CareGroup;
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
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("GroupsRoomsStep")
class GroupsRoomsStepTest {

    @Mock
    private CareGroupRepository careGroupRepository;

    @Mock
    private PersonRepository personRepository;

    @Mock
    private WizardProgressStore progressStore;

    private GroupsRoomsStep step;

    @BeforeEach
    void setUp() {
        InMemorySettingsPort settings = new InMemorySettingsPort();
        WizardStepContext context = new WizardStepContext(settings, new StepCompletionMarkers(settings),
                progressStore, TestTransactions.template());
        step = new GroupsRoomsStep(context, careGroupRepository, personRepository);
    }

    private static Map<String, Object> group(String name, Object capacity, Object minAge, Object maxAge) {
        Map<String, Object> group = new HashMap<>();
        group.put("name", name);
        group.put("capacity", capacity);
        group.put("minAge", minAge);
        group.put("maxAge", maxAge);
        return group;
    }

    @Test
    @DisplayName("should require at least one group")
    void shouldRequireGroup() {
        assertThat(step.validate(Map.of("groups", List.of())))
                .containsExactly(Map.entry("groups", "At least one group/room is required"));
    }

    @Test
    @DisplayName("should report errors per group index")
    void shouldReportPerGroupErrors() {
        Map<String, Object> payload = Map.of("groups", List.of(
                group("Butterflies", 10, 2, 4),
                group("butterflies", 0, 5, 3),
                group("Owls", null, 1, 19),
                group("Bees", "ten", null, null)));

        Map<String, String> errors = step.validate(payload);

        assertThat(errors)
                .doesNotContainKeys("groups.0.name", "groups.0.capacity")
                .containsEntry("groups.1.name", "Group name must be unique")
                .containsEntry("groups.1.capacity", "Capacity must be at least 1")
                .containsEntry("groups.1.ageRange", "Minimum age must be less than or equal to maximum age")
                .containsEntry("groups.2.capacity", "Capacity is required")
                .containsEntry("groups.2.maxAge", "Maximum age must not exceed 18 years")
                .containsEntry("groups.3.capacity", "Capacity must be a number");
    }

    @Test
    @DisplayName("should replace every group and default them to active")
    @SuppressWarnings("unchecked")
    void shouldReplaceGroups() {
        Map<String, Object> inactive = group("Owls", "12", 3, 5);
        inactive.put("isActive", false);
        Map<String, Object> payload = Map.of("groups", List.of(group("Butterflies", 10, 2, 4), inactive));

        assertThat(step.save(payload)).isTrue();

        ArgumentCaptor<List<CareGroup>> saved = ArgumentCaptor.forClass(List.class);
        verify(careGroupRepository).deleteAllInBatch();
        verify(careGroupRepository).saveAll(saved.capture());
        assertThat(saved.getValue()).extracting(CareGroup::getName).containsExactly("Butterflies", "Owls");
        assertThat(saved.getValue()).extracting(CareGroup::isActive).containsExactly(true, false);
        assertThat(saved.getValue()).extracting(CareGroup::getCapacity).containsExactly(10, 12);
        verify(progressStore).merge("groups_rooms", payload);
    }

    @Test
    @DisplayName("should detach people from the old groups before replacing them")
    void shouldDetachPeopleBeforeReplacingGroups() {
        when(personRepository.clearCareGroupAssignments()).thenReturn(4);

        assertThat(step.save(Map.of("groups", List.of(group("Butterflies", 10, 2, 4))))).isTrue();

        InOrder order = inOrder(personRepository, careGroupRepository);
        order.verify(personRepository).clearCareGroupAssignments();
        order.verify(careGroupRepository).deleteAllInBatch();
        order.verify(careGroupRepository).saveAll(anyList());
    }

    @Test
    @DisplayName("should detach people when the groups are cleared")
    void shouldDetachPeopleOnClear() {
        assertThat(step.clear()).isTrue();

        InOrder order = inOrder(personRepository, careGroupRepository);
        order.verify(personRepository).clearCareGroupAssignments();
        order.verify(careGroupRepository).deleteAllInBatch();
    }

    @Test
    @DisplayName("should offer the three default groups on a fresh installation")
    @SuppressWarnings("unchecked")
    void shouldOfferDefaultGroups() {
        when(careGroupRepository.findAllByOrderByIdAsc()).thenReturn(List.of());
        when(progressStore.findStepPayload("groups_rooms")).thenReturn(Optional.empty());

        List<Map<String, Object>> groups = (List<Map<String, Object>>) step.prepareData().get("groups");

        assertThat(groups).extracting(group -> group.get("name"))
                .containsExactly("Infants", "Toddlers", "Preschool");
    }

    @Test
    @DisplayName("should let a saved draft list replace the default list")
    @SuppressWarnings("unchecked")
    void shouldReplaceListsFromDraft() {
        when(careGroupRepository.findAllByOrderByIdAsc()).thenReturn(List.of());
        when(progressStore.findStepPayload("groups_rooms"))
                .thenReturn(Optional.of(Map.of("groups", List.of(Map.of("name", "Only")))));

        List<Map<String, Object>> groups = (List<Map<String, Object>>) step.prepareData().get("groups");

        assertThat(groups).hasSize(1);
    }
}
