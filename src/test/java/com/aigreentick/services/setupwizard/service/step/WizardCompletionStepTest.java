package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.constants.SetupStep;
import com.aigreentick.services.setupwizard.service.InstallationDetector;
import com.aigreentick.services.setupwizard.service.StepCompletionMarkers;
import com.aigreentick.services.setupwizard.service.WizardProgressStore;
import com.aigreentick.services.setupwizard.service.model.WizardProgressRecord;
import com.aigreentick.services.setupwizard.support.InMemorySettingsPort;
import com.aigreentick.services.setupwizard.support.TestTransactions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("WizardCompletionStep")
class WizardCompletionStepTest {

    @Mock
    private InstallationDetector installationDetector;

    @Mock
    private WizardProgressStore progressStore;

    private StepCompletionMarkers markers;
    private WizardCompletionStep step;

    @BeforeEach
    void setUp() {
        InMemorySettingsPort settings = new InMemorySettingsPort();
        markers = new StepCompletionMarkers(settings);
        step = new WizardCompletionStep(
                new WizardStepContext(settings, markers, progressStore, TestTransactions.template()),
                installationDetector);
    }

    private void completeEveryStepBefore() {
        for (SetupStep setupStep : SetupStep.values()) {
            if (setupStep != SetupStep.COMPLETION) {
                markers.markCompleted(setupStep);
            }
        }
    }

    private static Optional<WizardProgressRecord> someProgress() {
        return Optional.of(new WizardProgressRecord(1L, "sample_data", Map.of(), false, LocalDateTime.now()));
    }

    @Test
    @DisplayName("should refuse when the wizard is already completed")
    void shouldRefuseWhenAlreadyCompleted() {
        when(installationDetector.isWizardCompleted()).thenReturn(true);

        assertThat(step.validate(Map.of()))
                .containsExactly(Map.entry("wizard_completed", "The setup wizard has already been completed"));
    }

    @Test
    @DisplayName("should name the incomplete required steps")
    void shouldNameIncompleteSteps() {
        markers.markCompleted(SetupStep.ORGANIZATION_INFO);
        when(installationDetector.isWizardCompleted()).thenReturn(false);
        when(installationDetector.getWizardProgress()).thenReturn(Optional.empty());

        Map<String, String> errors = step.validate(Map.of());

        assertThat(errors)
                .containsEntry("no_progress", "No wizard progress found. Please complete the previous steps first.")
                .containsEntry("incomplete_steps", "The following required steps are incomplete: "
                        + "Administrator Account, Operating Hours, Groups and Rooms, Finance Settings, Service Connectivity");
    }

    @Test
    @DisplayName("should mark the wizard completed when every earlier step is done")
    void shouldMarkCompleted() {
        completeEveryStepBefore();
        when(installationDetector.isWizardCompleted()).thenReturn(false);
        when(installationDetector.getWizardProgress()).thenReturn(someProgress());
        when(installationDetector.markWizardCompleted()).thenReturn(true);

        assertThat(step.save(Map.of())).isTrue();

        assertThat(markers.isCompleted(SetupStep.COMPLETION)).isTrue();
        verify(progressStore).merge(eq("completion"), argThat(payload -> payload instanceof Map<?, ?> map
                && map.containsKey("completedAt")));
    }

    @Test
    @DisplayName("should not set its marker when the completion flag cannot be written")
    void shouldNotMarkWhenFlagFails() {
        completeEveryStepBefore();
        when(installationDetector.isWizardCompleted()).thenReturn(false);
        when(installationDetector.getWizardProgress()).thenReturn(someProgress());
        when(installationDetector.markWizardCompleted()).thenReturn(false);

        assertThat(step.save(Map.of())).isFalse();

        assertThat(markers.isCompleted(SetupStep.COMPLETION)).isFalse();
        verify(progressStore, never()).merge(anyString(), any());
    }

    @Test
    @DisplayName("should summarise every other step in its form data")
    @SuppressWarnings("unchecked")
    void shouldSummariseSteps() {
        markers.markCompleted(SetupStep.ORGANIZATION_INFO);
        when(installationDetector.isWizardCompleted()).thenReturn(false);
        when(progressStore.findStepPayload("completion")).thenReturn(Optional.empty());

        Map<String, Object> data = step.prepareData();

        List<Map<String, Object>> steps = (List<Map<String, Object>>) data.get("steps");
        assertThat(steps).hasSize(SetupStep.values().length - 1);
        assertThat(steps.get(0)).containsEntry("id", "organization_info").containsEntry("completed", true);
        assertThat(data).containsEntry("completionPercentage", 14).containsEntry("wizardCompleted", false);
    }
}
