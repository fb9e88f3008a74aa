package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.constants.PersonRole;
import com.aigreentick.services.setupwizard.constants.RecordOrigin;
import com.aigreentick.services.setupwizard.constants.SetupStep;
import com.aigreentick.services.setupwizard.entity.Person;
import com.aigreentick.services.setupwizard.repository.PersonRepository;
import com.aigreentick.services.setupwizard.service.StepCompletionMarkers;
import com.aigreentick.services.setupwizard.service.WizardProgressStore;
import com.aigreentick.services.setupwizard.support.InMemorySettingsPort;
import com.aigreentick.services.setupwizard.support.TestTransactions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AdminAccountStep")
class AdminAccountStepTest {

    @Mock
    private PersonRepository personRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private WizardProgressStore progressStore;

    private StepCompletionMarkers markers;
    private AdminAccountStep step;

    @BeforeEach
    void setUp() {
        InMemorySettingsPort settings = new InMemorySettingsPort();
        markers = new StepCompletionMarkers(settings);
        WizardStepContext context = new WizardStepContext(settings, markers, progressStore, TestTransactions.template());
        step = new AdminAccountStep(context, personRepository, passwordEncoder);
    }

    private static Map<String, Object> validPayload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("firstName", "Ada");
        payload.put("surname", "Lovelace");
        payload.put("email", "ada@example.com");
        payload.put("password", "Secret#123");
        payload.put("passwordConfirm", "Secret#123");
        return payload;
    }

    @Nested
    @DisplayName("validate()")
    class ValidateTests {

        @Test
        @DisplayName("should accept a complete payload")
        void shouldAcceptValidPayload() {
            when(personRepository.findFirstByRoleAndOriginOrderByIdAsc(PersonRole.ADMINISTRATOR, RecordOrigin.SETUP_WIZARD))
                    .thenReturn(Optional.empty());
            when(personRepository.existsByEmailIgnoreCase("ada@example.com")).thenReturn(false);

            assertThat(step.validate(validPayload())).isEmpty();
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "short1!A, ''",
                "Sh1!, Password must be at least 8 characters",
                "lowercase1!, Password must contain at least one uppercase letter",
                "UPPERCASE1!, Password must contain at least one lowercase letter",
                "NoDigits!!, Password must contain at least one number",
                "NoSpecial12, Password must contain at least one special character"
        })
        @DisplayName("should apply the password rules")
        void shouldApplyPasswordRules(String password, String expected) {
            when(personRepository.findFirstByRoleAndOriginOrderByIdAsc(any(), any())).thenReturn(Optional.empty());
            when(personRepository.existsByEmailIgnoreCase(anyString())).thenReturn(false);
            Map<String, Object> payload = validPayload();
            payload.put("password", password);
            payload.put("passwordConfirm", password);

            Map<String, String> errors = step.validate(payload);

            if (expected.isEmpty()) {
                assertThat(errors).doesNotContainKey("password");
            } else {
                assertThat(errors).containsEntry("password", expected);
            }
        }

        @Test
        @DisplayName("should reject a mismatched confirmation")
        void shouldRejectMismatchedConfirmation() {
            when(personRepository.findFirstByRoleAndOriginOrderByIdAsc(any(), any())).thenReturn(Optional.empty());
            when(personRepository.existsByEmailIgnoreCase(anyString())).thenReturn(false);
            Map<String, Object> payload = validPayload();
            payload.put("passwordConfirm", "Different#1");

            assertThat(step.validate(payload)).containsEntry("passwordConfirm", "Passwords do not match");
        }

        @Test
        @DisplayName("should reject an email used by another person")
        void shouldRejectTakenEmail() {
            when(personRepository.findFirstByRoleAndOriginOrderByIdAsc(any(), any())).thenReturn(Optional.empty());
            when(personRepository.existsByEmailIgnoreCase("ada@example.com")).thenReturn(true);

            assertThat(step.validate(validPayload())).containsEntry("email", "Email address already exists");
        }

        @Test
        @DisplayName("should accept the wizard administrator's own email on resubmission")
        void shouldAcceptOwnEmail() {
            Person existing = Person.builder().id(7L).email("ADA@example.com").username("ada.lovelace").build();
            when(personRepository.findFirstByRoleAndOriginOrderByIdAsc(any(), any())).thenReturn(Optional.of(existing));

            assertThat(step.validate(validPayload())).isEmpty();
            verify(personRepository, never()).existsByEmailIgnoreCase(anyString());
        }
    }

    @Nested
    @DisplayName("save()")
    class SaveTests {

        @Test
        @DisplayName("should store a hashed password and keep passwords out of the progress record")
        void shouldHashAndStripPasswords() {
            when(personRepository.findFirstByRoleAndOriginOrderByIdAsc(any(), any())).thenReturn(Optional.empty());
            when(personRepository.existsByEmailIgnoreCase(anyString())).thenReturn(false);
            when(personRepository.existsByUsernameIgnoreCase("ada.lovelace")).thenReturn(false);
            when(passwordEncoder.encode("Secret#123")).thenReturn("$2a$10$hash");

            assertThat(step.save(validPayload())).isTrue();

            ArgumentCaptor<Person> person = ArgumentCaptor.forClass(Person.class);
            verify(personRepository).save(person.capture());
            assertThat(person.getValue().getPasswordHash()).isEqualTo("$2a$10$hash");
            assertThat(person.getValue().getUsername()).isEqualTo("ada.lovelace");
            assertThat(person.getValue().getRole()).isEqualTo(PersonRole.ADMINISTRATOR);
            assertThat(person.getValue().getOrigin()).isEqualTo(RecordOrigin.SETUP_WIZARD);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, Object>> progress = ArgumentCaptor.forClass(Map.class);
            verify(progressStore).merge(eq("admin_account"), progress.capture());
            assertThat(progress.getValue()).doesNotContainKeys("password", "passwordConfirm")
                    .containsEntry("email", "ada@example.com");
            assertThat(markers.isCompleted(SetupStep.ADMIN_ACCOUNT)).isTrue();
        }

        @Test
        @DisplayName("should write nothing when the password is missing")
        void shouldNotWriteWithoutPassword() {
            when(personRepository.findFirstByRoleAndOriginOrderByIdAsc(any(), any())).thenReturn(Optional.empty());
            when(personRepository.existsByEmailIgnoreCase(anyString())).thenReturn(false);
            Map<String, Object> payload = validPayload();
            payload.remove("password");

            assertThat(step.save(payload)).isFalse();

            verify(personRepository, never()).save(any());
            verifyNoInteractions(progressStore, passwordEncoder);
            assertThat(markers.isCompleted(SetupStep.ADMIN_ACCOUNT)).isFalse();
        }
    }

    @Test
    @DisplayName("should suffix a derived username while it is taken")
    void shouldSuffixDerivedUsername() {
        when(personRepository.existsByUsernameIgnoreCase("ada.lovelace")).thenReturn(true);
        when(personRepository.existsByUsernameIgnoreCase("ada.lovelace1")).thenReturn(false);

        assertThat(step.deriveUsername("Ada", "Lovelace")).isEqualTo("ada.lovelace1");
    }

    @Test
    @DisplayName("should never return password fields as form data")
    void shouldNotPrefillPasswords() {
        when(personRepository.findFirstByRoleAndOriginOrderByIdAsc(any(), any())).thenReturn(Optional.empty());
        when(progressStore.findStepPayload("admin_account"))
                .thenReturn(Optional.of(Map.of("firstName", "Ada", "password", "leaked")));

        assertThat(step.prepareData()).containsEntry("firstName", "Ada").doesNotContainKey("password");
    }

    @Test
    @DisplayName("should drop both password fields from a draft")
    void shouldSanitizeDraft() {
        assertThat(step.sanitize(validPayload()))
                .containsEntry("email", "ada@example.com")
                .doesNotContainKeys("password", "passwordConfirm");
        verifyNoInteractions(personRepository, passwordEncoder, progressStore);
    }
}
