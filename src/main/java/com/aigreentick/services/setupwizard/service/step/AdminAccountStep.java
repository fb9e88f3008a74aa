package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.constants.PersonRole;
import com.aigreentick.services.setupwizard.constants.RecordOrigin;
import com.aigreentick.services.setupwizard.constants.SetupStep;
import com.aigreentick.services.setupwizard.entity.Person;
import com.aigreentick.services.setupwizard.repository.PersonRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.aigreentick.services.setupwizard.service.step.PayloadReader.text;
import static com.aigreentick.services.setupwizard.service.step.PayloadReader.textOrNull;

/**
 * First administrator account.
 *
 * Passwords are stored only as a BCrypt hash. They never reach the progress
 * record and are never returned as form data.
 */
@Component
@Slf4j
public class AdminAccountStep extends AbstractWizardStep {

    private static final Pattern USERNAME = Pattern.compile("^[A-Za-z0-9._-]+$");
    private static final Pattern SPECIAL = Pattern.compile("[^A-Za-z0-9]");
    private static final int USERNAME_MAX = 50;

    private final PersonRepository personRepository;
    private final PasswordEncoder passwordEncoder;

    public AdminAccountStep(WizardStepContext context,
                            PersonRepository personRepository,
                            PasswordEncoder passwordEncoder) {
        super(context);
        this.personRepository = personRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public SetupStep getStep() {
        return SetupStep.ADMIN_ACCOUNT;
    }

    // ════════════════════════════════════════════════════════════
    // VALIDATION
    // ════════════════════════════════════════════════════════════

    @Override
    public Map<String, String> validate(Map<String, Object> payload) {
        FieldErrors errors = new FieldErrors();
        Optional<Person> current = wizardAdministrator();

        errors.requireText("firstName", text(payload, "firstName"), "First name", 2, 100);
        errors.requireText("surname", text(payload, "surname"), "Surname", 2, 100);

        String email = text(payload, "email");
        if (email.isEmpty()) {
            errors.add("email", "Email address is required");
        } else if (!FieldErrors.isEmail(email)) {
            errors.add("email", "Invalid email address format");
        } else if (email.length() > 255) {
            errors.add("email", "Email must not exceed 255 characters");
        } else if (!isOwnValue(current.map(Person::getEmail), email)
                && personRepository.existsByEmailIgnoreCase(email)) {
            errors.add("email", "Email address already exists");
        }

        String username = text(payload, "username");
        if (!username.isEmpty()) {
            if (username.length() < 3) {
                errors.add("username", "Username must be at least 3 characters");
            } else if (username.length() > USERNAME_MAX) {
                errors.add("username", "Username must not exceed 50 characters");
            } else if (!USERNAME.matcher(username).matches()) {
                errors.add("username", "Username must contain only letters, numbers, dots, hyphens, and underscores");
            } else if (!isOwnValue(current.map(Person::getUsername), username)
                    && personRepository.existsByUsernameIgnoreCase(username)) {
                errors.add("username", "Username already exists");
            }
        }

        validatePassword(payload, errors);
        return errors.toMap();
    }

    private void validatePassword(Map<String, Object> payload, FieldErrors errors) {
        Object rawPassword = payload.get("password");
        String password = rawPassword == null ? "" : rawPassword.toString();

        if (password.isEmpty()) {
            errors.add("password", "Password is required");
        } else if (password.length() < 8) {
            errors.add("password", "Password must be at least 8 characters");
        } else if (password.length() > 72) {
            errors.add("password", "Password must not exceed 72 characters");
        } else if (password.chars().noneMatch(Character::isUpperCase)) {
            errors.add("password", "Password must contain at least one uppercase letter");
        } else if (password.chars().noneMatch(Character::isLowerCase)) {
            errors.add("password", "Password must contain at least one lowercase letter");
        } else if (password.chars().noneMatch(Character::isDigit)) {
            errors.add("password", "Password must contain at least one number");
        } else if (!SPECIAL.matcher(password).find()) {
            errors.add("password", "Password must contain at least one special character");
        }

        Object rawConfirm = payload.get("passwordConfirm");
        String confirm = rawConfirm == null ? "" : rawConfirm.toString();
        if (confirm.isEmpty()) {
            errors.add("passwordConfirm", "Password confirmation is required");
        } else if (!confirm.equals(password)) {
            errors.add("passwordConfirm", "Passwords do not match");
        }
    }

    // ════════════════════════════════════════════════════════════
    // PERSISTENCE
    // ════════════════════════════════════════════════════════════

    @Override
    protected void persist(Map<String, Object> payload) {
        Person admin = wizardAdministrator().orElseGet(() -> Person.builder()
                .role(PersonRole.ADMINISTRATOR)
                .origin(RecordOrigin.SETUP_WIZARD)
                .build());

        String firstName = text(payload, "firstName");
        String surname = text(payload, "surname");
        String username = textOrNull(payload, "username");
        if (username == null) {
            username = admin.getUsername() != null ? admin.getUsername() : deriveUsername(firstName, surname);
        }

        admin.setFirstName(firstName);
        admin.setSurname(surname);
        admin.setEmail(text(payload, "email"));
        admin.setUsername(username);
        admin.setPasswordHash(passwordEncoder.encode(payload.get("password").toString()));
        admin.setCanLogin(true);

        personRepository.save(admin);
        log.info("Administrator account '{}' stored", username);
    }

    @Override
    protected Map<String, Object> progressPayload(Map<String, Object> payload) {
        Map<String, Object> stripped = new LinkedHashMap<>(payload);
        stripped.remove("password");
        stripped.remove("passwordConfirm");
        return stripped;
    }

    @Override
    public boolean isCompleted() {
        return personRepository.existsByRole(PersonRole.ADMINISTRATOR);
    }

    @Override
    protected Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("firstName", "");
        defaults.put("surname", "");
        defaults.put("email", "");
        defaults.put("username", "");
        return defaults;
    }

    @Override
    protected Map<String, Object> committedData() {
        Map<String, Object> data = new LinkedHashMap<>();
        wizardAdministrator().ifPresent(admin -> {
            data.put("firstName", admin.getFirstName());
            data.put("surname", admin.getSurname());
            data.put("email", admin.getEmail() == null ? "" : admin.getEmail());
            data.put("username", admin.getUsername());
        });
        return data;
    }

    @Override
    protected void deleteDomainData() {
        int deleted = personRepository.deleteByRoleAndOrigin(PersonRole.ADMINISTRATOR, RecordOrigin.SETUP_WIZARD);
        log.debug("Deleted {} wizard-created administrator(s)", deleted);
    }

    // ── Helpers ────────────────────────────────────────────────────────

    private Optional<Person> wizardAdministrator() {
        return personRepository.findFirstByRoleAndOriginOrderByIdAsc(PersonRole.ADMINISTRATOR, RecordOrigin.SETUP_WIZARD);
    }

    private static boolean isOwnValue(Optional<String> existing, String candidate) {
        return existing.filter(candidate::equalsIgnoreCase).isPresent();
    }

    /** "first.surname", lower-case, suffixed with a number while taken. */
    String deriveUsername(String firstName, String surname) {
        String base = (firstName + "." + surname).toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]", "");
        if (base.length() > USERNAME_MAX - 4) {
            base = base.substring(0, USERNAME_MAX - 4);
        }
        String candidate = base;
        int suffix = 1;
        while (personRepository.existsByUsernameIgnoreCase(candidate)) {
            candidate = base + suffix++;
        }
        return candidate;
    }
}
