package com.aigreentick.services.setupwizard.service.step;

import com.aigreentick.services.setupwizard.constants.SetupStep;
import com.aigreentick.services.setupwizard.entity.Organization;
import com.aigreentick.services.setupwizard.repository.OrganizationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

import static com.aigreentick.services.setupwizard.service.step.PayloadReader.text;
import static com.aigreentick.services.setupwizard.service.step.PayloadReader.textOrNull;

/**
 * Organization profile: name, address, contact details and licence number.
 */
@Component
@Slf4j
public class OrganizationInfoStep extends AbstractWizardStep {

    private static final Pattern PHONE = Pattern.compile("^[0-9\\s\\-()+]+$");
    private static final int SHORT_NAME_MAX = 20;

    private final OrganizationRepository organizationRepository;

    public OrganizationInfoStep(WizardStepContext context, OrganizationRepository organizationRepository) {
        super(context);
        this.organizationRepository = organizationRepository;
    }

    @Override
    public SetupStep getStep() {
        return SetupStep.ORGANIZATION_INFO;
    }

    @Override
    public Map<String, String> validate(Map<String, Object> payload) {
        FieldErrors errors = new FieldErrors();

        errors.requireText("name", text(payload, "name"), "Organization name", 2, 255);
        errors.requireText("address", text(payload, "address"), "Address", 5, 500);

        String phone = text(payload, "phone");
        if (phone.isEmpty()) {
            errors.add("phone", "Phone number is required");
        } else if (!PHONE.matcher(phone).matches()) {
            errors.add("phone", "Phone number must contain only digits, spaces, hyphens, parentheses, and plus sign");
        } else if (phone.length() > 50) {
            errors.add("phone", "Phone number must not exceed 50 characters");
        }

        String email = text(payload, "email");
        if (!email.isEmpty()) {
            if (!FieldErrors.isEmail(email)) {
                errors.add("email", "Invalid email address format");
            } else if (email.length() > 255) {
                errors.add("email", "Email must not exceed 255 characters");
            }
        }

        String website = text(payload, "website");
        if (!website.isEmpty()) {
            if (!isWebUrl(website)) {
                errors.add("website", "Invalid website URL format");
            } else if (website.length() > 255) {
                errors.add("website", "Website URL must not exceed 255 characters");
            }
        }

        errors.optionalText("licenseNumber", text(payload, "licenseNumber"), "License number", 0, 100);

        return errors.toMap();
    }

    @Override
    protected void persist(Map<String, Object> payload) {
        Organization organization = organizationRepository.findFirstByOrderByIdAsc()
                .orElseGet(Organization::new);

        String name = text(payload, "name");
        organization.setName(name);
        organization.setShortName(shortNameOf(name));
        organization.setAddress(text(payload, "address"));
        organization.setPhone(text(payload, "phone"));
        organization.setEmail(textOrNull(payload, "email"));
        organization.setWebsite(textOrNull(payload, "website"));
        organization.setLicenseNumber(textOrNull(payload, "licenseNumber"));

        organizationRepository.save(organization);
        log.debug("Organization '{}' stored", name);
    }

    @Override
    public boolean isCompleted() {
        return organizationRepository.findFirstByOrderByIdAsc()
                .map(Organization::getName)
                .filter(name -> !name.isBlank())
                .isPresent();
    }

    @Override
    protected Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("name", "");
        defaults.put("address", "");
        defaults.put("phone", "");
        defaults.put("email", "");
        defaults.put("website", "");
        defaults.put("licenseNumber", "");
        return defaults;
    }

    @Override
    protected Map<String, Object> committedData() {
        Map<String, Object> data = new LinkedHashMap<>();
        organizationRepository.findFirstByOrderByIdAsc().ifPresent(org -> {
            data.put("name", org.getName());
            data.put("address", nullToEmpty(org.getAddress()));
            data.put("phone", nullToEmpty(org.getPhone()));
            data.put("email", nullToEmpty(org.getEmail()));
            data.put("website", nullToEmpty(org.getWebsite()));
            data.put("licenseNumber", nullToEmpty(org.getLicenseNumber()));
        });
        return data;
    }

    @Override
    protected void deleteDomainData() {
        organizationRepository.deleteAll();
    }

    // ── Helpers ────────────────────────────────────────────────────────

    static String shortNameOf(String name) {
        String firstWord = name.trim().split("\\s+")[0];
        return firstWord.length() > SHORT_NAME_MAX ? firstWord.substring(0, SHORT_NAME_MAX) : firstWord;
    }

    private static boolean isWebUrl(String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            return scheme != null
                    && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    && uri.getHost() != null;
        } catch (URISyntaxException ex) {
            return false;
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
