package com.aigreentick.services.setupwizard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Typed config properties for the setup wizard.
 *
 * Bound from application.yml under prefix "setup-wizard":
 * ┌─────────────────────────────────────────────────────────────────┐
 * │  setup-wizard:                                                  │
 * │    enabled-by-default: true                                     │
 * │    connectivity:                                                │
 * │      postgresql:  { enabled, host, port, database, user, ... }  │
 * │      redis:       { enabled, host, port, password, ... }        │
 * │      ai-service:  { enabled, url, api-key, timeout-seconds }    │
 * │    sample-data:                                                 │
 * │      max-students: 1000                                         │
 * └─────────────────────────────────────────────────────────────────┘
 *
 * Connectivity values are the defaults for the service connectivity step;
 * a payload section submitted by the operator overrides them.
 * See SetupWizardConfigValidator for fail-fast startup validation.
 */
@Configuration
@ConfigurationProperties(prefix = "setup-wizard")
@Data
public class SetupWizardProperties {

    /** Value of "wizard enabled" while the System/setupWizardEnabled setting is absent */
    private boolean enabledByDefault = true;

    private Connectivity connectivity = new Connectivity();

    private SampleData sampleData = new SampleData();

    @Data
    public static class Connectivity {
        private Postgresql postgresql = new Postgresql();
        private Redis redis = new Redis();
        private AiService aiService = new AiService();
    }

    @Data
    public static class Postgresql {
        private boolean enabled = false;
        private String host;
        private int port = 5432;
        private String database = "postgres";
        private String user = "postgres";
        private String password = "";
        private int timeoutSeconds = 5;
    }

    @Data
    public static class Redis {
        private boolean enabled = false;
        private String host;
        private int port = 6379;
        private String password;
        private int timeoutMillis = 2500;
    }

    @Data
    public static class AiService {
        private boolean enabled = false;
        private String url;
        /** Sent as a bearer token, never logged */
        private String apiKey;
        private int timeoutSeconds = 10;
    }

    @Data
    public static class SampleData {
        private int maxStudents = 1000;
        private int maxParents = 1000;
        private int maxStaff = 100;
    }
}
