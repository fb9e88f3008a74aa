package com.aigreentick.services.setupwizard;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Setup Wizard service
 *
 * This service handles:
 * - First-run installation detection
 * - The ordered sequence of setup steps and their access gating
 * - Per-step validation and persistence
 * - Resume of an interrupted wizard from durable state only
 * - Final wizard completion and reset
 *
 * @author AiGreenTick Team
 * @version 1.0.0
 */
@SpringBootApplication
@OpenAPIDefinition(
        info = @Info(
                title = "Setup Wizard API",
                version = "1.0.0",
                description = "First-run installation wizard for the AiGreenTick platform. " +
                        "Every request rebuilds wizard state from the database.",
                contact = @Contact(
                        name = "AiGreenTick Support",
                        email = "support@aigreentick.com"
                )
        ),
        servers = {
                @Server(url = "http://localhost:8082", description = "Local Development")
        }
)
public class SetupWizardApplication {

    public static void main(String[] args) {
        SpringApplication.run(SetupWizardApplication.class, args);
    }
}
