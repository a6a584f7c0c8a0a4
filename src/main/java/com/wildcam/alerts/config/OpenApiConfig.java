package com.wildcam.alerts.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI wildlifeAlertOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Wildlife Alert Engine API")
                        .version("1.0.0")
                        .description(
                                "Alert evaluation and notification delivery for a wildlife camera network.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Receive a detection via `POST /api/v1/detections`\n" +
                                "2. Extract a 9-value feature vector (confidence, time of day, weather, motion, danger flag)\n" +
                                "3. Compare against learned false/true positive patterns (cosine similarity)\n" +
                                "4. Assign a severity tier: **EMERGENCY**, **CRITICAL**, **WARNING**, **INFO**\n" +
                                "5. Apply environmental suppression, temporal scoring and a handling recommendation\n" +
                                "6. Persist the alert and, unless filtered, fan out to matching user rules\n\n" +
                                "**Channels:** email, push, webhook (3 attempts, 10s timeout), SMS via Twilio\n\n" +
                                "**Feedback:** `POST /api/v1/alerts/{id}/feedback` teaches the pattern matcher")
                        .contact(new Contact().name("Wildlife Monitoring Team")));
    }
}
