package com.wildcam.alerts.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "alerts.delivery")
public class DeliveryProperties {

    // Rules with suppressFalsePositives skip alerts whose FP score exceeds this
    private double falsePositiveSuppression = 0.7;

    private Webhook webhook = new Webhook();

    private Executor executor = new Executor();

    @Data
    public static class Webhook {
        private int maxAttempts = 3;
        private long backoffMillis = 0;
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 10;
    }

    @Data
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 1000;
    }
}
