package com.wildcam.alerts.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger falsePositivePatterns;
    private final AtomicInteger truePositivePatterns;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.falsePositivePatterns = registry.gauge("pattern.memory.size",
                Tags.of("label", "false_positive"), new AtomicInteger(0));
        this.truePositivePatterns = registry.gauge("pattern.memory.size",
                Tags.of("label", "true_positive"), new AtomicInteger(0));
    }

    public void recordEvaluation(String severity, String recommendation, double mlConfidence) {
        Counter.builder("alert.evaluation.count")
                .tag("severity", severity)
                .tag("recommendation", recommendation)
                .register(registry)
                .increment();

        DistributionSummary.builder("alert.evaluation.ml_confidence")
                .tag("severity", severity)
                .register(registry)
                .record(mlConfidence);
    }

    public void recordFiltered(String reason) {
        Counter.builder("alert.filtered.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordWebhookAttempt(String outcome) {
        Counter.builder("webhook.attempt.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRetentionDeleted(int count) {
        Counter.builder("retention.deleted.count")
                .register(registry)
                .increment(count);
    }

    public void updatePatternMemorySize(int falsePositives, int truePositives) {
        falsePositivePatterns.set(falsePositives);
        truePositivePatterns.set(truePositives);
    }
}
