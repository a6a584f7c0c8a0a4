package com.wildcam.alerts.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class DeliveryConfig {

    @Bean(name = "deliveryExecutor")
    public ThreadPoolTaskExecutor deliveryExecutor(DeliveryProperties properties) {
        DeliveryProperties.Executor cfg = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getCorePoolSize());
        executor.setMaxPoolSize(cfg.getMaxPoolSize());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("alert-delivery-");
        // Saturation pushes work back onto the ingesting thread instead of dropping it
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder, DeliveryProperties properties) {
        DeliveryProperties.Webhook cfg = properties.getWebhook();
        return builder
                .setConnectTimeout(Duration.ofSeconds(cfg.getConnectTimeoutSeconds()))
                .setReadTimeout(Duration.ofSeconds(cfg.getReadTimeoutSeconds()))
                .additionalInterceptors((request, body, execution) -> {
                    request.getHeaders().add("User-Agent", "wildlife-alert-engine");
                    return execution.execute(request, body);
                })
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
