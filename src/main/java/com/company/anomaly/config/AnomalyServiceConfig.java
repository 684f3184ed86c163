package com.company.anomaly.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AnomalyDetectionProperties.class)
@Slf4j
public class AnomalyServiceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Detection work is handed off here so the execution engine's completion path never waits on it.
     */
    @Bean(name = "anomalyPipelineExecutor")
    public ThreadPoolTaskExecutor anomalyPipelineExecutor(AnomalyDetectionProperties properties) {
        AnomalyDetectionProperties.Pipeline pipeline = properties.getPipeline();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pipeline.getCorePoolSize());
        executor.setMaxPoolSize(pipeline.getMaxPoolSize());
        executor.setQueueCapacity(pipeline.getQueueCapacity());
        executor.setThreadNamePrefix("anomaly-pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Anomaly pipeline executor started: core={}, max={}, queue={}",
                pipeline.getCorePoolSize(), pipeline.getMaxPoolSize(), pipeline.getQueueCapacity());
        return executor;
    }

    @Bean(name = "notificationChannelExecutor")
    public ThreadPoolTaskExecutor notificationChannelExecutor(AnomalyDetectionProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getPipeline().getChannelPoolSize());
        executor.setMaxPoolSize(properties.getPipeline().getChannelPoolSize());
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("notification-channel-");
        executor.initialize();
        return executor;
    }

    @Bean
    public RestTemplate chatWebhookRestTemplate(RestTemplateBuilder builder, AnomalyDetectionProperties properties) {
        AnomalyDetectionProperties.Chat chat = properties.getAlerting().getChat();
        return builder
                .setConnectTimeout(chat.getConnectTimeout())
                .setReadTimeout(chat.getReadTimeout())
                .build();
    }
}
