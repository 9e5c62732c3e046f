package com.ogt.crm.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@EnableConfigurationProperties(MigrationProperties.class)
public class MigrationConfig {

    // ========== CORRIDAS: un solo hilo, una corrida a la vez ==========
    @Bean
    public ThreadPoolTaskExecutor migrationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("crm-migration-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    // ========== ENTREGA DE EVENTOS A OBSERVADORES ==========
    @Bean
    public ThreadPoolTaskExecutor progressDeliveryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("crm-progress-");
        executor.initialize();
        return executor;
    }

    // ========== PING KEEP-ALIVE ==========
    @Bean
    public ThreadPoolTaskScheduler progressPingScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("crm-progress-ping-");
        scheduler.initialize();
        return scheduler;
    }
}
