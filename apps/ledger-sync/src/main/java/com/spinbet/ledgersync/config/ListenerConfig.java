package com.spinbet.ledgersync.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Wiring for the contract event listener: RPC transport, poll scheduler and the
 * per-event transaction boundary.
 */
@Configuration
public class ListenerConfig {

    /**
     * RestTemplate for Soroban JSON-RPC calls. Connect and read timeouts bound every fetch.
     */
    @Bean
    public RestTemplate sorobanRestTemplate(RestTemplateBuilder builder, StellarRpcProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
                .build();
    }

    /**
     * Single-threaded scheduler: one poll cycle in flight at a time.
     */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler contractEventScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("contract-events-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(60);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager,
                                                   ContractEventsProperties properties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout(properties.getTransactionTimeoutSeconds());
        return template;
    }
}
