package com.talentledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. The feed pool runs the runner loop and the live polling loop (one thread each); the ops
 * pool runs operator-triggered aggregate rebuilds off the HTTP threads. Per-partition reconcile workers are owned
 * by ReconcileDispatcher.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String FEED_EXECUTOR = "feed-executor";
    public static final String OPS_EXECUTOR = "ops-executor";
    /** Blocking ledger reads made on behalf of API requests. */
    public static final String LEDGER_READ_EXECUTOR = "ledger-read-executor";

    @Bean(name = FEED_EXECUTOR)
    public Executor feedExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setThreadNamePrefix("feed-");
        e.initialize();
        return e;
    }

    @Bean(name = OPS_EXECUTOR)
    public Executor opsExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(2);
        e.setThreadNamePrefix("ops-");
        e.initialize();
        return e;
    }

    @Bean(name = LEDGER_READ_EXECUTOR)
    public Executor ledgerReadExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setQueueCapacity(200);
        e.setThreadNamePrefix("ledger-read-");
        e.initialize();
        return e;
    }
}
