package com.talentledger.reconcile.config;

import com.talentledger.common.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ReconcileProperties.class)
public class ReconcileConfig {

    @Bean
    public RetryPolicy reconcileRetryPolicy(ReconcileProperties properties) {
        return new RetryPolicy(properties.getBaseDelayMs(), properties.getMaxDelayMs(),
                properties.getJitterFactor(), properties.getMaxAttempts());
    }
}
