package com.talentledger.ingestion.config;

import com.talentledger.common.RetryPolicy;
import com.talentledger.ingestion.ledger.rpc.EvmRpcClient;
import com.talentledger.ingestion.ledger.rpc.RpcEndpointRotator;
import com.talentledger.ingestion.ledger.rpc.WebClientEvmRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the ledger RPC stack: endpoint rotator with retry policy, WebClient JSON-RPC client and the local rate limiter.
 */
@Configuration
@EnableConfigurationProperties({ LedgerProperties.class, IngestionRetryProperties.class, FeedProperties.class })
public class IngestionAdapterConfig {

    @Bean
    public RetryPolicy ledgerRetryPolicy(IngestionRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getMaxDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }

    @Bean
    public RpcEndpointRotator ledgerRpcEndpointRotator(LedgerProperties properties,
                                                     @Qualifier("ledgerRetryPolicy") RetryPolicy ledgerRetryPolicy) {
        return new RpcEndpointRotator(properties.getUrls(), ledgerRetryPolicy);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "ledgerRpcRateLimiter")
    public RateLimiter ledgerRpcRateLimiter(LedgerProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("ledger-rpc", config);
    }
}
