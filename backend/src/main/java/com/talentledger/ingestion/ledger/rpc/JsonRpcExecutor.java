package com.talentledger.ingestion.ledger.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentledger.ingestion.config.LedgerProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;

/**
 * Executes one JSON-RPC method against the configured endpoints: local rate limit, bounded timeout, round-robin
 * failover with backoff. Returns the {@code result} node of the response envelope.
 */
@Slf4j
@Component
public class JsonRpcExecutor {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public JsonRpcExecutor(
            EvmRpcClient rpcClient,
            RpcEndpointRotator rotator,
            @Qualifier("ledgerRpcRateLimiter") RateLimiter rateLimiter,
            ObjectMapper objectMapper,
            LedgerProperties properties
    ) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.requestTimeout = Duration.ofMillis(Math.max(1L, properties.getRequestTimeoutMs()));
    }

    /**
     * @throws RpcRevertException when the node reports an execution revert (never retried)
     * @throws RpcException       when every attempt failed on transport or node errors
     */
    public JsonNode execute(String method, Object params) {
        Exception lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(rotator.retryDelayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RpcException("Interrupted during retry", e);
                }
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                if (!rateLimiter.acquirePermission()) {
                    throw new RpcException("Local rate limiter timed out waiting for a permit");
                }
                String json = rpcClient.call(endpoint, method, params).block(requestTimeout);
                return parseResult(method, json);
            } catch (RpcRevertException e) {
                throw e;
            } catch (Exception e) {
                lastException = e;
                log.debug("{} failed on {} (attempt {}/{}): {}", method, endpoint, attempt + 1,
                        rotator.getMaxAttempts(), e.getMessage());
            }
        }
        String msg = method + " failed after " + rotator.getMaxAttempts() + " attempts";
        if (lastException != null && lastException.getMessage() != null && !lastException.getMessage().isBlank()) {
            msg += ": " + lastException.getMessage();
        }
        throw new RpcException(msg, lastException);
    }

    JsonNode parseResult(String method, String json) {
        if (json == null) {
            throw new RpcException(method + " returned null");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            if (isRevert(error)) {
                throw new RpcRevertException(method + " reverted: " + error);
            }
            throw new RpcException(method + " error: " + error);
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode()) {
            throw new RpcException(method + " response has no result");
        }
        return result;
    }

    static boolean isRevert(JsonNode error) {
        if (error.path("code").asInt() == 3) {
            return true;
        }
        String message = error.path("message").asText("").toLowerCase();
        return message.contains("execution reverted") || message.contains("revert");
    }
}
