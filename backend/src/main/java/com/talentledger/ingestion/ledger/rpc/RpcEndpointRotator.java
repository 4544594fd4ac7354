package com.talentledger.ingestion.ledger.rpc;

import com.talentledger.common.RetryPolicy;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out ledger RPC endpoints round-robin so a failed call is retried on the next node. Blank entries (an unset
 * environment variable in the endpoint list) and repeated URLs are dropped.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final RetryPolicy retryPolicy;
    private final AtomicInteger cursor = new AtomicInteger();

    public RpcEndpointRotator(List<String> configured, RetryPolicy retryPolicy) {
        Set<String> distinct = new LinkedHashSet<>();
        if (configured != null) {
            for (String url : configured) {
                if (url != null && !url.isBlank()) {
                    distinct.add(url.trim());
                }
            }
        }
        if (distinct.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(distinct);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public String getNextEndpoint() {
        return endpoints.get(Math.floorMod(cursor.getAndIncrement(), endpoints.size()));
    }

    /** Backoff before the call that follows the given zero-based failed attempt. */
    public long retryDelayMs(int failedAttempt) {
        return retryPolicy.delayMs(failedAttempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
