package com.talentledger.ingestion.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.talentledger.config.CaffeineConfig;
import com.talentledger.ingestion.ledger.rpc.JsonRpcExecutor;
import com.talentledger.ingestion.ledger.rpc.RpcException;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Resolves block timestamp via eth_getBlockByNumber. Confirmed blocks never change, so results are cached.
 */
@Component
@RequiredArgsConstructor
public class BlockTimestampResolver {

    private final JsonRpcExecutor rpc;

    @Cacheable(cacheNames = CaffeineConfig.BLOCK_TIMESTAMP_CACHE, key = "#blockNumber")
    public Instant getBlockTimestamp(long blockNumber) {
        JsonNode result = rpc.execute("eth_getBlockByNumber", List.of("0x" + Long.toHexString(blockNumber), false));
        if (result.isNull()) {
            throw new RpcException("eth_getBlockByNumber no result for block " + blockNumber);
        }
        String timestampHex = result.path("timestamp").asText(null);
        if (timestampHex == null || !timestampHex.startsWith("0x")) {
            throw new RpcException("eth_getBlockByNumber invalid timestamp: " + timestampHex);
        }
        return Instant.ofEpochSecond(Long.parseLong(timestampHex.substring(2), 16));
    }
}
