package com.talentledger.ingestion.ledger.rpc;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Retries and endpoint rotation live in {@link JsonRpcExecutor}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_call"
     * @param params      positional params
     * @return response body as string (JSON); errors with {@link RpcException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
