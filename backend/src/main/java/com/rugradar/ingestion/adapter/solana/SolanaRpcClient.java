package com.rugradar.ingestion.adapter.solana;

import reactor.core.publisher.Mono;

/**
 * Solana JSON-RPC client abstraction for testing and endpoint rotation.
 * Methods used: getTransaction, getAccountInfo. Retries are handled by {@link SolanaRpcInvoker}.
 */
public interface SolanaRpcClient {

    /**
     * Perform a single Solana JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "getTransaction", "getAccountInfo"
     * @param params      method params (array or list)
     * @return response body as string (JSON); errors with {@code RpcException} on HTTP failure or timeout
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
