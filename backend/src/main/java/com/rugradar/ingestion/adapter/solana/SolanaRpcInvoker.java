package com.rugradar.ingestion.adapter.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rugradar.common.RetryPolicy;
import com.rugradar.ingestion.adapter.RpcException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes one Solana JSON-RPC method for the launch workers. Every attempt goes to the next endpoint in
 * round-robin order, so a retry after a transport failure lands on a fallback URL when one is configured.
 * Attempts are spaced by the {@link RetryPolicy} and each one takes a permit from the shared local rate limiter.
 * Returns the {@code result} node as-is; a JSON null result is a valid answer, not a failure, and is never retried.
 */
@Slf4j
public class SolanaRpcInvoker {

    private final SolanaRpcClient rpcClient;
    private final List<String> endpoints;
    private final AtomicInteger nextEndpoint = new AtomicInteger();
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public SolanaRpcInvoker(SolanaRpcClient rpcClient, List<String> endpoints, RetryPolicy retryPolicy,
                            RateLimiter rateLimiter, ObjectMapper objectMapper) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one Solana RPC endpoint required");
        }
        this.rpcClient = rpcClient;
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    /**
     * @return the JSON-RPC {@code result} node (may be a {@code NullNode})
     * @throws RpcException when every attempt failed at transport or JSON-RPC level
     */
    public JsonNode call(String method, List<Object> params) {
        Exception lastException = null;
        int maxAttempts = retryPolicy.getMaxAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(retryPolicy.delayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RpcException("Interrupted during " + method + " retry", e);
                }
            }
            String endpoint = endpoints.get(Math.floorMod(nextEndpoint.getAndIncrement(), endpoints.size()));
            try {
                JsonNode root = objectMapper.readTree(callRpc(endpoint, method, params));
                JsonNode error = root.path("error");
                if (!error.isMissingNode() && !error.isNull()) {
                    throw new RpcException(method + " error: " + error);
                }
                return root.path("result");
            } catch (Exception e) {
                lastException = e;
                log.debug("{} attempt {} on {} failed: {}", method, attempt + 1, endpoint, e.getMessage());
            }
        }
        throw new RpcException(method + " failed after " + maxAttempts + " attempts", lastException);
    }

    private String callRpc(String endpoint, String method, Object params) {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        String json = rpcClient.call(endpoint, method, params).block();
        if (json == null) {
            throw new RpcException("Empty response for " + method + " from " + endpoint);
        }
        return json;
    }
}
