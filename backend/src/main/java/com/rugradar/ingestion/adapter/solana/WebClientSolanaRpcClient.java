package com.rugradar.ingestion.adapter.solana;

import com.rugradar.ingestion.adapter.RpcException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Solana JSON-RPC 2.0 client over WebClient. Every call is bounded by {@code fetchTimeout}.
 */
public class WebClientSolanaRpcClient implements SolanaRpcClient {

    private final WebClient webClient;
    private final Duration fetchTimeout;
    private final AtomicLong requestIds = new AtomicLong();

    public WebClientSolanaRpcClient(WebClient.Builder builder, Duration fetchTimeout) {
        this.webClient = builder.build();
        this.fetchTimeout = fetchTimeout;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", requestIds.incrementAndGet(),
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(fetchTimeout)
                .onErrorMap(TimeoutException.class,
                        e -> new RpcException(method + " timed out after " + fetchTimeout.toMillis() + " ms", e))
                .onErrorMap(WebClientResponseException.class, e -> new RpcException(e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class, e -> new RpcException(e.getMessage(), e));
    }
}
