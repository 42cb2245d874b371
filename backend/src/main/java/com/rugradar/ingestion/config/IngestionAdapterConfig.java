package com.rugradar.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rugradar.ingestion.adapter.solana.LogsNotificationParser;
import com.rugradar.ingestion.adapter.solana.SolanaLogStream;
import com.rugradar.ingestion.adapter.solana.SolanaRpcClient;
import com.rugradar.ingestion.adapter.solana.SolanaRpcInvoker;
import com.rugradar.ingestion.adapter.solana.WebClientSolanaRpcClient;
import com.rugradar.ingestion.adapter.solana.WebSocketSolanaLogStream;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.WebsocketClientSpec;

import java.time.Duration;

/**
 * Wires the Solana HTTP RPC client, the rate-limited invoker that rotates over its endpoints, and the PubSub
 * log stream.
 */
@Configuration
@EnableConfigurationProperties({ IngestionRpcProperties.class, IngestionRetryProperties.class })
@Slf4j
public class IngestionAdapterConfig {

    /** PubSub frames with many log lines exceed the 64 KiB default. */
    private static final int MAX_FRAME_PAYLOAD_BYTES = 1024 * 1024;

    @Bean(name = "solanaRpcRateLimiter")
    public RateLimiter solanaRpcRateLimiter(IngestionRpcProperties rpcProperties) {
        int rps = Math.max(1, rpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(rpcProperties.getLocalLimiterTimeout())
                .build();
        return RateLimiter.of("solana-rpc", config);
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder webClientBuilder, IngestionRpcProperties rpcProperties) {
        return new WebClientSolanaRpcClient(webClientBuilder, rpcProperties.getFetchTimeout());
    }

    @Bean
    public SolanaRpcInvoker solanaRpcInvoker(SolanaRpcClient solanaRpcClient,
                                             IngestionRpcProperties rpcProperties,
                                             IngestionRetryProperties retryProperties,
                                             RateLimiter solanaRpcRateLimiter,
                                             ObjectMapper objectMapper) {
        log.info("Solana RPC endpoints: {}", rpcProperties.httpEndpoints());
        return new SolanaRpcInvoker(solanaRpcClient, rpcProperties.httpEndpoints(), retryProperties.toRetryPolicy(),
                solanaRpcRateLimiter, objectMapper);
    }

    @Bean
    public WebSocketClient solanaWebSocketClient() {
        return new ReactorNettyWebSocketClient(HttpClient.create(),
                () -> WebsocketClientSpec.builder().maxFramePayloadLength(MAX_FRAME_PAYLOAD_BYTES));
    }

    @Bean
    public SolanaLogStream solanaLogStream(WebSocketClient solanaWebSocketClient,
                                           LogsNotificationParser parser,
                                           IngestionRpcProperties rpcProperties,
                                           IngestionRetryProperties retryProperties) {
        log.info("Solana PubSub endpoint: {}", rpcProperties.webSocketUri());
        return new WebSocketSolanaLogStream(solanaWebSocketClient, rpcProperties.webSocketUri(), parser,
                retryProperties.toRetryPolicy());
    }
}
