package com.rugradar.ingestion.config;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IngestionRpcPropertiesTest {

    @Test
    void defaults_pointAtPublicMainnet() {
        IngestionRpcProperties props = new IngestionRpcProperties();

        assertThat(props.httpEndpoints()).containsExactly("https://api.mainnet-beta.solana.com");
        assertThat(props.webSocketUri()).isEqualTo(URI.create("wss://api.mainnet-beta.solana.com"));
    }

    @Test
    void webSocketUri_localValidator_usesNextPort() {
        IngestionRpcProperties props = new IngestionRpcProperties();
        props.setUrl("http://localhost:8899");

        assertThat(props.webSocketUri()).isEqualTo(URI.create("ws://localhost:8900"));
    }

    @Test
    void webSocketUri_keepsPathAndQueryWithoutPort() {
        IngestionRpcProperties props = new IngestionRpcProperties();
        props.setUrl("https://mainnet.helius-rpc.com/?api-key=k");

        assertThat(props.webSocketUri()).isEqualTo(URI.create("wss://mainnet.helius-rpc.com/?api-key=k"));
    }

    @Test
    void webSocketUri_explicitOverrideWins() {
        IngestionRpcProperties props = new IngestionRpcProperties();
        props.setUrl("https://mainnet.helius-rpc.com/?api-key=k");
        props.setWsUrl("wss://ws.example.test/solana");

        assertThat(props.webSocketUri()).isEqualTo(URI.create("wss://ws.example.test/solana"));
    }

    @Test
    void httpEndpoints_blankUrlFallsBackToDefault_andDeduplicatesFallbacks() {
        IngestionRpcProperties props = new IngestionRpcProperties();
        props.setUrl(" ");
        props.setFallbackUrls(Arrays.asList("https://b.test", null, "https://api.mainnet-beta.solana.com", "https://b.test"));

        assertThat(props.httpEndpoints()).isEqualTo(List.of("https://api.mainnet-beta.solana.com", "https://b.test"));
    }

    @Test
    void retryProperties_buildPolicy() {
        IngestionRetryProperties retry = new IngestionRetryProperties();
        retry.setBaseDelayMs(100);
        retry.setJitterFactor(0);
        retry.setMaxAttempts(2);

        assertThat(retry.toRetryPolicy().getMaxAttempts()).isEqualTo(2);
        assertThat(retry.toRetryPolicy().delayMs(1)).isEqualTo(200L);
    }
}
