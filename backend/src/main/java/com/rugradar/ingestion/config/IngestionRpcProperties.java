package com.rugradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Solana RPC endpoints and per-call limits. {@code url} is the one user-facing override (env {@code SOLANA_RPC}).
 */
@ConfigurationProperties(prefix = "rugradar.ingestion.rpc")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRpcProperties {

    public static final String DEFAULT_URL = "https://api.mainnet-beta.solana.com";

    /** Primary HTTP JSON-RPC endpoint. */
    private String url = DEFAULT_URL;

    /** Extra HTTP endpoints rotated with {@code url} on retries. Optional. */
    private List<String> fallbackUrls = new ArrayList<>();

    /** PubSub WebSocket endpoint; derived from {@code url} when blank (see {@link #webSocketUri()}). */
    private String wsUrl;

    /** Upper bound for a single HTTP RPC call. */
    private Duration fetchTimeout = Duration.ofSeconds(5);

    /** Local RPC budget (requests per second) shared by all launch workers. */
    private int maxRequestsPerSecond = 10;

    /** How long a worker may wait for a limiter permit before failing the call. */
    private Duration localLimiterTimeout = Duration.ofSeconds(2);

    public void setFallbackUrls(List<String> fallbackUrls) {
        this.fallbackUrls = fallbackUrls != null ? fallbackUrls : new ArrayList<>();
    }

    /**
     * {@code url} first, then non-blank fallbacks, without duplicates.
     */
    public List<String> httpEndpoints() {
        List<String> endpoints = new ArrayList<>();
        endpoints.add(url == null || url.isBlank() ? DEFAULT_URL : url.strip());
        for (String fallback : fallbackUrls) {
            if (fallback != null && !fallback.isBlank() && !endpoints.contains(fallback.strip())) {
                endpoints.add(fallback.strip());
            }
        }
        return endpoints;
    }

    /**
     * Explicit {@code wsUrl}, or the primary HTTP URL with its scheme switched to ws/wss. An explicit port is
     * bumped by one, the way a local {@code solana-test-validator} serves PubSub next to RPC (8899 -> 8900).
     * Hosted providers that put PubSub on another host or path need {@code ws-url} set explicitly.
     */
    public URI webSocketUri() {
        if (wsUrl != null && !wsUrl.isBlank()) {
            return URI.create(wsUrl.strip());
        }
        URI http = URI.create(httpEndpoints().get(0));
        String scheme = http.getScheme();
        if (!"https".equalsIgnoreCase(scheme) && !"http".equalsIgnoreCase(scheme)) {
            return http;
        }
        String authority = http.getRawAuthority();
        if (http.getPort() != -1) {
            authority = authority.substring(0, authority.lastIndexOf(':') + 1) + (http.getPort() + 1);
        }
        StringBuilder ws = new StringBuilder("https".equalsIgnoreCase(scheme) ? "wss" : "ws")
                .append("://").append(authority);
        if (http.getRawPath() != null) {
            ws.append(http.getRawPath());
        }
        if (http.getRawQuery() != null) {
            ws.append('?').append(http.getRawQuery());
        }
        return URI.create(ws.toString());
    }
}
