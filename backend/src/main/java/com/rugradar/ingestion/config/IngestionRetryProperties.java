package com.rugradar.ingestion.config;

import com.rugradar.common.RetryPolicy;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Backoff for HTTP RPC retries and WebSocket reconnects (exponential, ± jitter, capped).
 */
@ConfigurationProperties(prefix = "rugradar.ingestion.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. Default 500. */
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Total attempts per HTTP RPC call, including the first. Reconnects are unbounded. Default 3. */
    private int maxAttempts = 3;

    /** Upper bound for a single backoff delay. Default 30s. */
    private long maxDelayMs = 30_000L;

    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(baseDelayMs, jitterFactor, maxAttempts, maxDelayMs);
    }
}
