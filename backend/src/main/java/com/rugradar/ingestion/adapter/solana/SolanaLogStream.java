package com.rugradar.ingestion.adapter.solana;

import com.rugradar.domain.LaunchEvent;
import reactor.core.publisher.Flux;

/**
 * Live feed of program log notifications.
 */
public interface SolanaLogStream {

    /**
     * Subscribes to logs of transactions that mention {@code programAddress}.
     * The returned flux is lazy and unbounded; it reconnects on its own after the subscription was established
     * once, and terminates with an error only if the first subscription cannot be established.
     * Cancelling the subscription releases the connection.
     */
    Flux<LaunchEvent> logsMentioning(String programAddress, String commitment);
}
