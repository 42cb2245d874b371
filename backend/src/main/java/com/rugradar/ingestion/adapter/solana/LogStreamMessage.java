package com.rugradar.ingestion.adapter.solana;

import com.rugradar.domain.LaunchEvent;

/**
 * One classified WebSocket frame from a logsSubscribe session.
 */
public record LogStreamMessage(Kind kind, LaunchEvent event, String error) {

    public enum Kind {
        /** Reply to logsSubscribe carrying the subscription id. */
        SUBSCRIBED,
        /** logsNotification for a successful transaction. */
        NOTIFICATION,
        /** JSON-RPC error reply. */
        ERROR,
        /** Anything else, including notifications of failed transactions. */
        IGNORED
    }

    static LogStreamMessage subscribed() {
        return new LogStreamMessage(Kind.SUBSCRIBED, null, null);
    }

    static LogStreamMessage notification(LaunchEvent event) {
        return new LogStreamMessage(Kind.NOTIFICATION, event, null);
    }

    static LogStreamMessage error(String error) {
        return new LogStreamMessage(Kind.ERROR, null, error);
    }

    static LogStreamMessage ignored() {
        return new LogStreamMessage(Kind.IGNORED, null, null);
    }
}
