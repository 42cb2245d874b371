package com.rugradar.ingestion.job;

/**
 * Called when the launch feed terminates with an error it cannot recover from.
 */
@FunctionalInterface
public interface FeedFailureHandler {

    void onFatalFeedError(Throwable error);
}
