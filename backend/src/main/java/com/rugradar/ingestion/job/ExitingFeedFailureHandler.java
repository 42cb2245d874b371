package com.rugradar.ingestion.job;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Closes the application context and exits with status 1. Runs on its own thread so the context can shut
 * down the feed that reported the failure.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ExitingFeedFailureHandler implements FeedFailureHandler {

    static final int EXIT_STATUS = 1;

    private final ApplicationContext applicationContext;

    @Override
    public void onFatalFeedError(Throwable error) {
        log.error("Launch feed failed permanently: {}", error.getMessage(), error);
        Thread exitThread = new Thread(
                () -> System.exit(SpringApplication.exit(applicationContext, () -> EXIT_STATUS)),
                "feed-failure-exit");
        exitThread.start();
    }
}
