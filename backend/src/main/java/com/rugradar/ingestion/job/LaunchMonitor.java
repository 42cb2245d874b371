package com.rugradar.ingestion.job;

import com.rugradar.config.AsyncConfig;
import com.rugradar.config.LaunchExecutorProperties;
import com.rugradar.domain.ExplorerLinks;
import com.rugradar.domain.LaunchEvent;
import com.rugradar.domain.LaunchOutcome;
import com.rugradar.domain.SolanaPrograms;
import com.rugradar.ingestion.adapter.solana.SolanaLogStream;
import com.rugradar.ingestion.filter.LaunchFilter;
import com.rugradar.ingestion.pipeline.LaunchPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Consumer loop over the Pump.fun log feed. Filters creation events inline on the receiving thread and hands
 * each match to the launch executor; it never waits on a fetch.
 * <p>
 * Shutdown order: dispose the feed subscription (which releases the socket), then let in-flight launches finish
 * within the executor's grace period.
 */
@Component
@Slf4j
public class LaunchMonitor implements SmartLifecycle {

    static final String COMMITMENT = "confirmed";

    private final SolanaLogStream logStream;
    private final LaunchFilter launchFilter;
    private final LaunchPipeline pipeline;
    private final ThreadPoolTaskExecutor launchExecutor;
    private final FeedFailureHandler failureHandler;
    private final long shutdownGraceMs;

    private volatile Disposable subscription;
    private volatile boolean running;

    public LaunchMonitor(SolanaLogStream logStream,
                         LaunchFilter launchFilter,
                         LaunchPipeline pipeline,
                         @Qualifier(AsyncConfig.LAUNCH_EXECUTOR) ThreadPoolTaskExecutor launchExecutor,
                         FeedFailureHandler failureHandler,
                         LaunchExecutorProperties executorProperties) {
        this.logStream = logStream;
        this.launchFilter = launchFilter;
        this.pipeline = pipeline;
        this.launchExecutor = launchExecutor;
        this.failureHandler = failureHandler;
        this.shutdownGraceMs = executorProperties.getShutdownGracePeriod().toMillis();
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        log.info("Listening for new Pump.fun tokens (program {})", SolanaPrograms.PUMP_FUN_PROGRAM);
        subscription = logStream.logsMentioning(SolanaPrograms.PUMP_FUN_PROGRAM, COMMITMENT)
                .subscribe(this::onEvent, this::onFeedError,
                        () -> log.info("Launch feed completed"));
    }

    void onEvent(LaunchEvent event) {
        if (!running || !launchFilter.isLaunchEvent(event.logLines())) {
            return;
        }
        log.info("New Pump.fun launch detected: {}", ExplorerLinks.transactionUrl(event.signature()));
        try {
            launchExecutor.execute(() -> handle(event));
        } catch (TaskRejectedException e) {
            log.warn("Launch executor saturated; dropping {}", event.signature());
        }
    }

    private void handle(LaunchEvent event) {
        LaunchOutcome outcome = pipeline.process(event);
        log.debug("Launch {} finished: {}", outcome.signature(), outcome.status());
    }

    private void onFeedError(Throwable error) {
        if (!running) {
            log.debug("Launch feed ended during shutdown: {}", error.getMessage());
            return;
        }
        running = false;
        failureHandler.onFatalFeedError(error);
    }

    @Override
    public void stop() {
        if (!running && subscription == null) {
            return;
        }
        running = false;
        log.info("Stopping launch monitor");
        Disposable current = subscription;
        subscription = null;
        if (current != null) {
            current.dispose();
        }
        ThreadPoolExecutor pool = launchExecutor.getThreadPoolExecutor();
        pool.shutdown();
        try {
            if (!pool.awaitTermination(shutdownGraceMs, TimeUnit.MILLISECONDS)) {
                log.warn("Abandoning {} in-flight launch(es) after {} ms", pool.getActiveCount() + pool.getQueue().size(),
                        shutdownGraceMs);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
