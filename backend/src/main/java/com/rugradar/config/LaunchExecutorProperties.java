package com.rugradar.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Sizing of the per-launch worker pool and its shutdown grace period.
 */
@ConfigurationProperties(prefix = "rugradar.launch-executor")
@NoArgsConstructor
@Getter
@Setter
public class LaunchExecutorProperties {

    private int corePoolSize = 4;

    private int maxPoolSize = 8;

    /** Matched launches waiting for a worker; beyond this new launches are dropped. */
    private int queueCapacity = 256;

    /** How long shutdown waits for in-flight launches before abandoning them. */
    private Duration shutdownGracePeriod = Duration.ofSeconds(10);
}
