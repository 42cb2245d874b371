package com.rugradar.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = AsyncConfig.class, properties = {
        "rugradar.launch-executor.core-pool-size=3",
        "rugradar.launch-executor.max-pool-size=6",
        "rugradar.launch-executor.queue-capacity=32",
        "rugradar.launch-executor.shutdown-grace-period=5s"
})
class LaunchExecutorConfigTest {

    @Autowired
    @Qualifier(AsyncConfig.LAUNCH_EXECUTOR)
    ThreadPoolTaskExecutor launchExecutor;

    @Autowired
    LaunchExecutorProperties properties;

    @Test
    @DisplayName("launch executor is sized from rugradar.launch-executor")
    void executorSizedFromProperties() {
        assertThat(launchExecutor.getCorePoolSize()).isEqualTo(3);
        assertThat(launchExecutor.getMaxPoolSize()).isEqualTo(6);
        assertThat(launchExecutor.getQueueCapacity()).isEqualTo(32);
        assertThat(launchExecutor.getThreadNamePrefix()).isEqualTo("launch-");
        assertThat(properties.getShutdownGracePeriod().getSeconds()).isEqualTo(5);
    }

    @Test
    void rejectsWhenSaturated() {
        assertThat(launchExecutor.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
    }
}
