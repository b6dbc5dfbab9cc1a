package com.signalscope.backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class AsyncConfigTest {

    @Autowired
    @Qualifier("timeframeExecutor")
    private Executor timeframeExecutor;

    @Test
    void timeframeExecutorIsBounded() {
        assertThat(timeframeExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) timeframeExecutor;
        int processors = Runtime.getRuntime().availableProcessors();
        assertThat(executor.getCorePoolSize()).isEqualTo(Math.max(3, processors));
        assertThat(executor.getMaxPoolSize()).isEqualTo(Math.max(12, processors * 2));
        assertThat(executor.getThreadNamePrefix()).isEqualTo("timeframe-");
        assertThat(executor.getQueueCapacity()).isEqualTo(300);
    }
}
