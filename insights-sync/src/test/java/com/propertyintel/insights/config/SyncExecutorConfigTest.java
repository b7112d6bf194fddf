package com.propertyintel.insights.config;

import com.propertyintel.insights.Fixtures;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SyncExecutorConfigTest {

    @Test
    void poolIsSizedFromConfigAndQueuesEveryAccount() throws Exception {
        InsightsSyncProperties properties = Fixtures.properties();
        properties.getSync().setAccountParallelism(2);
        ThreadPoolTaskExecutor executor = new SyncExecutorConfig().syncExecutor(properties);
        executor.initialize();
        CountDownLatch release = new CountDownLatch(1);
        try {
            for (int i = 0; i < 300; i++) {
                executor.execute(() -> {
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }

            assertThat(executor.getThreadPoolExecutor().getMaximumPoolSize()).isEqualTo(2);
            assertThat(executor.getThreadPoolExecutor().getQueue()).hasSize(298);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }
}
