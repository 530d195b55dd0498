package com.jreinhal.querygate.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class QueryPerformanceConfigTest {

    @Test
    @DisplayName("Full pool rejects instead of running on the caller thread")
    void rejectsWhenSaturated() throws Exception {
        ThreadPoolExecutor executor = QueryPerformanceConfig.buildExecutor("test-exec-", 1, 1, 1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            Future<String> running = executor.submit(() -> {
                release.await(5, TimeUnit.SECONDS);
                return Thread.currentThread().getName();
            });
            executor.submit(() -> "queued");

            assertThatThrownBy(() -> executor.submit(() -> "rejected")).isInstanceOf(RejectedExecutionException.class);
            QueryPerformanceConfig.MonitoredRejectionHandler handler =
                    (QueryPerformanceConfig.MonitoredRejectionHandler) executor.getRejectedExecutionHandler();
            assertThat(handler.getRejectionCount()).isEqualTo(1);

            release.countDown();
            assertThat(running.get(5, TimeUnit.SECONDS)).startsWith("test-exec-");
        }
        finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Invalid sizes are raised to workable minimums")
    void clampsSizes() {
        ThreadPoolExecutor executor = QueryPerformanceConfig.buildExecutor("test-exec-", 0, -1, 0);
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(1);
            assertThat(executor.getMaximumPoolSize()).isEqualTo(1);
            assertThat(executor.getQueue().remainingCapacity()).isEqualTo(1);
        }
        finally {
            executor.shutdownNow();
        }
    }
}
