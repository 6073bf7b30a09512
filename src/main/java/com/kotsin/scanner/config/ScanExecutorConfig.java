package com.kotsin.scanner.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * ScanExecutorConfig - Thread pool for batch scans.
 *
 * One task per symbol, so symbols scan concurrently while scans for the same
 * symbol stay sequential.
 */
@Configuration
@Slf4j
public class ScanExecutorConfig {

    @Value("${scanner.executor.pool-size:4}")
    private int poolSize;

    @Value("${scanner.executor.queue-capacity:500}")
    private int queueCapacity;

    @Value("${scanner.executor.thread-prefix:scan-}")
    private String threadPrefix;

    /**
     * Uses caller-runs on saturation: a full queue slows the batch down, it
     * never drops a symbol.
     */
    @Bean(name = "scanExecutor")
    public ThreadPoolTaskExecutor scanExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadPrefix);

        executor.setRejectedExecutionHandler(new RejectedExecutionHandler() {
            @Override
            public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                log.warn("[SCAN-EXECUTOR] Queue full, executing in caller thread. activeCount={}, queueSize={}",
                        e.getActiveCount(), e.getQueue().size());
                if (!e.isShutdown()) {
                    r.run();
                }
            }
        });

        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds(60);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("[SCAN-EXECUTOR] Initialized: poolSize={}, queueCapacity={}, threadPrefix={}",
                poolSize, queueCapacity, threadPrefix);
        return executor;
    }
}
