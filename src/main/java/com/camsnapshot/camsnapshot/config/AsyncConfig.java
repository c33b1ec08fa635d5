package com.camsnapshot.camsnapshot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Value("${notification.executor.core-size:2}")
    private int notificationCoreSize;

    @Value("${notification.executor.max-size:4}")
    private int notificationMaxSize;

    @Value("${notification.executor.queue-capacity:500}")
    private int notificationQueueCapacity;

    /**
     * Bounded queue for post-transition side effects. When full, the task is dropped
     * and logged rather than run on the caller's thread.
     */
    @Bean
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(notificationCoreSize);
        executor.setMaxPoolSize(notificationMaxSize);
        executor.setQueueCapacity(notificationQueueCapacity);
        executor.setThreadNamePrefix("camera-notify-");
        executor.setRejectedExecutionHandler((task, pool) ->
                log.warn("Notification queue full ({} queued), dropping task", pool.getQueue().size()));
        executor.initialize();
        return executor;
    }

    // Runs the timed status persistence; callers give up after the liveness timeout
    @Bean(destroyMethod = "shutdown")
    public ExecutorService statusPersistenceExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(8, 8, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1000),
                runnable -> {
                    Thread thread = new Thread(runnable, "camera-status-persist-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }
}
