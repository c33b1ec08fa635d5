package com.camsnapshot.camsnapshot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class RetentionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // One background thread at minimum priority so sweeps yield to live snapshot traffic
    @Bean(destroyMethod = "shutdown")
    public ExecutorService retentionExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "snapshot-retention");
            thread.setPriority(Thread.MIN_PRIORITY);
            thread.setDaemon(true);
            return thread;
        });
    }
}
