package com.camsnapshot.camsnapshot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Two disjoint HTTP clients for the SeaweedFS filer: one for uploads, one for downloads
 * and listings. Each owns its connection pool and worker threads, so a burst of reads
 * cannot hold up snapshot writes and the other way round.
 */
@Configuration
public class SeaweedFsConfig {

    private static final Logger log = LoggerFactory.getLogger(SeaweedFsConfig.class);

    @Value("${snapshot.seaweedfs.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Value("${snapshot.seaweedfs.read-timeout-ms:15000}")
    private long readTimeoutMs;

    @Value("${snapshot.seaweedfs.upload-threads:10}")
    private int uploadThreads;

    @Value("${snapshot.seaweedfs.download-threads:20}")
    private int downloadThreads;

    @Bean(destroyMethod = "shutdown")
    public ExecutorService seaweedfsUploadPool() {
        return Executors.newFixedThreadPool(uploadThreads, namedThreads("seaweedfs-upload-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService seaweedfsDownloadPool() {
        return Executors.newFixedThreadPool(downloadThreads, namedThreads("seaweedfs-download-"));
    }

    @Bean
    public RestTemplate seaweedfsUploadRestTemplate() {
        log.info("SeaweedFS upload pool: {} threads, connect {} ms, read {} ms",
                uploadThreads, connectTimeoutMs, readTimeoutMs);
        return restTemplate(seaweedfsUploadPool());
    }

    @Bean
    public RestTemplate seaweedfsDownloadRestTemplate() {
        log.info("SeaweedFS download pool: {} threads, connect {} ms, read {} ms",
                downloadThreads, connectTimeoutMs, readTimeoutMs);
        return restTemplate(seaweedfsDownloadPool());
    }

    private RestTemplate restTemplate(ExecutorService pool) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .executor(pool)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(Duration.ofMillis(readTimeoutMs));
        return new RestTemplate(factory);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
