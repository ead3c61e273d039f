package com.example.slides.config;

import com.example.slides.dedup.DifferenceHashFingerprintEngine;
import com.example.slides.dedup.FingerprintEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class SlideExtractionConfig {

    private static final Logger log = LoggerFactory.getLogger(SlideExtractionConfig.class);

    @Bean
    public FingerprintEngine fingerprintEngine(SlideExtractionProperties properties) {
        int hashSize = properties.getDedup().getHashSize();
        log.info("Initializing difference-hash fingerprint engine ({}x{} grid, {} bits)",
                hashSize, hashSize, hashSize * hashSize);
        return new DifferenceHashFingerprintEngine(hashSize);
    }

    /**
     * Pool that fingerprints frames ahead of the sequential dedup decision loop.
     */
    @Bean(name = "fingerprintExecutor")
    public Executor fingerprintExecutor(SlideExtractionProperties properties) {
        int threads = Math.max(1, properties.getDedup().getParallelism());
        log.info("Initializing fingerprint executor with {} thread(s)", threads);
        return createPlatformThreadPool("fingerprint-", threads, threads);
    }

    /**
     * Runs whole extraction jobs (FFmpeg pass plus dedup pass) off the request thread.
     */
    @Bean(name = "extractionExecutor")
    public Executor extractionExecutor(SlideExtractionProperties properties) {
        int threads = Math.max(1, properties.getJobs().getThreads());
        log.info("Initializing extraction executor with {} thread(s)", threads);
        return createPlatformThreadPool("extract-", threads, threads);
    }

    private ThreadPoolTaskExecutor createPlatformThreadPool(String prefix, int coreSize, int maxSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
