package com.example.adaptivestream.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private ExecutorService streamFetchExecutor;

    /**
     * Shared by every session for segment fetches and content validation. Per-session
     * concurrency is bounded by the session's fetcher, not by this pool.
     */
    @Bean
    public ExecutorService streamFetchExecutor(AppFetchProperties appFetchProperties) {
        int core = Math.max(1, appFetchProperties.getWorkerThreadCount());
        int max = Math.max(core, core * 2);
        int queueSize = Math.max(16, appFetchProperties.getWorkerQueueSize());
        this.streamFetchExecutor = new ThreadPoolExecutor(
                core,
                max,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueSize),
                new NamedThreadFactory("stream-fetch-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.streamFetchExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (streamFetchExecutor != null) {
            streamFetchExecutor.shutdownNow();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
