package com.example.adaptivestream.application.job;

import com.example.adaptivestream.application.streaming.ProviderRegistry;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ProviderScoreFlushJob {

    private static final Logger log = LoggerFactory.getLogger(ProviderScoreFlushJob.class);

    private final ProviderRegistry providerRegistry;

    public ProviderScoreFlushJob(ProviderRegistry providerRegistry) {
        this.providerRegistry = providerRegistry;
    }

    @Scheduled(fixedDelayString = "${app.provider.flush-interval-ms:10000}")
    public void flush() {
        try {
            providerRegistry.flush();
        } catch (Exception e) {
            log.error("Provider score flush failed", e);
        }
    }

    @PreDestroy
    public void flushOnShutdown() {
        flush();
    }
}
