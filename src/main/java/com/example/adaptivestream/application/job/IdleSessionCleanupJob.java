package com.example.adaptivestream.application.job;

import com.example.adaptivestream.application.service.StreamSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class IdleSessionCleanupJob {

    private static final Logger log = LoggerFactory.getLogger(IdleSessionCleanupJob.class);

    private final StreamSessionService streamSessionService;

    public IdleSessionCleanupJob(StreamSessionService streamSessionService) {
        this.streamSessionService = streamSessionService;
    }

    @Scheduled(fixedDelayString = "${app.session.cleanup-interval-ms:60000}")
    public void cleanup() {
        try {
            int removed = streamSessionService.cleanupIdle();
            log.debug("Idle session cleanup finished, removed={}", removed);
        } catch (Exception e) {
            log.error("Idle session cleanup failed", e);
        }
    }
}
