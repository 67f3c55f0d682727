package com.example.adaptivestream.application.job;

import com.example.adaptivestream.application.service.StreamSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SessionMonitorJob {

    private static final Logger log = LoggerFactory.getLogger(SessionMonitorJob.class);

    private final StreamSessionService streamSessionService;

    public SessionMonitorJob(StreamSessionService streamSessionService) {
        this.streamSessionService = streamSessionService;
    }

    @Scheduled(fixedDelayString = "${app.buffer.check-interval-ms:500}")
    public void tick() {
        try {
            streamSessionService.monitorAll();
        } catch (Exception e) {
            log.error("Session monitor tick failed", e);
        }
    }
}
