package com.example.adaptivestream.application.job;

import com.example.adaptivestream.infrastructure.http.HttpContentValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ValidatedContentPurgeJob {

    private static final Logger log = LoggerFactory.getLogger(ValidatedContentPurgeJob.class);

    private final HttpContentValidator contentValidator;

    public ValidatedContentPurgeJob(HttpContentValidator contentValidator) {
        this.contentValidator = contentValidator;
    }

    @Scheduled(cron = "${app.content.purge-cron:0 15 4 * * ?}")
    public void purge() {
        try {
            int purged = contentValidator.purgeExpired();
            log.info("Validated content purge finished, purged={}", purged);
        } catch (Exception e) {
            log.error("Validated content purge failed", e);
        }
    }
}
