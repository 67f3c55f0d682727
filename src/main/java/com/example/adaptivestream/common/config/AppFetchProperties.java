package com.example.adaptivestream.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.fetch")
public class AppFetchProperties {

    /**
     * Max in-flight segment fetches per content handle; further requests queue.
     */
    private int maxConcurrentFetches = 3;

    /**
     * Requests a session may queue behind the in-flight ones.
     */
    private int maxQueuedFetches = 3;

    /**
     * Number of recent completions the bandwidth estimate is smoothed over.
     */
    private int bandwidthSampleWindow = 5;

    private int connectTimeoutMs = 5000;

    private int socketTimeoutMs = 10000;

    /**
     * Worker threads shared by all sessions for segment fetches and content validation.
     */
    private int workerThreadCount = 8;

    private int workerQueueSize = 256;

    private int maxConnectionsTotal = 64;

    private int maxConnectionsPerRoute = 12;
}
