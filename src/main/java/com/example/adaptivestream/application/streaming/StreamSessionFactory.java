package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.common.config.AppBufferProperties;
import com.example.adaptivestream.common.config.AppFetchProperties;
import com.example.adaptivestream.common.config.AppQualityProperties;
import com.example.adaptivestream.common.config.AppSessionProperties;
import com.example.adaptivestream.common.util.Clock;
import java.util.concurrent.ExecutorService;
import org.springframework.stereotype.Component;

/**
 * Builds independent sessions. Only the provider registry and the worker pool are shared.
 */
@Component
public class StreamSessionFactory {

    private final ProviderRegistry providerRegistry;
    private final ContentValidator contentValidator;
    private final SegmentTransport segmentTransport;
    private final ExecutorService streamFetchExecutor;
    private final Clock clock;
    private final AppFetchProperties appFetchProperties;
    private final AppBufferProperties appBufferProperties;
    private final AppQualityProperties appQualityProperties;
    private final AppSessionProperties appSessionProperties;

    public StreamSessionFactory(ProviderRegistry providerRegistry,
                                ContentValidator contentValidator,
                                SegmentTransport segmentTransport,
                                ExecutorService streamFetchExecutor,
                                Clock clock,
                                AppFetchProperties appFetchProperties,
                                AppBufferProperties appBufferProperties,
                                AppQualityProperties appQualityProperties,
                                AppSessionProperties appSessionProperties) {
        this.providerRegistry = providerRegistry;
        this.contentValidator = contentValidator;
        this.segmentTransport = segmentTransport;
        this.streamFetchExecutor = streamFetchExecutor;
        this.clock = clock;
        this.appFetchProperties = appFetchProperties;
        this.appBufferProperties = appBufferProperties;
        this.appQualityProperties = appQualityProperties;
        this.appSessionProperties = appSessionProperties;
    }

    public StreamSession create(String sessionId, StreamSessionListener listener) {
        SegmentFetcher fetcher = new SegmentFetcher(
                streamFetchExecutor,
                segmentTransport,
                appFetchProperties.getMaxConcurrentFetches(),
                clock,
                new BandwidthEstimator(appFetchProperties.getBandwidthSampleWindow()),
                new ChunkCache());
        int outstandingLimit = appFetchProperties.getMaxConcurrentFetches()
                + Math.max(0, appFetchProperties.getMaxQueuedFetches());
        return new StreamSession(
                sessionId,
                providerRegistry,
                contentValidator,
                fetcher,
                new BufferTracker(appBufferProperties),
                QualityAdvisor.fromProperties(appQualityProperties),
                listener,
                streamFetchExecutor,
                clock,
                appSessionProperties,
                outstandingLimit);
    }
}
