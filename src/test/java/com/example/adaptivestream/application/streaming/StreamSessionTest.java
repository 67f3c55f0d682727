package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.common.config.AppBufferProperties;
import com.example.adaptivestream.common.config.AppProviderProperties;
import com.example.adaptivestream.common.config.AppQualityProperties;
import com.example.adaptivestream.common.config.AppSessionProperties;
import com.example.adaptivestream.domain.model.BufferHealth;
import com.example.adaptivestream.domain.model.ByteRange;
import com.example.adaptivestream.domain.model.ContentMetadata;
import com.example.adaptivestream.domain.model.ErrorKind;
import com.example.adaptivestream.domain.model.QualityTier;
import com.example.adaptivestream.domain.model.SessionError;
import com.example.adaptivestream.domain.model.SessionState;
import com.example.adaptivestream.domain.model.SourceChange;
import com.example.adaptivestream.domain.model.TimeSpan;
import com.example.adaptivestream.support.FakeClock;
import com.example.adaptivestream.support.ManualExecutor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StreamSessionTest {

    private static final String CONTENT = "QmVideo";

    private FakeClock clock;
    private ManualExecutor executor;
    private ProviderRegistry registry;
    private SegmentFetcher fetcher;
    private RecordingListener listener;
    private AtomicInteger validations;
    private Double contentDuration;
    private boolean rejectContent;
    private SegmentTransport transportBehaviour;
    private StreamSession session;

    @BeforeEach
    void setUp() {
        clock = new FakeClock(100_000L);
        executor = new ManualExecutor();
        listener = new RecordingListener();
        validations = new AtomicInteger();
        contentDuration = 60D;
        transportBehaviour = (uri, range, cancellation) -> new byte[(int) range.length()];

        AppProviderProperties providerProperties = new AppProviderProperties();
        providerProperties.setTieJitter(0D);
        providerProperties.setEndpoints(new ArrayList<>(Arrays.asList(
                new AppProviderProperties.Endpoint("alpha", "Alpha", "https://alpha.test/ipfs/{contentId}"),
                new AppProviderProperties.Endpoint("beta", "Beta", "https://beta.test/ipfs/{contentId}"),
                new AppProviderProperties.Endpoint("gamma", "Gamma", "https://gamma.test/ipfs/{contentId}"))));
        registry = new ProviderRegistry(providerProperties, ProviderScoreStore.NONE, clock, new Random(3L));

        SegmentTransport transport = (uri, range, cancellation) -> transportBehaviour.fetch(uri, range, cancellation);
        fetcher = new SegmentFetcher(executor, transport, 3, clock, new BandwidthEstimator(5), new ChunkCache());
        ContentValidator validator = contentId -> {
            validations.incrementAndGet();
            if (rejectContent) {
                throw new ContentValidationException(contentId, "metadata has no playable video");
            }
            return new ContentMetadata(contentId, contentDuration, 0L, false);
        };
        session = new StreamSession("s-1", registry, validator, fetcher,
                new BufferTracker(new AppBufferProperties()),
                QualityAdvisor.fromProperties(new AppQualityProperties()),
                listener, Runnable::run, clock, new AppSessionProperties(), 6);
    }

    @Test
    void shouldMoveFromResolvingToPlayingOnceMinimumBufferArrives() {
        session.load(CONTENT);

        Assertions.assertEquals(SessionState.LOADING, session.getState());
        Assertions.assertEquals("alpha", session.snapshot().getProviderName());
        Assertions.assertEquals(5, fetcher.outstandingCount());
        Assertions.assertEquals(1, listener.sourceChanges.size());
        Assertions.assertEquals("initial", listener.sourceChanges.get(0).getReason());

        executor.runAll();

        Assertions.assertEquals(SessionState.PLAYING, session.getState());
        Assertions.assertEquals(Arrays.asList(SessionState.RESOLVING, SessionState.LOADING, SessionState.PLAYING),
                listener.states);
        Assertions.assertEquals(Collections.singletonList(new TimeSpan(0D, 10D)), session.snapshot().getBufferedRanges());
        Assertions.assertEquals(BufferHealth.HEALTHY, session.snapshot().getHealth());
        Assertions.assertNotNull(session.chunkAt(3D));
    }

    @Test
    void shouldFailWithoutRetryWhenValidationRejectsContent() {
        rejectContent = true;

        session.load(CONTENT);

        Assertions.assertEquals(SessionState.FAILED, session.getState());
        Assertions.assertEquals(1, validations.get());
        Assertions.assertEquals(1, listener.fatalErrors.size());
        Assertions.assertEquals(ErrorKind.VALIDATION, listener.fatalErrors.get(0).getKind());
        Assertions.assertTrue(listener.sourceChanges.isEmpty());
        Assertions.assertEquals(0, fetcher.outstandingCount());
    }

    @Test
    void shouldRecoverFromStallWithExactlyOneProviderSwitch() {
        playFirstTenSeconds();
        session.updatePosition(10D);

        for (int i = 0; i <= 12; i++) {
            session.monitor();
            clock.advance(500L);
        }

        Assertions.assertEquals(SessionState.RECOVERING, session.getState());
        Assertions.assertEquals(1, listener.recoverableErrors.size());
        Assertions.assertEquals(ErrorKind.STALL_TIMEOUT, listener.recoverableErrors.get(0).getKind());

        executor.runAll();

        Assertions.assertEquals(SessionState.PLAYING, session.getState());
        Assertions.assertEquals(1, session.getProviderSwitches());
        Assertions.assertEquals(Arrays.asList(SessionState.BUFFERING, SessionState.RECOVERING, SessionState.PLAYING),
                listener.states.subList(3, listener.states.size()));
        SourceChange last = listener.sourceChanges.get(listener.sourceChanges.size() - 1);
        Assertions.assertEquals("beta", last.getProviderName());
        Assertions.assertEquals("recovery", last.getReason());
        Assertions.assertEquals(1, listener.recoverableErrors.size());
    }

    @Test
    void shouldSwitchAgainWhenRecoveryWindowExpires() {
        playFirstTenSeconds();
        session.updatePosition(10D);
        for (int i = 0; i <= 10; i++) {
            session.monitor();
            clock.advance(500L);
        }
        Assertions.assertEquals("beta", session.snapshot().getProviderName());

        clock.advance(new AppSessionProperties().getRecoveryWindowMs());
        session.monitor();

        Assertions.assertEquals(SessionState.RECOVERING, session.getState());
        Assertions.assertEquals("gamma", session.snapshot().getProviderName());
        Assertions.assertEquals(2, session.getProviderSwitches());
    }

    @Test
    void shouldFailWithProviderExhaustedWhenEveryProviderFails() {
        transportBehaviour = (uri, range, cancellation) -> {
            throw FetchException.forStatus(503, uri.toString());
        };

        session.load(CONTENT);
        executor.runAll();

        Assertions.assertEquals(SessionState.FAILED, session.getState());
        Assertions.assertEquals(2, session.getProviderSwitches());
        Assertions.assertEquals(1, listener.fatalErrors.size());
        Assertions.assertEquals(ErrorKind.PROVIDER_EXHAUSTED, listener.fatalErrors.get(0).getKind());
        Assertions.assertTrue(listener.recoverableErrors.isEmpty());
    }

    @Test
    void shouldFailOverToNextProviderOnTransientError() {
        transportBehaviour = (uri, range, cancellation) -> {
            if ("alpha.test".equals(uri.getHost())) {
                throw FetchException.forStatus(503, uri.toString());
            }
            return new byte[(int) range.length()];
        };

        session.load(CONTENT);
        executor.runAll();

        Assertions.assertEquals(SessionState.PLAYING, session.getState());
        Assertions.assertEquals("beta", session.snapshot().getProviderName());
        Assertions.assertEquals(1, session.getProviderSwitches());
        Assertions.assertEquals("failover", listener.sourceChanges.get(1).getReason());
        Assertions.assertEquals(1, registry.get("alpha").getConsecutiveFailures());
        Assertions.assertTrue(listener.fatalErrors.isEmpty());
    }

    @Test
    void shouldTreatRangeNotSatisfiableAsEndOfContent() {
        contentDuration = null;
        long endOffset = ByteRange.forSpan(new TimeSpan(4D, 6D), 400_000L).getFirst();
        transportBehaviour = (uri, range, cancellation) -> {
            if (range.getFirst() >= endOffset) {
                throw FetchException.forStatus(FetchException.RANGE_NOT_SATISFIABLE, uri.toString());
            }
            return new byte[(int) range.length()];
        };

        session.load(CONTENT);
        executor.runAll();

        Assertions.assertEquals(SessionState.PLAYING, session.getState());
        Assertions.assertEquals(4D, session.snapshot().getContentEndSec(), 1e-9);
        Assertions.assertEquals(0, registry.get("alpha").getConsecutiveFailures());
        Assertions.assertEquals(0, session.getProviderSwitches());
        Assertions.assertEquals(0, fetcher.outstandingCount());
        Assertions.assertEquals(BufferHealth.HEALTHY, session.snapshot().getHealth());
    }

    @Test
    void shouldCancelFetchesBehindSeekTargetAndNeverReportStall() {
        session.load(CONTENT);

        session.seek(30D);

        Assertions.assertTrue(session.snapshot().isSeeking());
        Assertions.assertEquals(BufferHealth.LOW, session.snapshot().getHealth());
        List<TimeSpan> outstanding = fetcher.outstandingSpans();
        Assertions.assertFalse(outstanding.isEmpty());
        for (TimeSpan span : outstanding) {
            Assertions.assertTrue(span.getStart() >= 30D, "stale span " + span);
        }
        session.monitor();
        Assertions.assertNotEquals(BufferHealth.STALLED, session.snapshot().getHealth());
    }

    @Test
    void shouldRejectSeekBeforeLoad() {
        Assertions.assertThrows(IllegalStateException.class, () -> session.seek(5D));
    }

    @Test
    void shouldDeferForcedQualityUntilRecoverySettles() {
        playFirstTenSeconds();
        session.updatePosition(10D);
        for (int i = 0; i <= 10; i++) {
            session.monitor();
            clock.advance(500L);
        }
        Assertions.assertEquals(SessionState.RECOVERING, session.getState());
        QualityTier hd = session.getQualityAdvisor().findTier("720p");

        session.forceQuality(hd);
        Assertions.assertEquals("360p", session.snapshot().getTier().getLabel());

        executor.runAll();

        Assertions.assertEquals(SessionState.PLAYING, session.getState());
        Assertions.assertEquals(hd, session.snapshot().getTier());
        Assertions.assertEquals(hd, listener.qualityChanges.get(listener.qualityChanges.size() - 1));
        Assertions.assertFalse(session.snapshot().isAutoQuality());
    }

    @Test
    void shouldIgnoreCompletionsFromSupersededLoad() {
        session.load("QmFirst");
        session.load(CONTENT);

        executor.runAll();

        Assertions.assertEquals(2, validations.get());
        Assertions.assertEquals(CONTENT, session.snapshot().getContentId());
        Assertions.assertTrue(session.snapshot().getSourceUri().toString().contains(CONTENT));
        Assertions.assertEquals(Collections.singletonList(new TimeSpan(0D, 10D)), session.snapshot().getBufferedRanges());
    }

    @Test
    void shouldDisposeIdempotently() {
        session.load(CONTENT);

        Assertions.assertTrue(session.dispose());
        Assertions.assertFalse(session.dispose());

        Assertions.assertEquals(SessionState.DISPOSED, session.getState());
        Assertions.assertTrue(fetcher.isDisposed());
        Assertions.assertEquals(0, fetcher.outstandingCount());
        Assertions.assertEquals(1, Collections.frequency(listener.states, SessionState.DISPOSED));
        Assertions.assertThrows(IllegalStateException.class, () -> session.load(CONTENT));
        executor.runAll();
        Assertions.assertEquals(SessionState.DISPOSED, session.getState());
    }

    private void playFirstTenSeconds() {
        session.load(CONTENT);
        executor.runAll();
        Assertions.assertEquals(SessionState.PLAYING, session.getState());
    }

    private static final class RecordingListener implements StreamSessionListener {

        private final List<SourceChange> sourceChanges = new ArrayList<>();
        private final List<QualityTier> qualityChanges = new ArrayList<>();
        private final List<BufferHealth> healthChanges = new ArrayList<>();
        private final List<SessionError> recoverableErrors = new ArrayList<>();
        private final List<SessionError> fatalErrors = new ArrayList<>();
        private final List<SessionState> states = new ArrayList<>();

        @Override
        public void onSourceChanged(String sessionId, SourceChange change) {
            sourceChanges.add(change);
        }

        @Override
        public void onQualityChanged(String sessionId, QualityTier tier) {
            qualityChanges.add(tier);
        }

        @Override
        public void onBufferHealth(String sessionId, BufferHealth health) {
            healthChanges.add(health);
        }

        @Override
        public void onRecoverableError(String sessionId, SessionError error) {
            recoverableErrors.add(error);
        }

        @Override
        public void onFatalError(String sessionId, SessionError error) {
            fatalErrors.add(error);
        }

        @Override
        public void onStateChanged(String sessionId, SessionState from, SessionState to) {
            states.add(to);
        }
    }
}
