package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.common.config.AppSessionProperties;
import com.example.adaptivestream.common.util.Clock;
import com.example.adaptivestream.domain.model.BufferHealth;
import com.example.adaptivestream.domain.model.Chunk;
import com.example.adaptivestream.domain.model.ContentMetadata;
import com.example.adaptivestream.domain.model.DecodeCostSignal;
import com.example.adaptivestream.domain.model.ErrorKind;
import com.example.adaptivestream.domain.model.Provider;
import com.example.adaptivestream.domain.model.QualityTier;
import com.example.adaptivestream.domain.model.SessionError;
import com.example.adaptivestream.domain.model.SessionState;
import com.example.adaptivestream.domain.model.SourceChange;
import com.example.adaptivestream.domain.model.TimeSpan;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates delivery of one content handle: validation, provider selection, buffering,
 * stall recovery and quality switches.
 *
 * <p>All public methods and all fetch/validation completions run under the session monitor,
 * so state transitions and listener notifications are serialized. Completions carry the
 * generation they were issued under; anything from an earlier {@link #load} or from before
 * {@link #dispose} is ignored.
 *
 * <p>A provider switch (failover or stall recovery) is in progress from the moment a new
 * provider is selected until it delivers data. Quality changes recommended or requested during
 * that time are held back and applied once the switch settles.
 */
public class StreamSession {

    private static final Logger log = LoggerFactory.getLogger(StreamSession.class);

    private static final int MAX_SUBMITS_PER_PUMP = 64;

    private final String sessionId;
    private final ProviderRegistry registry;
    private final ContentValidator validator;
    private final SegmentFetcher fetcher;
    private final BufferTracker buffer;
    private final QualityAdvisor advisor;
    private final StreamSessionListener listener;
    private final Executor validationExecutor;
    private final Clock clock;
    private final AppSessionProperties sessionProperties;
    private final int outstandingLimit;

    private SessionState state = SessionState.IDLE;
    private long generation;
    private String contentId;
    private ContentMetadata metadata;
    private String providerName;
    private URI sourceUri;
    private QualityTier tier;
    private double cursorSec;
    private DecodeCostSignal decodeCost;
    private BufferHealth lastHealth;
    private SwitchBudget switchBudget = new SwitchBudget();
    private boolean switchPending;
    private long recoveryDeadlineMs;
    private int providerSwitches;
    private long lastActivityMs;

    public StreamSession(String sessionId,
                         ProviderRegistry registry,
                         ContentValidator validator,
                         SegmentFetcher fetcher,
                         BufferTracker buffer,
                         QualityAdvisor advisor,
                         StreamSessionListener listener,
                         Executor validationExecutor,
                         Clock clock,
                         AppSessionProperties sessionProperties,
                         int outstandingLimit) {
        this.sessionId = sessionId;
        this.registry = registry;
        this.validator = validator;
        this.fetcher = fetcher;
        this.buffer = buffer;
        this.advisor = advisor;
        this.listener = listener;
        this.validationExecutor = validationExecutor;
        this.clock = clock;
        this.sessionProperties = sessionProperties;
        this.outstandingLimit = Math.max(1, outstandingLimit);
        this.lastActivityMs = clock.nowMs();
    }

    /**
     * Starts delivering new content, replacing whatever this session was doing. Validation runs
     * asynchronously; the session stays RESOLVING until it completes.
     */
    public synchronized void load(String newContentId) {
        ensureNotDisposed();
        if (newContentId == null || newContentId.trim().isEmpty()) {
            throw new IllegalArgumentException("contentId is required");
        }
        long now = clock.nowMs();
        generation++;
        fetcher.cancelAll();
        buffer.reset();
        contentId = newContentId.trim();
        metadata = null;
        providerName = null;
        sourceUri = null;
        cursorSec = 0D;
        decodeCost = null;
        lastHealth = null;
        switchBudget = new SwitchBudget();
        switchPending = false;
        recoveryDeadlineMs = 0L;
        providerSwitches = 0;
        lastActivityMs = now;
        tier = advisor.reset(now);
        log.info("SESSION_LOAD sessionId={} contentId={} tier={}", sessionId, contentId, tier.getLabel());
        transition(SessionState.RESOLVING);
        notifyQualityChanged(tier);

        final long loadGeneration = generation;
        final String id = contentId;
        try {
            CompletableFuture.supplyAsync(() -> validator.validate(id), validationExecutor)
                    .whenComplete((result, error) -> onValidated(loadGeneration, result, error));
        } catch (RejectedExecutionException e) {
            log.warn("CONTENT_VALIDATION_REJECTED sessionId={} contentId={}", sessionId, id, e);
            fail(ErrorKind.VALIDATION, "content validation could not be scheduled", "contentId", id);
        }
    }

    public synchronized void seek(double toSeconds) {
        ensureNotDisposed();
        if (state == SessionState.IDLE || state == SessionState.FAILED) {
            throw new IllegalStateException("cannot seek in state " + state.value());
        }
        long now = clock.nowMs();
        lastActivityMs = now;
        double target = Math.max(0D, toSeconds);
        Double end = buffer.getContentEndSec();
        if (end != null) {
            target = Math.min(target, end);
        }
        cursorSec = target;
        if (!state.isStreaming()) {
            return;
        }
        final double newCursor = target;
        int cancelled = fetcher.cancelWhere(request -> !buffer.leadsCursor(request.getSpan(), newCursor));
        if (!buffer.covers(newCursor)) {
            buffer.beginSeek(now);
        }
        log.info("SESSION_SEEK sessionId={} cursorSec={} cancelledFetches={} seeking={}",
                sessionId, newCursor, cancelled, buffer.isSeeking());
        refreshHealth();
        pump();
    }

    /**
     * Playback position reported by the presentation layer.
     */
    public synchronized void updatePosition(double positionSec) {
        ensureNotDisposed();
        lastActivityMs = clock.nowMs();
        cursorSec = Math.max(0D, positionSec);
        if (state.isStreaming()) {
            pump();
        }
    }

    public synchronized void setDecodeCost(DecodeCostSignal signal) {
        ensureNotDisposed();
        lastActivityMs = clock.nowMs();
        this.decodeCost = signal;
    }

    public synchronized void setAutoQuality(boolean enabled) {
        ensureNotDisposed();
        lastActivityMs = clock.nowMs();
        advisor.setAutoQuality(enabled);
        log.info("SESSION_AUTO_QUALITY sessionId={} enabled={}", sessionId, enabled);
    }

    /**
     * Pins a tier. Applied at once unless a provider switch is in progress, in which case it
     * takes effect when the switch settles.
     *
     * @throws IllegalArgumentException if the tier is not in the configured table
     */
    public synchronized void forceQuality(QualityTier requested) {
        ensureNotDisposed();
        long now = clock.nowMs();
        lastActivityMs = now;
        QualityTier pinned = advisor.forceTier(requested, now);
        if (pinned.equals(tier)) {
            return;
        }
        if (providerName == null || !state.isStreaming()) {
            tier = pinned;
            notifyQualityChanged(pinned);
            return;
        }
        if (isSwitchInProgress()) {
            log.info("QUALITY_CHANGE_DEFERRED sessionId={} requested={} provider={}",
                    sessionId, pinned.getLabel(), providerName);
            return;
        }
        applyTier(pinned);
    }

    /**
     * Periodic tick: advances the state machine on buffer level, raises stall recovery,
     * evaluates quality and keeps the fetch pipeline full.
     */
    public synchronized void monitor() {
        if (!state.isStreaming()) {
            return;
        }
        long now = clock.nowMs();
        buffer.updateSeek(cursorSec, now);
        BufferHealth health = refreshHealth();
        boolean stallSignal = buffer.pollStallSignal(cursorSec, now);
        switch (state) {
            case LOADING:
                if (stallSignal) {
                    startRecovery(now);
                } else if (buffer.hasMinimumBuffer(cursorSec)) {
                    transition(SessionState.PLAYING);
                }
                break;
            case PLAYING:
                if (health == BufferHealth.STALLED || !buffer.hasMinimumBuffer(cursorSec)) {
                    transition(SessionState.BUFFERING);
                }
                if (stallSignal) {
                    startRecovery(now);
                }
                break;
            case BUFFERING:
                if (stallSignal) {
                    startRecovery(now);
                } else if (buffer.hasMinimumBuffer(cursorSec)) {
                    transition(SessionState.PLAYING);
                }
                break;
            case RECOVERING:
                if (buffer.hasMinimumBuffer(cursorSec)) {
                    finishRecovery();
                } else if (now >= recoveryDeadlineMs) {
                    log.info("RECOVERY_WINDOW_EXPIRED sessionId={} provider={} switches={}",
                            sessionId, providerName, switchBudget.switches);
                    registry.reportOutcome(providerName, false);
                    switchProvider(now, "recovery", ErrorKind.STALL_TIMEOUT);
                }
                break;
            default:
                break;
        }
        if (!state.isStreaming()) {
            return;
        }
        evaluateQuality(now, lastHealth);
        evictAndPump();
    }

    /**
     * Releases every fetch and buffered chunk. Safe to call in any state, any number of times.
     *
     * @return true if this call disposed the session
     */
    public synchronized boolean dispose() {
        if (state == SessionState.DISPOSED) {
            return false;
        }
        generation++;
        fetcher.dispose();
        buffer.reset();
        transition(SessionState.DISPOSED);
        log.info("SESSION_DISPOSED sessionId={} contentId={}", sessionId, contentId);
        return true;
    }

    /**
     * Loaded chunk covering a playback position, or null if that position is not buffered.
     */
    public synchronized Chunk chunkAt(double positionSec) {
        ensureNotDisposed();
        BufferedSegment segment = buffer.segmentAt(positionSec);
        if (segment == null || segment.getChunkKey() == null) {
            return null;
        }
        return fetcher.cachedChunk(segment.getChunkKey());
    }

    public synchronized SessionSnapshot snapshot() {
        SessionSnapshot snapshot = new SessionSnapshot();
        snapshot.setSessionId(sessionId);
        snapshot.setState(state);
        snapshot.setContentId(contentId);
        snapshot.setProviderName(providerName);
        snapshot.setSourceUri(sourceUri);
        snapshot.setTier(tier);
        snapshot.setAutoQuality(advisor.isAutoEnabled());
        snapshot.setCursorSec(cursorSec);
        snapshot.setHealth(lastHealth);
        snapshot.setBufferAheadSec(buffer.bufferAhead(cursorSec));
        snapshot.setBufferedRanges(buffer.ranges());
        snapshot.setBufferedBytes(buffer.totalBytes());
        snapshot.setContentEndSec(buffer.getContentEndSec());
        snapshot.setBandwidthBps(fetcher.getBandwidthEstimator().estimateBps());
        snapshot.setOutstandingFetches(fetcher.outstandingCount());
        snapshot.setProviderSwitches(providerSwitches);
        snapshot.setSeeking(buffer.isSeeking());
        snapshot.setLastActivityMs(lastActivityMs);
        return snapshot;
    }

    public String getSessionId() {
        return sessionId;
    }

    public synchronized SessionState getState() {
        return state;
    }

    public synchronized long getLastActivityMs() {
        return lastActivityMs;
    }

    public synchronized int getProviderSwitches() {
        return providerSwitches;
    }

    public synchronized ContentMetadata getMetadata() {
        return metadata;
    }

    public QualityAdvisor getQualityAdvisor() {
        return advisor;
    }

    private synchronized void onValidated(long loadGeneration, ContentMetadata result, Throwable error) {
        if (loadGeneration != generation || state != SessionState.RESOLVING) {
            return;
        }
        if (error != null) {
            Throwable cause = unwrap(error);
            String reason = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
            log.warn("CONTENT_VALIDATION_FAILED sessionId={} contentId={} reason={}", sessionId, contentId, reason);
            fail(ErrorKind.VALIDATION, reason, "contentId", contentId);
            return;
        }
        metadata = result;
        buffer.setContentDuration(result == null ? null : result.getDurationSec());
        List<Provider> ranked = registry.rank(Collections.<String>emptySet());
        if (ranked.isEmpty()) {
            fail(ErrorKind.PROVIDER_EXHAUSTED, "no provider available", "contentId", contentId);
            return;
        }
        selectProvider(ranked.get(0), "initial");
        transition(SessionState.LOADING);
        refreshHealth();
        pump();
    }

    private synchronized void onChunkComplete(long fetchGeneration, String fetchedFrom, SegmentRequest request,
                                              Chunk chunk, Throwable error) {
        if (fetchGeneration != generation || !state.isStreaming()) {
            return;
        }
        if (error == null) {
            onChunkLoaded(fetchedFrom, request, chunk);
            return;
        }
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException) {
            return;
        }
        FetchException failure = cause instanceof FetchException
                ? (FetchException) cause
                : FetchException.transientFailure(String.valueOf(cause.getMessage()), cause);
        onFetchFailed(fetchedFrom, request, failure);
    }

    private void onChunkLoaded(String fetchedFrom, SegmentRequest request, Chunk chunk) {
        registry.reportOutcome(fetchedFrom, true);
        if (fetchedFrom.equals(providerName)) {
            switchPending = false;
            if (state != SessionState.RECOVERING) {
                switchBudget = new SwitchBudget();
            }
        }
        buffer.observe(cursorSec, new BufferedSegment(request.getSpan(), chunk.getSize(), chunk.getKey()));
        refreshHealth();
        if ((state == SessionState.LOADING || state == SessionState.BUFFERING) && buffer.hasMinimumBuffer(cursorSec)) {
            transition(SessionState.PLAYING);
        } else if (state == SessionState.RECOVERING && buffer.hasMinimumBuffer(cursorSec)) {
            finishRecovery();
        }
        evictAndPump();
    }

    private void onFetchFailed(String fetchedFrom, SegmentRequest request, FetchException failure) {
        if (failure.isRangeNotSatisfiable()) {
            final double endSec = request.getSpan().getStart();
            buffer.markContentEnd(endSec);
            fetcher.cancelWhere(r -> r.getSpan().getStart() >= endSec - TimeSpan.EPSILON);
            log.info("CONTENT_END_DETECTED sessionId={} contentId={} endSec={}", sessionId, contentId, endSec);
            refreshHealth();
            return;
        }
        registry.reportOutcome(fetchedFrom, false);
        log.warn("SEGMENT_FETCH_FAILED sessionId={} provider={} kind={} status={} span={} reason={}",
                sessionId, fetchedFrom, failure.getKind(), failure.getStatusCode(), request.getSpan(),
                failure.getMessage());
        if (!fetchedFrom.equals(providerName)) {
            pump();
            return;
        }
        ErrorKind kind = failure.isTransient() ? ErrorKind.FETCH_TRANSIENT : ErrorKind.FETCH_FATAL;
        String reason = state == SessionState.RECOVERING ? "recovery" : "failover";
        if (switchProvider(clock.nowMs(), reason, kind)) {
            pump();
        }
    }

    private void startRecovery(long now) {
        String stalledProvider = providerName;
        log.warn("STALL_DETECTED sessionId={} provider={} cursorSec={}", sessionId, stalledProvider, cursorSec);
        notifyRecoverableError(SessionError.of(ErrorKind.STALL_TIMEOUT, "no data at playback position",
                "provider", stalledProvider, "cursorSec", String.valueOf(cursorSec)));
        registry.reportOutcome(stalledProvider, false);
        switchBudget = new SwitchBudget();
        transition(SessionState.RECOVERING);
        switchProvider(now, "recovery", ErrorKind.STALL_TIMEOUT);
    }

    private void finishRecovery() {
        switchPending = false;
        recoveryDeadlineMs = 0L;
        log.info("RECOVERY_SUCCEEDED sessionId={} provider={} switches={}",
                sessionId, providerName, switchBudget.switches);
        transition(SessionState.PLAYING);
        QualityTier wanted = advisor.getActiveTier();
        if (!wanted.equals(tier)) {
            applyTier(wanted);
        }
    }

    /**
     * Moves to the best provider not yet tried in the current budget window.
     *
     * @return false when the budget is exhausted and the session failed
     */
    private boolean switchProvider(long now, String reason, ErrorKind cause) {
        if (providerName != null) {
            switchBudget.tried.add(providerName);
        }
        switchBudget.switches++;
        if (switchBudget.switches > sessionProperties.getMaxProviderRetries()) {
            fail(ErrorKind.PROVIDER_EXHAUSTED, "provider retry budget exhausted",
                    "switches", String.valueOf(switchBudget.switches - 1), "cause", cause.name(),
                    "tried", String.join(",", switchBudget.tried));
            return false;
        }
        List<Provider> ranked = registry.rank(switchBudget.tried);
        if (ranked.isEmpty()) {
            fail(ErrorKind.PROVIDER_EXHAUSTED, "no untried provider left",
                    "cause", cause.name(), "tried", String.join(",", switchBudget.tried));
            return false;
        }
        fetcher.cancelAll();
        providerSwitches++;
        switchPending = true;
        selectProvider(ranked.get(0), reason);
        if (state == SessionState.RECOVERING) {
            recoveryDeadlineMs = now + sessionProperties.getRecoveryWindowMs();
        }
        return true;
    }

    private void selectProvider(Provider provider, String reason) {
        String previous = providerName;
        providerName = provider.getName();
        sourceUri = provider.resolveUri(contentId, tier);
        log.info("SOURCE_SELECTED sessionId={} from={} to={} reason={} tier={} cursorSec={}",
                sessionId, previous, providerName, reason, tier.getLabel(), cursorSec);
        notifySourceChanged(new SourceChange(providerName, sourceUri, tier, cursorSec, reason));
    }

    private void evaluateQuality(long now, BufferHealth health) {
        if (isSwitchInProgress() || health == null) {
            return;
        }
        QualityTier recommended = advisor.recommend(
                fetcher.getBandwidthEstimator().estimateBps(), health, decodeCost, now);
        if (!recommended.equals(tier)) {
            applyTier(recommended);
        }
    }

    private void applyTier(QualityTier next) {
        QualityTier previous = tier;
        tier = next;
        log.info("QUALITY_CHANGED sessionId={} from={} to={}", sessionId,
                previous == null ? null : previous.getLabel(), next.getLabel());
        notifyQualityChanged(next);
        if (providerName == null) {
            return;
        }
        fetcher.cancelAll();
        sourceUri = registry.get(providerName).resolveUri(contentId, tier);
        notifySourceChanged(new SourceChange(providerName, sourceUri, tier, cursorSec, "quality"));
        pump();
    }

    private void evictAndPump() {
        for (BufferedSegment evicted : buffer.evict(cursorSec)) {
            if (evicted.getChunkKey() != null) {
                fetcher.release(evicted.getChunkKey());
            }
        }
        pump();
    }

    /**
     * Submits fetches until the buffer tracker has nothing more to ask for.
     */
    private void pump() {
        int submitted = 0;
        while (state.isStreaming() && providerName != null && !fetcher.isDisposed()
                && submitted < MAX_SUBMITS_PER_PUMP) {
            Optional<TimeSpan> next = buffer.needsFetch(cursorSec, fetcher.outstandingSpans(), outstandingLimit);
            if (!next.isPresent()) {
                return;
            }
            boolean urgent = !buffer.hasMinimumBuffer(cursorSec);
            SegmentRequest request = new SegmentRequest(contentId, tier, next.get(), urgent);
            final long fetchGeneration = generation;
            final String target = providerName;
            CompletableFuture<Chunk> future = fetcher.submit(request, target, sourceUri);
            submitted++;
            if (future.isCancelled()) {
                return;
            }
            future.whenComplete((chunk, error) -> onChunkComplete(fetchGeneration, target, request, chunk, error));
        }
    }

    private boolean isSwitchInProgress() {
        return state == SessionState.RECOVERING || switchPending;
    }

    private BufferHealth refreshHealth() {
        BufferHealth health = buffer.health(cursorSec);
        if (health != lastHealth) {
            lastHealth = health;
            try {
                listener.onBufferHealth(sessionId, health);
            } catch (RuntimeException e) {
                log.warn("SESSION_LISTENER_FAILED sessionId={} event=bufferHealth", sessionId, e);
            }
        }
        return health;
    }

    private void fail(ErrorKind kind, String message, String... context) {
        fetcher.cancelAll();
        transition(SessionState.FAILED);
        SessionError error = SessionError.of(kind, message, context);
        log.warn("SESSION_FAILED sessionId={} contentId={} kind={} message={} context={}",
                sessionId, contentId, kind, message, error.getContext());
        try {
            listener.onFatalError(sessionId, error);
        } catch (RuntimeException e) {
            log.warn("SESSION_LISTENER_FAILED sessionId={} event=fatalError", sessionId, e);
        }
    }

    private void transition(SessionState next) {
        SessionState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        log.info("SESSION_STATE_TRANSITION sessionId={} from={} to={}", sessionId, previous.value(), next.value());
        try {
            listener.onStateChanged(sessionId, previous, next);
        } catch (RuntimeException e) {
            log.warn("SESSION_LISTENER_FAILED sessionId={} event=stateChanged", sessionId, e);
        }
    }

    private void notifySourceChanged(SourceChange change) {
        try {
            listener.onSourceChanged(sessionId, change);
        } catch (RuntimeException e) {
            log.warn("SESSION_LISTENER_FAILED sessionId={} event=sourceChanged", sessionId, e);
        }
    }

    private void notifyQualityChanged(QualityTier next) {
        try {
            listener.onQualityChanged(sessionId, next);
        } catch (RuntimeException e) {
            log.warn("SESSION_LISTENER_FAILED sessionId={} event=qualityChanged", sessionId, e);
        }
    }

    private void notifyRecoverableError(SessionError error) {
        try {
            listener.onRecoverableError(sessionId, error);
        } catch (RuntimeException e) {
            log.warn("SESSION_LISTENER_FAILED sessionId={} event=recoverableError", sessionId, e);
        }
    }

    private void ensureNotDisposed() {
        if (state == SessionState.DISPOSED) {
            throw new IllegalStateException("session " + sessionId + " is disposed");
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static final class SwitchBudget {

        private final Set<String> tried = new LinkedHashSet<>();
        private int switches;
    }
}
