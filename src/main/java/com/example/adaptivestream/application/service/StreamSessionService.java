package com.example.adaptivestream.application.service;

import com.example.adaptivestream.api.request.DecodeCostRequest;
import com.example.adaptivestream.api.request.QualityPreferenceRequest;
import com.example.adaptivestream.api.response.BufferedRangeResponse;
import com.example.adaptivestream.api.response.SessionEventResponse;
import com.example.adaptivestream.api.response.SessionStatusResponse;
import com.example.adaptivestream.application.streaming.CompositeSessionListener;
import com.example.adaptivestream.application.streaming.SessionEvent;
import com.example.adaptivestream.application.streaming.SessionEventLog;
import com.example.adaptivestream.application.streaming.SessionSnapshot;
import com.example.adaptivestream.application.streaming.StreamSession;
import com.example.adaptivestream.application.streaming.StreamSessionFactory;
import com.example.adaptivestream.application.streaming.StreamSessionListener;
import com.example.adaptivestream.common.config.AppSessionProperties;
import com.example.adaptivestream.common.exception.BusinessException;
import com.example.adaptivestream.common.util.Clock;
import com.example.adaptivestream.domain.model.BufferHealth;
import com.example.adaptivestream.domain.model.Chunk;
import com.example.adaptivestream.domain.model.DecodeCostSignal;
import com.example.adaptivestream.domain.model.QualityTier;
import com.example.adaptivestream.domain.model.SessionError;
import com.example.adaptivestream.domain.model.SessionState;
import com.example.adaptivestream.domain.model.SourceChange;
import com.example.adaptivestream.domain.model.TimeSpan;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class StreamSessionService {

    private static final Logger log = LoggerFactory.getLogger(StreamSessionService.class);

    private final StreamSessionFactory streamSessionFactory;
    private final AppSessionProperties appSessionProperties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final ConcurrentMap<String, ManagedSession> sessions = new ConcurrentHashMap<>();

    public StreamSessionService(StreamSessionFactory streamSessionFactory,
                                AppSessionProperties appSessionProperties,
                                Clock clock,
                                ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.streamSessionFactory = streamSessionFactory;
        this.appSessionProperties = appSessionProperties;
        this.clock = clock;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public SessionStatusResponse createSession(String contentId) {
        if (sessions.size() >= appSessionProperties.getMaxSessions()) {
            recordCounter("adaptive.session.create.rejected");
            throw new BusinessException("SESSION_LIMIT_REACHED", "Too many active sessions", "Close an idle session and retry");
        }
        String sessionId = UUID.randomUUID().toString().replace("-", "");
        SessionEventLog eventLog = new SessionEventLog(appSessionProperties.getEventLogCapacity(), clock);
        StreamSessionListener listener = new CompositeSessionListener(eventLog, new MetricsListener());
        StreamSession session = streamSessionFactory.create(sessionId, listener);
        sessions.put(sessionId, new ManagedSession(session, eventLog));
        recordCounter("adaptive.session.created");
        log.info("SESSION_CREATED sessionId={} activeSessions={}", sessionId, sessions.size());
        if (StringUtils.hasText(contentId)) {
            return load(sessionId, contentId);
        }
        return toStatus(session.snapshot(), eventLog);
    }

    public SessionStatusResponse load(String sessionId, String contentId) {
        ManagedSession managed = require(sessionId);
        long startedAtNanos = System.nanoTime();
        try {
            managed.session.load(contentId);
            recordCounter("adaptive.session.load");
            return toStatus(managed.session.snapshot(), managed.eventLog);
        } catch (IllegalArgumentException e) {
            throw new BusinessException("400", e.getMessage());
        } catch (IllegalStateException e) {
            throw conflict(e);
        } finally {
            recordDuration("adaptive.session.load.latency", System.nanoTime() - startedAtNanos);
        }
    }

    public SessionStatusResponse seek(String sessionId, double positionSec) {
        ManagedSession managed = require(sessionId);
        try {
            managed.session.seek(positionSec);
            recordCounter("adaptive.session.seek");
            return toStatus(managed.session.snapshot(), managed.eventLog);
        } catch (IllegalStateException e) {
            throw conflict(e);
        }
    }

    public SessionStatusResponse updatePosition(String sessionId, double positionSec) {
        ManagedSession managed = require(sessionId);
        try {
            managed.session.updatePosition(positionSec);
            return toStatus(managed.session.snapshot(), managed.eventLog);
        } catch (IllegalStateException e) {
            throw conflict(e);
        }
    }

    public void reportDecodeCost(String sessionId, DecodeCostRequest request) {
        ManagedSession managed = require(sessionId);
        try {
            managed.session.setDecodeCost(new DecodeCostSignal(
                    request.getComplexity(),
                    request.getMotion(),
                    request.getProcessingTimeMs(),
                    request.getDroppedFrames()));
        } catch (IllegalStateException e) {
            throw conflict(e);
        }
    }

    public SessionStatusResponse updateQuality(String sessionId, QualityPreferenceRequest request) {
        ManagedSession managed = require(sessionId);
        String mode = request.getMode().trim().toLowerCase(Locale.ROOT);
        try {
            if ("auto".equals(mode)) {
                managed.session.setAutoQuality(true);
            } else {
                if (!StringUtils.hasText(request.getTier())) {
                    throw new BusinessException("400", "Tier is required for manual quality", "Pick one of the listed tiers");
                }
                QualityTier tier = managed.session.getQualityAdvisor().findTier(request.getTier());
                managed.session.forceQuality(tier);
            }
            recordCounter("adaptive.session.quality.preference", "mode", mode);
            return toStatus(managed.session.snapshot(), managed.eventLog);
        } catch (IllegalArgumentException e) {
            throw new BusinessException("QUALITY_TIER_UNKNOWN", e.getMessage(), "Pick one of the listed tiers");
        } catch (IllegalStateException e) {
            throw conflict(e);
        }
    }

    public SessionStatusResponse getStatus(String sessionId) {
        ManagedSession managed = require(sessionId);
        return toStatus(managed.session.snapshot(), managed.eventLog);
    }

    public List<SessionEventResponse> listEvents(String sessionId, long afterSequence) {
        ManagedSession managed = require(sessionId);
        List<SessionEventResponse> result = new ArrayList<>();
        for (SessionEvent event : managed.eventLog.since(afterSequence)) {
            result.add(new SessionEventResponse(
                    event.getSequence(), event.getTimestampMs(), event.getType(), event.getAttributes()));
        }
        return result;
    }

    /**
     * Loaded chunk covering the position.
     */
    public Chunk readSegment(String sessionId, double positionSec) {
        ManagedSession managed = require(sessionId);
        Chunk chunk;
        try {
            chunk = managed.session.chunkAt(positionSec);
        } catch (IllegalStateException e) {
            throw conflict(e);
        }
        if (chunk == null) {
            throw new BusinessException("404", "Position is not buffered", "Wait for buffering and retry");
        }
        return chunk;
    }

    public void dispose(String sessionId) {
        ManagedSession managed = sessions.remove(sessionId);
        if (managed == null) {
            throw notFound();
        }
        managed.session.dispose();
        recordCounter("adaptive.session.disposed", "reason", "client");
    }

    /**
     * Advances every session's state machine. One failing session does not stop the others.
     */
    public void monitorAll() {
        for (ManagedSession managed : sessions.values()) {
            try {
                managed.session.monitor();
            } catch (Exception e) {
                log.warn("SESSION_MONITOR_FAILED sessionId={}", managed.session.getSessionId(), e);
            }
        }
    }

    /**
     * Disposes sessions without client activity for the idle TTL, and sessions already
     * disposed elsewhere.
     *
     * @return number of sessions removed
     */
    public int cleanupIdle() {
        long cutoff = clock.nowMs() - TimeUnit.SECONDS.toMillis(appSessionProperties.getIdleTtlSec());
        int removed = 0;
        for (Map.Entry<String, ManagedSession> entry : sessions.entrySet()) {
            StreamSession session = entry.getValue().session;
            boolean idle = session.getLastActivityMs() < cutoff;
            if (!idle && session.getState() != SessionState.DISPOSED) {
                continue;
            }
            if (sessions.remove(entry.getKey(), entry.getValue())) {
                session.dispose();
                removed++;
                recordCounter("adaptive.session.disposed", "reason", "idle");
            }
        }
        if (removed > 0) {
            log.info("SESSION_IDLE_CLEANUP removed={} activeSessions={}", removed, sessions.size());
        }
        return removed;
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    @PreDestroy
    public void disposeAll() {
        for (String sessionId : new ArrayList<>(sessions.keySet())) {
            ManagedSession managed = sessions.remove(sessionId);
            if (managed != null) {
                managed.session.dispose();
            }
        }
    }

    private ManagedSession require(String sessionId) {
        ManagedSession managed = sessionId == null ? null : sessions.get(sessionId);
        if (managed == null) {
            throw notFound();
        }
        return managed;
    }

    private BusinessException notFound() {
        return new BusinessException("404", "Session not found", "Create a new session");
    }

    private BusinessException conflict(IllegalStateException e) {
        return new BusinessException("SESSION_STATE_CONFLICT", e.getMessage(), "Load content or create a new session");
    }

    private SessionStatusResponse toStatus(SessionSnapshot snapshot, SessionEventLog eventLog) {
        List<BufferedRangeResponse> ranges = new ArrayList<>();
        for (TimeSpan span : snapshot.getBufferedRanges()) {
            ranges.add(new BufferedRangeResponse(span.getStart(), span.getEnd()));
        }
        QualityTier tier = snapshot.getTier();
        return new SessionStatusResponse(
                snapshot.getSessionId(),
                snapshot.getState().value(),
                snapshot.getContentId(),
                snapshot.getProviderName(),
                snapshot.getSourceUri() == null ? null : snapshot.getSourceUri().toString(),
                tier == null ? null : tier.getLabel(),
                tier == null ? null : tier.getBitrate(),
                snapshot.isAutoQuality(),
                snapshot.getCursorSec(),
                snapshot.getHealth() == null ? null : snapshot.getHealth().name(),
                snapshot.getBufferAheadSec(),
                ranges,
                snapshot.getBufferedBytes(),
                snapshot.getContentEndSec(),
                Math.round(snapshot.getBandwidthBps()),
                snapshot.getOutstandingFetches(),
                snapshot.getProviderSwitches(),
                snapshot.isSeeking(),
                eventLog.lastSequence());
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("Session metric counter failed, name={}", name, ex);
        }
    }

    private void recordDuration(String name, long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Session metric timer failed, name={}", name, ex);
        }
    }

    private static final class ManagedSession {

        private final StreamSession session;
        private final SessionEventLog eventLog;

        private ManagedSession(StreamSession session, SessionEventLog eventLog) {
            this.session = session;
            this.eventLog = eventLog;
        }
    }

    private final class MetricsListener implements StreamSessionListener {

        @Override
        public void onSourceChanged(String sessionId, SourceChange change) {
            recordCounter("adaptive.session.source.changed",
                    "reason", change.getReason(), "provider", change.getProviderName());
        }

        @Override
        public void onQualityChanged(String sessionId, QualityTier tier) {
            recordCounter("adaptive.session.quality.changed", "tier", tier.getLabel());
        }

        @Override
        public void onBufferHealth(String sessionId, BufferHealth health) {
            recordCounter("adaptive.session.buffer.health", "health", health.name());
        }

        @Override
        public void onRecoverableError(String sessionId, SessionError error) {
            recordCounter("adaptive.session.error", "kind", error.getKind().name(), "severity", "recoverable");
        }

        @Override
        public void onFatalError(String sessionId, SessionError error) {
            recordCounter("adaptive.session.error", "kind", error.getKind().name(), "severity", "fatal");
        }
    }
}
