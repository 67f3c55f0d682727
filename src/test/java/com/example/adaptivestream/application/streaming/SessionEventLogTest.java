package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.domain.model.BufferHealth;
import com.example.adaptivestream.domain.model.ErrorKind;
import com.example.adaptivestream.domain.model.QualityTier;
import com.example.adaptivestream.domain.model.SessionError;
import com.example.adaptivestream.domain.model.SessionState;
import com.example.adaptivestream.support.FakeClock;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SessionEventLogTest {

    @Test
    void shouldKeepNewestEventsWithinCapacity() {
        FakeClock clock = new FakeClock(500L);
        SessionEventLog log = new SessionEventLog(3, clock);

        log.onBufferHealth("s", BufferHealth.STALLED);
        log.onBufferHealth("s", BufferHealth.LOW);
        log.onQualityChanged("s", new QualityTier(800_000L, 480));
        clock.advance(10L);
        log.onStateChanged("s", SessionState.LOADING, SessionState.PLAYING);

        List<SessionEvent> events = log.since(0L);
        Assertions.assertEquals(3, events.size());
        Assertions.assertEquals(2L, events.get(0).getSequence());
        Assertions.assertEquals("stateChanged", events.get(2).getType());
        Assertions.assertEquals("playing", events.get(2).getAttributes().get("to"));
        Assertions.assertEquals(510L, events.get(2).getTimestampMs());
        Assertions.assertEquals(4L, log.lastSequence());
    }

    @Test
    void shouldReturnOnlyEventsAfterSequence() {
        SessionEventLog log = new SessionEventLog(10, new FakeClock(0L));
        log.onRecoverableError("s", SessionError.of(ErrorKind.STALL_TIMEOUT, "stalled", "provider", "alpha"));
        log.onFatalError("s", SessionError.of(ErrorKind.PROVIDER_EXHAUSTED, "gave up"));

        List<SessionEvent> events = log.since(1L);

        Assertions.assertEquals(1, events.size());
        Assertions.assertEquals("fatalError", events.get(0).getType());
        Assertions.assertEquals("PROVIDER_EXHAUSTED", events.get(0).getAttributes().get("kind"));
        Assertions.assertEquals("alpha", log.since(0L).get(0).getAttributes().get("provider"));
    }
}
