package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.common.config.AppBufferProperties;
import com.example.adaptivestream.domain.model.BufferHealth;
import com.example.adaptivestream.domain.model.TimeSpan;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BufferTrackerTest {

    private AppBufferProperties properties;
    private BufferTracker tracker;

    @BeforeEach
    void setUp() {
        properties = new AppBufferProperties();
        tracker = new BufferTracker(properties);
    }

    @Test
    void shouldMergeAdjacentRangesRegardlessOfOrder() {
        BufferTracker forward = new BufferTracker(properties);
        forward.observe(0D, BufferedSegment.of(0D, 5D));
        forward.observe(0D, BufferedSegment.of(5D, 10D));

        BufferTracker backward = new BufferTracker(properties);
        backward.observe(0D, BufferedSegment.of(5D, 10D));
        backward.observe(0D, BufferedSegment.of(0D, 5D));

        List<TimeSpan> expected = Collections.singletonList(new TimeSpan(0D, 10D));
        Assertions.assertEquals(expected, forward.ranges());
        Assertions.assertEquals(expected, backward.ranges());
    }

    @Test
    void shouldKeepLongerSegmentWhenStartsCollideRegardlessOfOrder() {
        BufferTracker longFirst = new BufferTracker(properties);
        longFirst.observe(0D, new BufferedSegment(new TimeSpan(0D, 10D), 500L, null));
        longFirst.observe(0D, new BufferedSegment(new TimeSpan(0D, 5D), 200L, null));

        BufferTracker shortFirst = new BufferTracker(properties);
        shortFirst.observe(0D, new BufferedSegment(new TimeSpan(0D, 5D), 200L, null));
        shortFirst.observe(0D, new BufferedSegment(new TimeSpan(0D, 10D), 500L, null));

        List<TimeSpan> expected = Collections.singletonList(new TimeSpan(0D, 10D));
        Assertions.assertEquals(expected, longFirst.ranges());
        Assertions.assertEquals(expected, shortFirst.ranges());
        Assertions.assertEquals(500L, longFirst.totalBytes());
        Assertions.assertEquals(500L, shortFirst.totalBytes());
    }

    @Test
    void shouldCoalesceOverlappingSegmentsRegardlessOfOrder() {
        List<BufferedSegment> observed = Arrays.asList(
                BufferedSegment.of(0D, 4D), BufferedSegment.of(3D, 8D), BufferedSegment.of(7D, 9D));
        BufferTracker forward = new BufferTracker(properties);
        forward.observe(0D, observed);

        List<BufferedSegment> reversed = new ArrayList<>(observed);
        Collections.reverse(reversed);
        BufferTracker backward = new BufferTracker(properties);
        for (BufferedSegment segment : reversed) {
            backward.observe(0D, segment);
        }

        List<TimeSpan> expected = Collections.singletonList(new TimeSpan(0D, 9D));
        Assertions.assertEquals(expected, forward.ranges());
        Assertions.assertEquals(expected, backward.ranges());
    }

    @Test
    void shouldIgnoreRepeatedObservations() {
        tracker.observe(0D, Arrays.asList(BufferedSegment.of(0D, 2D), BufferedSegment.of(4D, 6D)));
        tracker.observe(0D, Arrays.asList(BufferedSegment.of(4D, 6D), BufferedSegment.of(0D, 2D)));

        Assertions.assertEquals(Arrays.asList(new TimeSpan(0D, 2D), new TimeSpan(4D, 6D)), tracker.ranges());
    }

    @Test
    void shouldClassifyHealthFromBufferAhead() {
        tracker.observe(0D, BufferedSegment.of(0D, 12D));

        Assertions.assertEquals(BufferHealth.HEALTHY, tracker.health(0D));
        Assertions.assertEquals(BufferHealth.LOW, tracker.health(5D));
        Assertions.assertEquals(7D, tracker.bufferAhead(5D), 1e-9);
        Assertions.assertEquals(BufferHealth.STALLED, tracker.health(13D));
        Assertions.assertEquals(0D, tracker.bufferAhead(13D), 0D);
    }

    @Test
    void shouldTreatBufferReachingContentEndAsHealthy() {
        tracker.setContentDuration(12D);
        tracker.observe(5D, BufferedSegment.of(4D, 12D));

        Assertions.assertEquals(BufferHealth.HEALTHY, tracker.health(5D));
        Assertions.assertTrue(tracker.hasMinimumBuffer(11.5D));
        Assertions.assertEquals(BufferHealth.HEALTHY, tracker.health(12D));
    }

    @Test
    void shouldNeverReportStalledDuringActiveSeek() {
        tracker.beginSeek(0L);
        Assertions.assertEquals(BufferHealth.LOW, tracker.health(30D));

        tracker.observe(30D, BufferedSegment.of(0D, 4D));
        Assertions.assertNotEquals(BufferHealth.STALLED, tracker.health(30D));
        Assertions.assertFalse(tracker.pollStallSignal(30D, 60_000L));
    }

    @Test
    void shouldEndSeekWhenCursorIsCovered() {
        tracker.beginSeek(0L);
        tracker.observe(30D, BufferedSegment.of(30D, 32D));

        Assertions.assertFalse(tracker.isSeeking());
    }

    @Test
    void shouldEndSeekAfterGracePeriod() {
        tracker.beginSeek(0L);
        tracker.updateSeek(30D, properties.getStallTimeoutMs() - 1);
        Assertions.assertTrue(tracker.isSeeking());

        tracker.updateSeek(30D, properties.getStallTimeoutMs());
        Assertions.assertFalse(tracker.isSeeking());
        Assertions.assertEquals(BufferHealth.STALLED, tracker.health(30D));
    }

    @Test
    void shouldSignalStallExactlyOncePerEpisode() {
        int signals = 0;
        for (long now = 0L; now <= 3 * properties.getStallTimeoutMs(); now += 250L) {
            if (tracker.pollStallSignal(0D, now)) {
                signals++;
                Assertions.assertEquals(properties.getStallTimeoutMs(), now);
            }
        }
        Assertions.assertEquals(1, signals);
    }

    @Test
    void shouldStartNewStallEpisodeAfterRecovery() {
        Assertions.assertFalse(tracker.pollStallSignal(0D, 0L));
        Assertions.assertTrue(tracker.pollStallSignal(0D, 5_000L));

        tracker.observe(0D, BufferedSegment.of(0D, 2D));
        Assertions.assertFalse(tracker.pollStallSignal(0D, 6_000L));

        Assertions.assertFalse(tracker.pollStallSignal(2D, 7_000L));
        Assertions.assertTrue(tracker.pollStallSignal(2D, 12_000L));
    }

    @Test
    void shouldRequestNextAlignedSpanAfterBufferEdge() {
        Optional<TimeSpan> first = tracker.needsFetch(0D, Collections.<TimeSpan>emptyList(), 6);
        Assertions.assertEquals(new TimeSpan(0D, 2D), first.get());

        tracker.observe(0D, BufferedSegment.of(0D, 4D));
        Optional<TimeSpan> next = tracker.needsFetch(0D, Collections.singletonList(new TimeSpan(4D, 6D)), 6);
        Assertions.assertEquals(new TimeSpan(6D, 8D), next.get());

        BufferTracker unaligned = new BufferTracker(properties);
        unaligned.observe(0D, BufferedSegment.of(0D, 3D));
        Assertions.assertEquals(new TimeSpan(3D, 4D),
                unaligned.needsFetch(0D, Collections.<TimeSpan>emptyList(), 6).get());
    }

    @Test
    void shouldStopRequestingAtOptimalBufferOrBudget() {
        tracker.observe(0D, BufferedSegment.of(0D, 10D));
        Assertions.assertFalse(tracker.needsFetch(0D, Collections.<TimeSpan>emptyList(), 6).isPresent());

        List<TimeSpan> outstanding = Arrays.asList(new TimeSpan(10D, 12D), new TimeSpan(12D, 14D));
        Assertions.assertFalse(tracker.needsFetch(5D, outstanding, 2).isPresent());
        Assertions.assertTrue(tracker.needsFetch(5D, outstanding, 3).isPresent());
    }

    @Test
    void shouldCapRequestsAtContentEnd() {
        tracker.setContentDuration(5D);
        tracker.observe(0D, BufferedSegment.of(0D, 4D));
        Assertions.assertEquals(new TimeSpan(4D, 5D),
                tracker.needsFetch(0D, Collections.<TimeSpan>emptyList(), 6).get());

        tracker.observe(0D, BufferedSegment.of(4D, 5D));
        Assertions.assertFalse(tracker.needsFetch(0D, Collections.<TimeSpan>emptyList(), 6).isPresent());
    }

    @Test
    void shouldEvictOldestSegmentsBehindRetentionWindowOnlyOverBudget() {
        properties.setMaxBufferBytes(100L);
        List<BufferedSegment> segments = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            segments.add(new BufferedSegment(new TimeSpan(i * 2D, i * 2D + 2D), 40L, null));
        }
        segments.add(new BufferedSegment(new TimeSpan(40D, 42D), 40L, null));
        tracker.observe(40D, segments);

        List<BufferedSegment> evicted = tracker.evict(40D);

        Assertions.assertEquals(5, evicted.size());
        Assertions.assertEquals(0D, evicted.get(0).getSpan().getStart(), 0D);
        Assertions.assertEquals(8D, evicted.get(4).getSpan().getStart(), 0D);
        Assertions.assertEquals(240L, tracker.totalBytes());
        Assertions.assertTrue(tracker.covers(40D));
    }

    @Test
    void shouldNotEvictUnderBudgetOrSegmentUnderCursor() {
        tracker.observe(40D, new BufferedSegment(new TimeSpan(0D, 2D), 40L, null));
        Assertions.assertTrue(tracker.evict(40D).isEmpty());

        properties.setMaxBufferBytes(10L);
        properties.setRetentionSec(0D);
        BufferTracker tight = new BufferTracker(properties);
        tight.observe(1D, new BufferedSegment(new TimeSpan(0D, 2D), 400L, null));
        Assertions.assertTrue(tight.evict(1D).isEmpty());
        Assertions.assertTrue(tight.covers(1D));
    }

    @Test
    void shouldMarkContentEndAndFindSegments() {
        tracker.observe(0D, BufferedSegment.of(0D, 2D));
        tracker.observe(0D, BufferedSegment.of(2D, 4D));

        Assertions.assertEquals(2D, tracker.segmentAt(3.5D).getSpan().getStart(), 0D);
        Assertions.assertNull(tracker.segmentAt(4D));

        tracker.markContentEnd(4D);
        Assertions.assertEquals(4D, tracker.getContentEndSec(), 0D);
        Assertions.assertEquals(BufferHealth.HEALTHY, tracker.health(4D));
    }
}
