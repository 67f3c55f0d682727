package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.common.config.AppBufferProperties;
import com.example.adaptivestream.domain.model.BufferHealth;
import com.example.adaptivestream.domain.model.TimeSpan;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Buffered media time of one content handle, kept as fetched segments and reported as
 * coalesced, disjoint ranges. Not thread-safe; the owning session serializes access.
 */
public class BufferTracker {

    private static final double EPS = TimeSpan.EPSILON;

    private final AppBufferProperties properties;
    private final TreeMap<Double, BufferedSegment> segments = new TreeMap<>();
    private long totalBytes;
    private Double contentEndSec;

    private boolean seeking;
    private long seekStartedAtMs;
    private long stalledSinceMs = -1L;
    private boolean stallSignalled;

    public BufferTracker(AppBufferProperties properties) {
        this.properties = properties;
    }

    /**
     * Merges fetched segments. Of two segments starting at the same time the longer one is
     * kept, then the larger one, so the result does not depend on arrival order or repetition.
     */
    public void observe(double cursor, Collection<BufferedSegment> newSegments) {
        for (BufferedSegment segment : newSegments) {
            Double start = segment.getSpan().getStart();
            BufferedSegment previous = segments.get(start);
            if (previous != null && !supersedes(segment, previous)) {
                continue;
            }
            segments.put(start, segment);
            if (previous != null) {
                totalBytes -= previous.getBytes();
            }
            totalBytes += segment.getBytes();
        }
        if (seeking && containing(cursor) != null) {
            seeking = false;
        }
    }

    public void observe(double cursor, BufferedSegment segment) {
        observe(cursor, Collections.singletonList(segment));
    }

    /**
     * Ordered, disjoint ranges with adjacent and overlapping segments coalesced.
     */
    public List<TimeSpan> ranges() {
        List<TimeSpan> merged = new ArrayList<>();
        TimeSpan current = null;
        for (BufferedSegment segment : segments.values()) {
            TimeSpan span = segment.getSpan();
            if (current == null) {
                current = span;
            } else if (current.touches(span)) {
                current = current.union(span);
            } else {
                merged.add(current);
                current = span;
            }
        }
        if (current != null) {
            merged.add(current);
        }
        return merged;
    }

    /**
     * Seconds of media buffered from the cursor to the end of the range containing it, or of
     * the range starting right at it. Zero otherwise.
     */
    public double bufferAhead(double cursor) {
        TimeSpan range = containing(cursor);
        return range == null ? 0D : Math.max(0D, range.getEnd() - cursor);
    }

    public BufferHealth health(double cursor) {
        TimeSpan range = containing(cursor);
        if (range == null) {
            if (seeking) {
                return BufferHealth.LOW;
            }
            if (isAtContentEnd(cursor)) {
                return BufferHealth.HEALTHY;
            }
            return BufferHealth.STALLED;
        }
        double ahead = range.getEnd() - cursor;
        if (ahead >= properties.getOptimalSec() - EPS || isAtContentEnd(range.getEnd())) {
            return BufferHealth.HEALTHY;
        }
        return BufferHealth.LOW;
    }

    public boolean hasMinimumBuffer(double cursor) {
        TimeSpan range = containing(cursor);
        if (range == null) {
            return false;
        }
        return range.getEnd() - cursor >= properties.getMinimumSec() - EPS || isAtContentEnd(range.getEnd());
    }

    /**
     * True when a requested span still matters for a cursor: it ends after the cursor and
     * starts within the optimal buffer window.
     */
    public boolean leadsCursor(TimeSpan span, double cursor) {
        return span.getEnd() > cursor + EPS && span.getStart() <= cursor + properties.getOptimalSec() + EPS;
    }

    public boolean covers(double cursor) {
        return containing(cursor) != null;
    }

    public void beginSeek(long nowMs) {
        seeking = true;
        seekStartedAtMs = nowMs;
        stalledSinceMs = -1L;
        stallSignalled = false;
    }

    /**
     * Ends the active seek once the cursor has data or the seek grace period has passed.
     */
    public void updateSeek(double cursor, long nowMs) {
        if (!seeking) {
            return;
        }
        if (containing(cursor) != null || nowMs - seekStartedAtMs >= properties.effectiveSeekGraceMs()) {
            seeking = false;
        }
    }

    public boolean isSeeking() {
        return seeking;
    }

    /**
     * True exactly once per stall episode, when the cursor has been without data for the stall
     * timeout. The episode ends as soon as health is anything but STALLED.
     */
    public boolean pollStallSignal(double cursor, long nowMs) {
        if (health(cursor) != BufferHealth.STALLED) {
            stalledSinceMs = -1L;
            stallSignalled = false;
            return false;
        }
        if (stalledSinceMs < 0) {
            stalledSinceMs = nowMs;
        }
        if (!stallSignalled && nowMs - stalledSinceMs >= properties.getStallTimeoutMs()) {
            stallSignalled = true;
            return true;
        }
        return false;
    }

    /**
     * Next span to fetch after the buffer edge, counting outstanding requests as buffered.
     * Empty when the outstanding budget is used up, the buffer already reaches the optimal
     * level, or the content end is reached. Span ends are aligned to the segment grid.
     */
    public Optional<TimeSpan> needsFetch(double cursor, List<TimeSpan> outstanding, int outstandingLimit) {
        if (outstanding.size() >= outstandingLimit) {
            return Optional.empty();
        }
        List<TimeSpan> covered = new ArrayList<>(outstanding);
        covered.addAll(ranges());
        Collections.sort(covered);
        double edge = cursor;
        boolean advanced = true;
        while (advanced) {
            advanced = false;
            for (TimeSpan span : covered) {
                if (span.getStart() <= edge + EPS && span.getEnd() > edge + EPS) {
                    edge = span.getEnd();
                    advanced = true;
                }
            }
        }
        if (isAtContentEnd(edge)) {
            return Optional.empty();
        }
        if (edge - cursor >= properties.getOptimalSec() - EPS) {
            return Optional.empty();
        }
        double segment = properties.getSegmentDurationSec();
        double end = (Math.floor(edge / segment + EPS) + 1D) * segment;
        if (contentEndSec != null) {
            end = Math.min(end, contentEndSec);
        }
        if (end - edge <= EPS) {
            return Optional.empty();
        }
        return Optional.of(new TimeSpan(edge, end));
    }

    /**
     * Drops segments lying entirely behind the retention window, lowest start first, until the
     * buffer fits its byte budget. The segment under the cursor is never dropped.
     *
     * @return the dropped segments, so their chunks can be released
     */
    public List<BufferedSegment> evict(double cursor) {
        if (totalBytes <= properties.getMaxBufferBytes()) {
            return Collections.emptyList();
        }
        double retainFrom = cursor - properties.getRetentionSec();
        List<BufferedSegment> evicted = new ArrayList<>();
        Iterator<Map.Entry<Double, BufferedSegment>> it = segments.entrySet().iterator();
        while (it.hasNext() && totalBytes > properties.getMaxBufferBytes()) {
            BufferedSegment segment = it.next().getValue();
            TimeSpan span = segment.getSpan();
            if (span.getEnd() > retainFrom + EPS || span.contains(cursor)) {
                break;
            }
            it.remove();
            totalBytes -= segment.getBytes();
            evicted.add(segment);
        }
        return evicted;
    }

    public BufferedSegment segmentAt(double position) {
        for (BufferedSegment segment : segments.headMap(position + EPS, true).descendingMap().values()) {
            if (segment.getSpan().contains(position)) {
                return segment;
            }
        }
        return null;
    }

    public void setContentDuration(Double durationSec) {
        this.contentEndSec = durationSec != null && durationSec > 0 ? durationSec : null;
    }

    /**
     * Records that no media exists at or after the position.
     */
    public void markContentEnd(double positionSec) {
        if (contentEndSec == null || positionSec < contentEndSec) {
            contentEndSec = Math.max(0D, positionSec);
        }
    }

    public Double getContentEndSec() {
        return contentEndSec;
    }

    public long totalBytes() {
        return totalBytes;
    }

    public void reset() {
        segments.clear();
        totalBytes = 0L;
        contentEndSec = null;
        seeking = false;
        stalledSinceMs = -1L;
        stallSignalled = false;
    }

    private static boolean supersedes(BufferedSegment candidate, BufferedSegment existing) {
        int byEnd = Double.compare(candidate.getSpan().getEnd(), existing.getSpan().getEnd());
        if (byEnd != 0) {
            return byEnd > 0;
        }
        return candidate.getBytes() > existing.getBytes();
    }

    private boolean isAtContentEnd(double position) {
        return contentEndSec != null && position >= contentEndSec - EPS;
    }

    private TimeSpan containing(double cursor) {
        for (TimeSpan range : ranges()) {
            if (range.contains(cursor)) {
                return range;
            }
            if (range.getStart() > cursor + EPS) {
                break;
            }
        }
        return null;
    }
}
