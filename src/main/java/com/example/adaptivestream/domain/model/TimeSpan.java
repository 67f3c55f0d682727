package com.example.adaptivestream.domain.model;

import java.util.Objects;

/**
 * Half-open interval of media time in seconds: [start, end). Equality is exact; the
 * {@link #EPSILON} tolerance applies only to containment and coalescing.
 */
public final class TimeSpan implements Comparable<TimeSpan> {

    public static final double EPSILON = 1e-6D;

    private final double start;
    private final double end;

    public TimeSpan(double start, double end) {
        if (Double.isNaN(start) || Double.isNaN(end) || end < start) {
            throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public double getStart() {
        return start;
    }

    public double getEnd() {
        return end;
    }

    public double length() {
        return end - start;
    }

    public boolean contains(double position) {
        return position >= start - EPSILON && position < end - EPSILON;
    }

    /**
     * True when the two spans overlap or touch, i.e. can be coalesced into one.
     */
    public boolean touches(TimeSpan other) {
        return other.start <= end + EPSILON && start <= other.end + EPSILON;
    }

    public TimeSpan union(TimeSpan other) {
        return new TimeSpan(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public int compareTo(TimeSpan other) {
        int byStart = Double.compare(start, other.start);
        return byStart != 0 ? byStart : Double.compare(end, other.end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeSpan)) {
            return false;
        }
        TimeSpan that = (TimeSpan) o;
        return Double.compare(start, that.start) == 0 && Double.compare(end, that.end) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
