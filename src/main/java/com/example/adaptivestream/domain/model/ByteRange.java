package com.example.adaptivestream.domain.model;

import java.util.Objects;

/**
 * Inclusive byte range as used by the HTTP {@code Range} header.
 */
public final class ByteRange {

    private final long first;
    private final long last;

    public ByteRange(long first, long last) {
        if (first < 0 || last < first) {
            throw new IllegalArgumentException("invalid byte range " + first + "-" + last);
        }
        this.first = first;
        this.last = last;
    }

    /**
     * Maps a media-time span to bytes assuming a constant bitrate.
     */
    public static ByteRange forSpan(TimeSpan span, long bitrate) {
        double bytesPerSecond = bitrate / 8.0D;
        long first = (long) Math.floor(span.getStart() * bytesPerSecond);
        long endExclusive = (long) Math.ceil(span.getEnd() * bytesPerSecond);
        return new ByteRange(first, Math.max(first, endExclusive - 1));
    }

    public long getFirst() {
        return first;
    }

    public long getLast() {
        return last;
    }

    public long length() {
        return last - first + 1;
    }

    public String toHeaderValue() {
        return "bytes=" + first + "-" + last;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ByteRange)) {
            return false;
        }
        ByteRange that = (ByteRange) o;
        return first == that.first && last == that.last;
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, last);
    }

    @Override
    public String toString() {
        return first + "-" + last;
    }
}
