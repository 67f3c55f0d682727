package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.domain.model.ChunkKey;
import com.example.adaptivestream.domain.model.TimeSpan;

/**
 * A fetched span of media time and the chunk holding its bytes.
 */
public final class BufferedSegment {

    private final TimeSpan span;
    private final long bytes;
    private final ChunkKey chunkKey;

    public BufferedSegment(TimeSpan span, long bytes, ChunkKey chunkKey) {
        this.span = span;
        this.bytes = Math.max(0L, bytes);
        this.chunkKey = chunkKey;
    }

    public static BufferedSegment of(double start, double end) {
        return new BufferedSegment(new TimeSpan(start, end), 0L, null);
    }

    public TimeSpan getSpan() {
        return span;
    }

    public long getBytes() {
        return bytes;
    }

    /**
     * Null for segments observed without a backing chunk.
     */
    public ChunkKey getChunkKey() {
        return chunkKey;
    }

    @Override
    public String toString() {
        return span + "(" + bytes + "B)";
    }
}
