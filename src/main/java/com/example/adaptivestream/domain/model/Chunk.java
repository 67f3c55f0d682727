package com.example.adaptivestream.domain.model;

/**
 * A byte range of content requested from one provider. Created PENDING by the fetcher and
 * moved exactly once to LOADED, FAILED or ABORTED.
 */
public final class Chunk {

    private final ChunkKey key;
    private final TimeSpan span;
    private final ByteRange byteRange;
    private final QualityTier tier;
    private final String providerName;
    private volatile ChunkStatus status = ChunkStatus.PENDING;
    private volatile byte[] payload;

    public Chunk(ChunkKey key, TimeSpan span, ByteRange byteRange, QualityTier tier, String providerName) {
        this.key = key;
        this.span = span;
        this.byteRange = byteRange;
        this.tier = tier;
        this.providerName = providerName;
    }

    public synchronized boolean markLoaded(byte[] data) {
        if (status != ChunkStatus.PENDING) {
            return false;
        }
        this.payload = data;
        this.status = ChunkStatus.LOADED;
        return true;
    }

    public synchronized boolean markFailed() {
        return transition(ChunkStatus.FAILED);
    }

    public synchronized boolean markAborted() {
        return transition(ChunkStatus.ABORTED);
    }

    private boolean transition(ChunkStatus target) {
        if (status != ChunkStatus.PENDING) {
            return false;
        }
        this.status = target;
        return true;
    }

    public ChunkKey getKey() {
        return key;
    }

    public TimeSpan getSpan() {
        return span;
    }

    public ByteRange getByteRange() {
        return byteRange;
    }

    public QualityTier getTier() {
        return tier;
    }

    public String getProviderName() {
        return providerName;
    }

    public ChunkStatus getStatus() {
        return status;
    }

    /**
     * Null unless LOADED.
     */
    public byte[] getPayload() {
        return payload;
    }

    public long getSize() {
        byte[] data = payload;
        return data == null ? 0L : data.length;
    }

    @Override
    public String toString() {
        return "Chunk{" + key + ", " + span + ", " + status + "}";
    }
}
