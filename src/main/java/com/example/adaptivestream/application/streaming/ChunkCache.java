package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.domain.model.Chunk;
import com.example.adaptivestream.domain.model.ChunkKey;
import java.util.HashMap;
import java.util.Map;

/**
 * Loaded chunks by content address. Entries leave when the buffer evicts their span.
 */
public class ChunkCache {

    private final Map<ChunkKey, Chunk> chunks = new HashMap<>();

    public synchronized void put(Chunk chunk) {
        chunks.put(chunk.getKey(), chunk);
    }

    public synchronized Chunk get(ChunkKey key) {
        return chunks.get(key);
    }

    public synchronized Chunk remove(ChunkKey key) {
        return chunks.remove(key);
    }

    public synchronized void clear() {
        chunks.clear();
    }
}
