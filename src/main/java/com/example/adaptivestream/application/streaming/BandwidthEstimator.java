package com.example.adaptivestream.application.streaming;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Exponentially weighted average of the last K throughput samples, newest weighted highest.
 */
public class BandwidthEstimator {

    private final int window;
    private final double alpha;
    private final Deque<Double> samples = new ArrayDeque<>();

    public BandwidthEstimator(int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.window = window;
        this.alpha = 2D / (window + 1D);
    }

    /**
     * Records one completed transfer. Samples without measurable elapsed time are ignored.
     */
    public synchronized void record(long bytes, long elapsedMs) {
        if (bytes <= 0 || elapsedMs <= 0) {
            return;
        }
        samples.addFirst(bytes * 8D * 1000D / elapsedMs);
        while (samples.size() > window) {
            samples.removeLast();
        }
    }

    /**
     * Smoothed estimate in bits per second, 0 with no samples.
     */
    public synchronized double estimateBps() {
        if (samples.isEmpty()) {
            return 0D;
        }
        double weighted = 0D;
        double totalWeight = 0D;
        double weight = alpha;
        Iterator<Double> it = samples.iterator();
        while (it.hasNext()) {
            weighted += it.next() * weight;
            totalWeight += weight;
            weight *= 1D - alpha;
        }
        return weighted / totalWeight;
    }

    public synchronized int sampleCount() {
        return samples.size();
    }

    public synchronized void reset() {
        samples.clear();
    }
}
