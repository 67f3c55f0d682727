package com.example.adaptivestream.domain.model;

/**
 * Frame-analysis feedback from the presentation layer. Complexity and motion are in [0,1].
 */
public final class DecodeCostSignal {

    private final double complexity;
    private final double motion;
    private final double processingTimeMs;
    private final int droppedFrames;

    public DecodeCostSignal(double complexity, double motion, double processingTimeMs, int droppedFrames) {
        this.complexity = clamp(complexity);
        this.motion = clamp(motion);
        this.processingTimeMs = Math.max(0D, processingTimeMs);
        this.droppedFrames = Math.max(0, droppedFrames);
    }

    /**
     * Multiplier in (0,1] applied to the raw bandwidth estimate.
     */
    public double bandwidthFactor() {
        double complexityFactor = 1D - complexity * 0.5D;
        double motionFactor = 1D - motion * 0.3D;
        double processingFactor = processingTimeMs > 0D ? Math.min(60D / processingTimeMs, 1D) : 1D;
        double dropFactor = 1D - Math.min(droppedFrames / 100D, 0.5D);
        return complexityFactor * motionFactor * processingFactor * dropFactor;
    }

    public double getComplexity() {
        return complexity;
    }

    public double getMotion() {
        return motion;
    }

    public double getProcessingTimeMs() {
        return processingTimeMs;
    }

    public int getDroppedFrames() {
        return droppedFrames;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0D;
        }
        return Math.max(0D, Math.min(1D, value));
    }
}
