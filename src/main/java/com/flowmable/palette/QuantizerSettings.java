package com.flowmable.palette;

/**
 * K-means quantization parameters.
 *
 * @param clusterCount   Default number of clusters (k) when none is given per call
 * @param iterations     Fixed number of refinement passes; there is no convergence check
 * @param alphaThreshold Pixels with alpha below this value are ignored
 */
public record QuantizerSettings(
        int clusterCount,
        int iterations,
        int alphaThreshold
) {
    public static final QuantizerSettings DEFAULT = new QuantizerSettings(
            8,   // clusterCount
            5,   // iterations
            128  // alphaThreshold
    );

    public QuantizerSettings {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be >= 1, got: " + iterations);
        }
        if (alphaThreshold < 0 || alphaThreshold > 256) {
            throw new IllegalArgumentException("alphaThreshold must be in [0, 256], got: " + alphaThreshold);
        }
    }

    public QuantizerSettings withClusterCount(int k) {
        return new QuantizerSettings(k, iterations, alphaThreshold);
    }
}
