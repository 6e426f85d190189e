package com.flowmable.palette;

import java.util.Random;

/**
 * Source of pixel indices for centroid initialization.
 * Tests inject fixed sequences to make clustering reproducible.
 */
@FunctionalInterface
public interface PixelSampler {

    /**
     * @param pixelCount number of pixels in the buffer (≥ 1)
     * @return an index in [0, pixelCount)
     */
    int nextIndex(int pixelCount);

    /**
     * Uniform sampling with replacement backed by {@code random}.
     */
    static PixelSampler uniform(Random random) {
        return random::nextInt;
    }
}
