package com.flowmable.palette;

import java.time.Duration;

/**
 * Palette plus the bookkeeping of the extraction that produced it.
 *
 * @param palette    Extracted palette
 * @param pixelCount Number of pixels quantized (after downsampling)
 * @param elapsed    Wall-clock time spent downsampling, quantizing and classifying
 */
public record ExtractionResult(
        Palette palette,
        int pixelCount,
        Duration elapsed
) {}
