package com.flowmable.palette;

/**
 * An sRGB color with channels nominally in [0, 255].
 * <p>
 * Components may be fractional while they hold a k-means centroid.
 *
 * @param r Red channel
 * @param g Green channel
 * @param b Blue channel
 */
public record Rgb(double r, double g, double b) {

    /**
     * Round each channel half-up to the nearest integer.
     */
    public Rgb rounded() {
        return new Rgb(Math.round(r), Math.round(g), Math.round(b));
    }
}
