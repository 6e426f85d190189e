package com.flowmable.palette;

/**
 * A color in HSL space.
 *
 * @param h Hue in degrees [0, 360)
 * @param s Saturation [0, 1]
 * @param l Lightness [0, 1]
 */
public record Hsl(double h, double s, double l) {}
