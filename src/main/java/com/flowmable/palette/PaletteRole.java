package com.flowmable.palette;

/**
 * Semantic roles a palette color can be assigned to.
 */
public enum PaletteRole {
    /** Highest-population cluster. Always present. */
    DOMINANT,
    /** Saturated, mid-lightness color weighted by population. */
    VIBRANT,
    /** Low-saturation, mid-lightness color. */
    MUTED,
    /** Dark color with some saturation. */
    DARK_VIBRANT,
    /** Light color with some saturation. */
    LIGHT_VIBRANT
}
