package com.flowmable.palette;

/**
 * A representative color produced by k-means quantization.
 *
 * @param rgb        Rounded centroid (integer-valued channels)
 * @param hsl        HSL of {@code rgb}
 * @param hex        Lowercase {@code #rrggbb} encoding of {@code rgb}
 * @param population Number of opaque pixels assigned to the cluster (≥ 1)
 * @param score      Ranking value; equals population at quantization time
 * @param vibrant    Saturation > 0.5 and lightness in (0.3, 0.8)
 * @param dark       Lightness < 0.4
 * @param light      Lightness > 0.7
 */
public record PaletteColor(
        Rgb rgb,
        Hsl hsl,
        String hex,
        int population,
        double score,
        boolean vibrant,
        boolean dark,
        boolean light
) {
    public PaletteColor {
        if (population < 1) {
            throw new IllegalArgumentException("population must be >= 1, got: " + population);
        }
    }

    /**
     * Create a PaletteColor from a centroid and its population,
     * auto-computing hex, HSL and the classification flags.
     */
    public static PaletteColor of(Rgb centroid, int population) {
        Rgb rgb = centroid.rounded();
        Hsl hsl = ColorSpaceUtils.rgbToHsl(rgb);
        boolean vibrant = hsl.s() > 0.5 && hsl.l() > 0.3 && hsl.l() < 0.8;
        boolean dark = hsl.l() < 0.4;
        boolean light = hsl.l() > 0.7;
        return new PaletteColor(rgb, hsl, ColorSpaceUtils.rgbToHex(rgb),
                population, population, vibrant, dark, light);
    }
}
