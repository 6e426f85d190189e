package com.flowmable.palette;

/**
 * Color space conversion utilities.
 * <p>
 * Provides sRGB → HSL conversion, hex encoding and WCAG relative luminance.
 * All functions are pure and total over channel values in [0, 255].
 */
public final class ColorSpaceUtils {

    private ColorSpaceUtils() {}

    /**
     * Encode an RGB color as {@code #rrggbb}.
     * Channels are rounded half-up and clamped to [0, 255].
     */
    public static String rgbToHex(Rgb rgb) {
        return "#" + toHex(rgb.r()) + toHex(rgb.g()) + toHex(rgb.b());
    }

    private static String toHex(double channel) {
        long v = Math.min(255, Math.max(0, Math.round(channel)));
        String hex = Long.toHexString(v);
        return hex.length() == 1 ? "0" + hex : hex;
    }

    /**
     * Convert sRGB (0–255 per channel) to HSL.
     * <p>
     * When two channels share the maximum, the hue is taken from the first
     * of red, green, blue.
     */
    public static Hsl rgbToHsl(Rgb rgb) {
        double r = rgb.r() / 255.0;
        double g = rgb.g() / 255.0;
        double b = rgb.b() / 255.0;

        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double l = (max + min) / 2.0;

        if (max == min) {
            return new Hsl(0.0, 0.0, l);
        }

        double d = max - min;
        double s = l > 0.5 ? d / (2.0 - max - min) : d / (max + min);

        double h;
        if (max == r) {
            h = (g - b) / d + (g < b ? 6.0 : 0.0);
        } else if (max == g) {
            h = (b - r) / d + 2.0;
        } else {
            h = (r - g) / d + 4.0;
        }
        h /= 6.0;

        return new Hsl(h * 360.0, s, l);
    }

    /**
     * Compute relative luminance from sRGB (0–255).
     * Returns value in [0.0, 1.0].
     */
    public static double relativeLuminance(Rgb rgb) {
        return 0.2126 * gammaExpand(rgb.r() / 255.0)
             + 0.7152 * gammaExpand(rgb.g() / 255.0)
             + 0.0722 * gammaExpand(rgb.b() / 255.0);
    }

    private static double gammaExpand(double c) {
        return c <= 0.03928 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }
}
