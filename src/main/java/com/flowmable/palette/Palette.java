package com.flowmable.palette;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Labeled palette extracted from one image.
 * <p>
 * Role fields reference entries of {@code allColors} (same instances).
 * Read-only after construction.
 *
 * @param dominant     Highest-population color (never null)
 * @param vibrant      Most vibrant color, or a fallback; never null when built by {@link PaletteClassifier}
 * @param muted        Muted color, or null
 * @param darkVibrant  Dark vibrant color, or null
 * @param lightVibrant Light vibrant color, or null
 * @param allColors    Every cluster, sorted by population descending
 */
public record Palette(
        PaletteColor dominant,
        PaletteColor vibrant,
        PaletteColor muted,
        PaletteColor darkVibrant,
        PaletteColor lightVibrant,
        List<PaletteColor> allColors
) {
    public Palette {
        Objects.requireNonNull(dominant, "dominant");
        allColors = List.copyOf(allColors);
        if (allColors.isEmpty()) {
            throw new IllegalArgumentException("allColors must not be empty");
        }
    }

    /**
     * Non-null roles in declaration order of {@link PaletteRole}.
     */
    public Map<PaletteRole, PaletteColor> roles() {
        Map<PaletteRole, PaletteColor> roles = new LinkedHashMap<>();
        roles.put(PaletteRole.DOMINANT, dominant);
        if (vibrant != null) roles.put(PaletteRole.VIBRANT, vibrant);
        if (muted != null) roles.put(PaletteRole.MUTED, muted);
        if (darkVibrant != null) roles.put(PaletteRole.DARK_VIBRANT, darkVibrant);
        if (lightVibrant != null) roles.put(PaletteRole.LIGHT_VIBRANT, lightVibrant);
        return roles;
    }

    /**
     * Fraction of all clustered pixels represented by {@code color}. Range [0, 1].
     */
    public double populationShare(PaletteColor color) {
        long total = 0;
        for (PaletteColor c : allColors) {
            total += c.population();
        }
        return (double) color.population() / total;
    }
}
