package com.flowmable.palette;

import java.util.List;
import java.util.Objects;

/**
 * Assigns semantic roles to quantized colors.
 * <p>
 * Each role is evaluated independently over every candidate, dominant included.
 * Vibrant ranks by saturation weighted with the population ratio to the dominant
 * color; the other roles keep the most populated eligible color. Ties keep the
 * first color seen, so the result is deterministic for a given input order.
 */
public class PaletteClassifier {

    private final ClassificationThresholds thresholds;

    public PaletteClassifier() {
        this(ClassificationThresholds.DEFAULT);
    }

    public PaletteClassifier(ClassificationThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    /**
     * Build a palette from colors sorted by population descending.
     *
     * @param colors Output of {@link KMeansQuantizer#quantize}
     * @return Palette whose role fields alias entries of {@code colors}
     * @throws PaletteUnavailableException if {@code colors} is empty
     */
    public Palette classify(List<PaletteColor> colors) throws PaletteUnavailableException {
        if (colors.isEmpty()) {
            throw new PaletteUnavailableException("No colors to classify: image has no opaque pixels");
        }

        PaletteColor dominant = colors.get(0);
        double dominantPopulation = dominant.population() == 0 ? 1 : dominant.population();

        PaletteColor vibrant = null;
        double maxVibrantScore = -1;
        PaletteColor darkVibrant = null;
        PaletteColor lightVibrant = null;
        PaletteColor muted = null;

        for (PaletteColor c : colors) {
            double sat = c.hsl().s();
            double lum = c.hsl().l();
            double popRatio = c.population() / dominantPopulation;

            if (isVibrantCandidate(sat, lum)) {
                double score = sat * (1 + popRatio * thresholds.vibrantPopulationWeight());
                if (score > maxVibrantScore) {
                    maxVibrantScore = score;
                    vibrant = c;
                }
            }

            if (lum < thresholds.darkMaxLightness() && sat > thresholds.accentMinSaturation()) {
                darkVibrant = morePopulated(darkVibrant, c);
            }

            if (lum > thresholds.lightMinLightness() && sat > thresholds.accentMinSaturation()) {
                lightVibrant = morePopulated(lightVibrant, c);
            }

            if (sat < thresholds.mutedMaxSaturation()
                    && lum > thresholds.mutedMinLightness() && lum < thresholds.mutedMaxLightness()) {
                muted = morePopulated(muted, c);
            }
        }

        if (vibrant == null) {
            if (dominant.vibrant()) {
                vibrant = dominant;
            } else {
                vibrant = colors.size() > 1 ? colors.get(1) : dominant;
            }
        }

        return new Palette(dominant, vibrant, muted, darkVibrant, lightVibrant, colors);
    }

    private boolean isVibrantCandidate(double sat, double lum) {
        return sat > thresholds.vibrantMinSaturation() && sat <= 1.0
                && lum > thresholds.vibrantMinLightness() && lum < thresholds.vibrantMaxLightness();
    }

    private static PaletteColor morePopulated(PaletteColor current, PaletteColor candidate) {
        if (current == null || candidate.population() > current.population()) {
            return candidate;
        }
        return current;
    }
}
